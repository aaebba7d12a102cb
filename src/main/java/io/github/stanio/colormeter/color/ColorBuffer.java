/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.colormeter.color;

import java.awt.image.BufferedImage;

/**
 * 8-bit-per-channel color samples in a given {@code ChannelOrder}.  Alpha
 * is not kept.
 */
public final class ColorBuffer extends PixelBuffer {

    private final ChannelOrder order;

    ColorBuffer(int width, int height, ChannelOrder order) {
        super(width, height);
        this.order = order;
    }

    /**
     * Copies the pixels of the given image.  Pixels are read in the default
     * sRGB color model, and any alpha is dropped without compositing.
     *
     * @param   image  the source image
     * @param   order  channel order of the returned buffer
     * @return  a new buffer of the same size as the image
     * @see     BufferedImage#getRGB(int, int, int, int, int[], int, int)
     */
    public static ColorBuffer of(BufferedImage image, ChannelOrder order) {
        int width = image.getWidth();
        int height = image.getHeight();
        ColorBuffer buffer = new ColorBuffer(width, height, order);
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            image.getRGB(0, y, width, 1, row, 0, width);
            for (int x = 0; x < width; x++) {
                int argb = row[x];
                buffer.setSample(x, y, order.red, (argb >> 16) & 0xFF);
                buffer.setSample(x, y, order.green, (argb >> 8) & 0xFF);
                buffer.setSample(x, y, order.blue, argb & 0xFF);
            }
        }
        return buffer;
    }

    public ChannelOrder order() {
        return order;
    }

    public int red(int x, int y) {
        return sample(x, y, order.red);
    }

    public int green(int x, int y) {
        return sample(x, y, order.green);
    }

    public int blue(int x, int y) {
        return sample(x, y, order.blue);
    }

    /**
     * {@return the pixel as {@code [red, green, blue]}, regardless of the
     * storage order}
     */
    public int[] rgb(int x, int y) {
        return new int[] { red(x, y), green(x, y), blue(x, y) };
    }

    @Override
    public String toString() {
        return "ColorBuffer(" + width() + "x" + height() + ", " + order + ")";
    }

}
