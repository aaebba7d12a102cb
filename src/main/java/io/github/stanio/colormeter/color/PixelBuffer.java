/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.colormeter.color;

import java.util.Objects;

/**
 * Three 8-bit samples per pixel, row-major, no padding.  What the samples
 * mean is up to the subclass.
 */
public abstract class PixelBuffer {

    static final int SAMPLES_PER_PIXEL = 3;

    private final int width;
    private final int height;

    final byte[] data;

    PixelBuffer(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Non-positive buffer size: "
                                               + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.data = new byte[Math.multiplyExact(width * SAMPLES_PER_PIXEL, height)];
    }

    public final int width() {
        return width;
    }

    public final int height() {
        return height;
    }

    /**
     * Tests whether the given coordinates address a pixel of this buffer.
     * Both bounds are checked.
     *
     * @param   x  column
     * @param   y  row
     * @return  {@code true} if {@code 0 <= x < width} and {@code 0 <= y < height}
     */
    public final boolean contains(int x, int y) {
        return x >= 0 && y >= 0 && x < width && y < height;
    }

    public final boolean sameSize(PixelBuffer other) {
        return width == other.width && height == other.height;
    }

    /**
     * {@return the unsigned sample value at the given pixel and channel index}
     *
     * @throws  IndexOutOfBoundsException  if the coordinates are outside
     *          the buffer or {@code channel} is not in {@code [0, 3)}
     */
    public final int sample(int x, int y, int channel) {
        return data[offset(x, y, channel)] & 0xFF;
    }

    final void setSample(int x, int y, int channel, int value) {
        data[offset(x, y, channel)] = (byte) value;
    }

    final int offset(int x, int y, int channel) {
        Objects.checkIndex(x, width);
        Objects.checkIndex(y, height);
        Objects.checkIndex(channel, SAMPLES_PER_PIXEL);
        return (y * width + x) * SAMPLES_PER_PIXEL + channel;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + width + "x" + height + ")";
    }

}
