/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.colormeter.color;

/**
 * 8-bit HSV samples: hue in {@code [0, 179]} (two degrees per unit),
 * saturation and value in {@code [0, 255]}.
 *
 * @see  HsvConversion
 */
public final class HsvBuffer extends PixelBuffer {

    static final int HUE = 0;
    static final int SATURATION = 1;
    static final int VALUE = 2;

    HsvBuffer(int width, int height) {
        super(width, height);
    }

    public int hue(int x, int y) {
        return sample(x, y, HUE);
    }

    public int saturation(int x, int y) {
        return sample(x, y, SATURATION);
    }

    public int value(int x, int y) {
        return sample(x, y, VALUE);
    }

    /**
     * {@return the pixel as {@code [hue, saturation, value]}}
     */
    public int[] hsv(int x, int y) {
        return new int[] { hue(x, y), saturation(x, y), value(x, y) };
    }

}
