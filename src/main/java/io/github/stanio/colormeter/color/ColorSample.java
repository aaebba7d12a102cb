/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.colormeter.color;

import java.util.Arrays;

/**
 * Color values read from a single pixel.
 *
 * @param   x  column of the sampled pixel
 * @param   y  row of the sampled pixel
 * @param   rgb  {@code [red, green, blue]}, each {@code [0, 255]}
 * @param   hsv  8-bit {@code [hue, saturation, value]} as stored
 */
public record ColorSample(int x, int y, int[] rgb, int[] hsv) {

    public ColorSample {
        if (rgb.length != 3 || hsv.length != 3)
            throw new IllegalArgumentException("Three channels expected");

        rgb = rgb.clone();
        hsv = hsv.clone();
    }

    /**
     * Reads the pixel at the given coordinates of both buffers.
     *
     * @throws  IllegalArgumentException  if the buffers differ in size
     * @throws  IndexOutOfBoundsException  if the coordinates are outside
     *          the buffers
     */
    public static ColorSample of(ColorBuffer colors, HsvBuffer hsv, int x, int y) {
        if (!colors.sameSize(hsv)) {
            throw new IllegalArgumentException("Buffer size mismatch: "
                                               + colors + " vs. " + hsv);
        }
        return new ColorSample(x, y, colors.rgb(x, y), hsv.hsv(x, y));
    }

    @Override
    public int[] rgb() {
        return rgb.clone();
    }

    @Override
    public int[] hsv() {
        return hsv.clone();
    }

    /**
     * {@return the hue in degrees, {@code [0, 358]}}
     */
    public int hueDegrees() {
        return hsv[HsvBuffer.HUE] * 2;
    }

    /**
     * {@return the saturation in percent, rounded, {@code [0, 100]}}
     */
    public int saturationPercent() {
        return percent(hsv[HsvBuffer.SATURATION]);
    }

    /**
     * {@return the value in percent, rounded, {@code [0, 100]}}
     */
    public int valuePercent() {
        return percent(hsv[HsvBuffer.VALUE]);
    }

    private static int percent(int byteValue) {
        return (int) Math.round(byteValue / 255.0 * 100);
    }

    public String rgbText() {
        return "RGB: (" + rgb[0] + ", " + rgb[1] + ", " + rgb[2] + ")";
    }

    public String rawHsvText() {
        return "8-bit HSV: (" + hsv[0] + ", " + hsv[1] + ", " + hsv[2] + ")";
    }

    public String hsvText() {
        return "HSV: (" + hueDegrees() + ", "
                + saturationPercent() + ", " + valuePercent() + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof ColorSample))
            return false;

        ColorSample other = (ColorSample) obj;
        return x == other.x && y == other.y
                && Arrays.equals(rgb, other.rgb)
                && Arrays.equals(hsv, other.hsv);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * (31 * x + y) + Arrays.hashCode(rgb))
                + Arrays.hashCode(hsv);
    }

    @Override
    public String toString() {
        return "ColorSample(x=" + x + ", y=" + y + ", "
                + rgbText() + ", " + rawHsvText() + ")";
    }

}
