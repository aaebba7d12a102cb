/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.colormeter.color;

/**
 * 8-bit RGB to HSV conversion.
 * <p>
 * Produces hue in {@code [0, 180)} (half-degree units, so the full circle
 * fits a byte), saturation and value in {@code [0, 255]}.  Divisions go
 * through 12-bit fixed-point reciprocal tables with round-half-up, which
 * gives the same bytes as the common image-processing libraries do for
 * their 8-bit HSV mode.</p>
 *
 * @see  <a href="https://en.wikipedia.org/wiki/HSL_and_HSV#From_RGB"
 *              >HSL and HSV: From RGB</a>
 */
public final class HsvConversion {

    /** Exclusive upper bound of the 8-bit hue. */
    public static final int HUE_RANGE = 180;

    private static final int SHIFT = 12;
    private static final int ROUND = 1 << (SHIFT - 1);

    private static final int[] saturationDiv = new int[256];
    private static final int[] hueDiv = new int[256];
    static {
        for (int i = 1; i < 256; i++) {
            saturationDiv[i] = (int) Math.rint((255 << SHIFT) / (double) i);
            hueDiv[i] = (int) Math.rint((HUE_RANGE << SHIFT) / (6.0 * i));
        }
    }

    private HsvConversion() {/* no instances */}

    /**
     * Converts a single pixel.
     *
     * @param   red    {@code [0, 255]}
     * @param   green  {@code [0, 255]}
     * @param   blue   {@code [0, 255]}
     * @return  {@code [hue, saturation, value]}
     */
    public static int[] rgbToHsv(int red, int green, int blue) {
        int[] hsv = new int[3];
        rgbToHsv(red, green, blue, hsv);
        return hsv;
    }

    private static void rgbToHsv(int r, int g, int b, int[] hsv) {
        int v = Math.max(r, Math.max(g, b));
        int min = Math.min(r, Math.min(g, b));
        int diff = v - min;

        int s = (diff * saturationDiv[v] + ROUND) >> SHIFT;

        // Sextant offset in units of diff: red 0, green 2, blue 4
        int h;
        if (v == r) {
            h = g - b;
        } else if (v == g) {
            h = b - r + 2 * diff;
        } else {
            h = r - g + 4 * diff;
        }
        h = (h * hueDiv[diff] + ROUND) >> SHIFT;
        if (h < 0) {
            h += HUE_RANGE;
        }

        hsv[HsvBuffer.HUE] = h;
        hsv[HsvBuffer.SATURATION] = s;
        hsv[HsvBuffer.VALUE] = v;
    }

    /**
     * Converts every pixel of the given color buffer.
     *
     * @param   colors  the source pixels, in any channel order
     * @return  a new HSV buffer of the same size
     */
    public static HsvBuffer convert(ColorBuffer colors) {
        int width = colors.width();
        int height = colors.height();
        HsvBuffer target = new HsvBuffer(width, height);
        int[] hsv = new int[3];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                rgbToHsv(colors.red(x, y), colors.green(x, y), colors.blue(x, y), hsv);
                target.setSample(x, y, HsvBuffer.HUE, hsv[HsvBuffer.HUE]);
                target.setSample(x, y, HsvBuffer.SATURATION, hsv[HsvBuffer.SATURATION]);
                target.setSample(x, y, HsvBuffer.VALUE, hsv[HsvBuffer.VALUE]);
            }
        }
        return target;
    }

}
