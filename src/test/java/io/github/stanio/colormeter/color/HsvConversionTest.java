/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.colormeter.color;

import static org.assertj.core.api.Assertions.assertThat;

import java.awt.image.BufferedImage;

import org.junit.jupiter.api.Test;

public class HsvConversionTest {

    @Test
    void primaries() {
        assertThat(HsvConversion.rgbToHsv(255, 0, 0)).as("red").containsExactly(0, 255, 255);
        assertThat(HsvConversion.rgbToHsv(0, 255, 0)).as("green").containsExactly(60, 255, 255);
        assertThat(HsvConversion.rgbToHsv(0, 0, 255)).as("blue").containsExactly(120, 255, 255);
    }

    @Test
    void secondaries() {
        assertThat(HsvConversion.rgbToHsv(255, 255, 0)).as("yellow").containsExactly(30, 255, 255);
        assertThat(HsvConversion.rgbToHsv(0, 255, 255)).as("cyan").containsExactly(90, 255, 255);
        assertThat(HsvConversion.rgbToHsv(255, 0, 255)).as("magenta").containsExactly(150, 255, 255);
    }

    @Test
    void achromatic() {
        assertThat(HsvConversion.rgbToHsv(255, 255, 255)).as("white").containsExactly(0, 0, 255);
        assertThat(HsvConversion.rgbToHsv(0, 0, 0)).as("black").containsExactly(0, 0, 0);
        assertThat(HsvConversion.rgbToHsv(128, 128, 128)).as("gray").containsExactly(0, 0, 128);
    }

    @Test
    void darkerShades() {
        assertThat(HsvConversion.rgbToHsv(128, 0, 0)).as("maroon").containsExactly(0, 255, 128);
        assertThat(HsvConversion.rgbToHsv(255, 128, 128)).as("light red").containsExactly(0, 127, 255);
    }

    @Test
    void hueWrapsBelowRed() {
        // Slightly blue-ish red: negative sextant offset wraps to the top of the range
        int[] hsv = HsvConversion.rgbToHsv(255, 0, 40);
        assertThat(hsv[0]).as("hue").isEqualTo(175);
    }

    @Test
    void resultRanges() {
        for (int r = 0; r < 256; r += 15) {
            for (int g = 0; g < 256; g += 15) {
                for (int b = 0; b < 256; b += 15) {
                    int[] hsv = HsvConversion.rgbToHsv(r, g, b);
                    assertThat(hsv[0]).as("hue of (%d, %d, %d)", r, g, b).isBetween(0, 179);
                    assertThat(hsv[1]).as("saturation of (%d, %d, %d)", r, g, b).isBetween(0, 255);
                    assertThat(hsv[2]).as("value of (%d, %d, %d)", r, g, b)
                                      .isEqualTo(Math.max(r, Math.max(g, b)));
                }
            }
        }
    }

    @Test
    void convertBuffer() {
        BufferedImage image = new BufferedImage(2, 1, BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, 0x00FF00);
        image.setRGB(1, 0, 0xFFFFFF);

        HsvBuffer hsv = HsvConversion.convert(ColorBuffer.of(image, ChannelOrder.BGR));

        assertThat(hsv.width()).as("width").isEqualTo(2);
        assertThat(hsv.height()).as("height").isEqualTo(1);
        assertThat(hsv.hsv(0, 0)).as("green pixel").containsExactly(60, 255, 255);
        assertThat(hsv.hsv(1, 0)).as("white pixel").containsExactly(0, 0, 255);
    }

}
