/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.colormeter.awt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.awt.Dimension;
import java.awt.image.BufferedImage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

public class ResamplingTest {

    private static BufferedImage filled(int width, int height, int rgb) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.setRGB(x, y, rgb);
            }
        }
        return image;
    }

    @Test
    void halfSizeTruncates() {
        assertThat(Resampling.scaledSize(4, 4, 0.5)).isEqualTo(new Dimension(2, 2));
        assertThat(Resampling.scaledSize(7, 5, 0.5)).isEqualTo(new Dimension(3, 2));
        assertThat(Resampling.scaledSize(1001, 3, 0.5)).isEqualTo(new Dimension(500, 1));
    }

    @Test
    void scaledSizeAtLeastOnePixel() {
        assertThat(Resampling.scaledSize(1, 1, 0.5)).isEqualTo(new Dimension(1, 1));
        assertThat(Resampling.scaledSize(10, 1, 0.5)).isEqualTo(new Dimension(5, 1));
    }

    @Test
    void scaleOutOfRange() {
        assertThatThrownBy(() -> Resampling.scaledSize(4, 4, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Resampling.scaledSize(4, 4, 1.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Resampling.scaledSize(4, 4, Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @EnumSource(ResampleFilter.class)
    void targetDimensions(ResampleFilter filter) {
        BufferedImage result = Resampling.resize(filled(37, 20, 0x336699), 18, 10, filter);

        assertThat(result.getWidth()).as("width").isEqualTo(18);
        assertThat(result.getHeight()).as("height").isEqualTo(10);
    }

    @ParameterizedTest
    @EnumSource(ResampleFilter.class)
    void uniformColorPreserved(ResampleFilter filter) {
        BufferedImage result = Resampling.resize(filled(4, 4, 0xFF0000), 2, 2, filter);

        for (int y = 0; y < 2; y++) {
            for (int x = 0; x < 2; x++) {
                assertThat(result.getRGB(x, y) & 0xFFFFFF)
                        .as("pixel (%d, %d)", x, y).isEqualTo(0xFF0000);
            }
        }
    }

    @Test
    void lanczosAveragesCheckerboard() {
        BufferedImage source = new BufferedImage(16, 16, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < 16; y++) {
            for (int x = 0; x < 16; x++) {
                source.setRGB(x, y, ((x + y) % 2 == 0) ? 0xFFFFFF : 0x000000);
            }
        }

        BufferedImage result = Resampling.resize(source, 8, 8, ResampleFilter.LANCZOS);

        int gray = result.getRGB(4, 4) & 0xFF;
        assertThat(gray).as("center pixel").isCloseTo(128, within(16));
    }

    @Test
    void lanczosKernel() {
        assertThat(LanczosResampler.kernel(0)).isEqualTo(1.0);
        assertThat(LanczosResampler.kernel(1)).isCloseTo(0.0, within(1e-9));
        assertThat(LanczosResampler.kernel(-2)).isCloseTo(0.0, within(1e-9));
        assertThat(LanczosResampler.kernel(3)).isEqualTo(0.0);
        assertThat(LanczosResampler.kernel(0.5)).isGreaterThan(0.5);
        assertThat(LanczosResampler.kernel(1.5)).isNegative();
    }

    @Test
    void targetLargerThanSource() {
        assertThatThrownBy(() -> Resampling.resize(filled(2, 2, 0), 3, 2, ResampleFilter.LANCZOS))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Invalid target size");
    }

    @Test
    void filterForName() {
        assertThat(ResampleFilter.forName(" lanczos ")).isSameAs(ResampleFilter.LANCZOS);
        assertThat(ResampleFilter.forName("Bicubic")).isSameAs(ResampleFilter.BICUBIC);
        assertThatThrownBy(() -> ResampleFilter.forName("nearest"))
                .isInstanceOf(IllegalArgumentException.class);
    }

}
