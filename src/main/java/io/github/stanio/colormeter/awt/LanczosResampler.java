/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.colormeter.awt;

import java.awt.image.BufferedImage;

/**
 * Two-pass (horizontal, then vertical) convolution resampling with
 * a Lanczos-3 kernel.  When downscaling, the kernel is widened by the scale
 * ratio so every source pixel contributes.  Works on opaque 8-bit RGB; any
 * alpha of the source is ignored.
 *
 * @see  <a href="https://en.wikipedia.org/wiki/Lanczos_resampling">Lanczos resampling</a>
 */
final class LanczosResampler {

    private static final double LOBES = 3.0;

    private LanczosResampler() {/* no instances */}

    static double kernel(double x) {
        if (x == 0.0)
            return 1.0;

        if (x <= -LOBES || x >= LOBES)
            return 0.0;

        double px = Math.PI * x;
        return LOBES * Math.sin(px) * Math.sin(px / LOBES) / (px * px);
    }

    static BufferedImage resize(BufferedImage source, int targetWidth, int targetHeight) {
        int sourceWidth = source.getWidth();
        int sourceHeight = source.getHeight();
        int[] pixels = source.getRGB(0, 0, sourceWidth, sourceHeight, null, 0, sourceWidth);

        // Planar float channels, row-major
        float[][] channels = new float[3][sourceWidth * sourceHeight];
        for (int i = 0; i < pixels.length; i++) {
            int rgb = pixels[i];
            channels[0][i] = (rgb >> 16) & 0xFF;
            channels[1][i] = (rgb >> 8) & 0xFF;
            channels[2][i] = rgb & 0xFF;
        }

        Contributions horizontal = new Contributions(sourceWidth, targetWidth);
        Contributions vertical = new Contributions(sourceHeight, targetHeight);

        int[] target = new int[targetWidth * targetHeight];
        float[] temp = new float[targetWidth * sourceHeight];
        for (int c = 0; c < 3; c++) {
            float[] plane = channels[c];
            for (int y = 0; y < sourceHeight; y++) {
                int row = y * sourceWidth;
                for (int x = 0; x < targetWidth; x++) {
                    temp[y * targetWidth + x] = horizontal.apply(x, plane, row, 1);
                }
            }
            int shift = 16 - 8 * c;
            for (int x = 0; x < targetWidth; x++) {
                for (int y = 0; y < targetHeight; y++) {
                    float value = vertical.apply(y, temp, x, targetWidth);
                    target[y * targetWidth + x] |= clamp(value) << shift;
                }
            }
        }

        BufferedImage scaled = new BufferedImage(targetWidth,
                targetHeight, BufferedImage.TYPE_INT_RGB);
        scaled.setRGB(0, 0, targetWidth, targetHeight, target, 0, targetWidth);
        return scaled;
    }

    private static int clamp(float value) {
        int rounded = Math.round(value);
        return rounded < 0 ? 0 : (rounded > 255 ? 255 : rounded);
    }


    /**
     * Normalized kernel weights for each target position along one axis.
     */
    private static final class Contributions {

        final int[] start;
        final float[][] weights;

        Contributions(int sourceSize, int targetSize) {
            double scale = (double) sourceSize / targetSize;
            double filterScale = Math.max(scale, 1.0);
            double support = LOBES * filterScale;

            start = new int[targetSize];
            weights = new float[targetSize][];
            for (int i = 0; i < targetSize; i++) {
                double center = (i + 0.5) * scale;
                int min = Math.max(0, (int) (center - support + 0.5));
                int max = Math.min(sourceSize, (int) (center + support + 0.5));

                double[] w = new double[Math.max(max - min, 0)];
                double sum = 0;
                for (int j = 0; j < w.length; j++) {
                    w[j] = kernel((j + min - center + 0.5) / filterScale);
                    sum += w[j];
                }

                float[] normalized = new float[w.length];
                for (int j = 0; j < w.length; j++) {
                    normalized[j] = (float) (sum == 0 ? 0 : w[j] / sum);
                }
                start[i] = min;
                weights[i] = normalized;
            }
        }

        float apply(int index, float[] data, int offset, int stride) {
            float[] w = weights[index];
            int pos = offset + start[index] * stride;
            float acc = 0;
            for (int j = 0; j < w.length; j++, pos += stride) {
                acc += w[j] * data[pos];
            }
            return acc;
        }

    } // class Contributions


}
