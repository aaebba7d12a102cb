/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.colormeter.awt;

import java.awt.Dimension;
import java.awt.image.BufferedImage;

/**
 * Scales images down for display.
 */
public final class Resampling {

    private Resampling() {/* no instances */}

    /**
     * Computes the size of an image scaled by the given factor.  Fractional
     * results are truncated; a dimension that would truncate to zero is
     * kept at one pixel.
     *
     * @param   width  source width
     * @param   height  source height
     * @param   scale  scale factor in {@code (0, 1]}
     * @return  the scaled size
     */
    public static Dimension scaledSize(int width, int height, double scale) {
        if (!(scale > 0 && scale <= 1)) {
            throw new IllegalArgumentException("Scale not in (0, 1]: " + scale);
        }
        return new Dimension(Math.max(1, (int) Math.floor(width * scale)),
                             Math.max(1, (int) Math.floor(height * scale)));
    }

    /**
     * Resamples an opaque image to the given size.
     *
     * @param   image  the source image
     * @param   targetWidth  target width, not larger than the source
     * @param   targetHeight  target height, not larger than the source
     * @param   filter  resampling filter
     * @return  a new {@code TYPE_INT_RGB} image, or a copy of the source
     *          if the size doesn't change
     */
    public static BufferedImage resize(BufferedImage image,
                                       int targetWidth,
                                       int targetHeight,
                                       ResampleFilter filter) {
        if (targetWidth <= 0 || targetHeight <= 0
                || targetWidth > image.getWidth()
                || targetHeight > image.getHeight()) {
            throw new IllegalArgumentException("Invalid target size "
                    + targetWidth + "x" + targetHeight + " for "
                    + image.getWidth() + "x" + image.getHeight() + " source");
        }

        switch (filter) {
        case BICUBIC:
            return SmoothDownscale.resize(image, targetWidth, targetHeight);

        case LANCZOS:
            return LanczosResampler.resize(image, targetWidth, targetHeight);

        default:
            throw new IllegalStateException("Unknown filter: " + filter);
        }
    }

}
