/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.colormeter.awt;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Bicubic downscaling through {@code Graphics2D}.  Scales down by at most
 * a factor of 2 per step, as single-step bicubic drops source pixels at
 * larger factors.
 *
 * @see  <a href="https://web.archive.org/web/20080516181120/http://today.java.net/pub/a/today/2007/04/03/perils-of-image-getscaledinstance.html"
 *              >The Perils of Image.getScaledInstance()</a> <i>by Chris Campbell</i>
 */
final class SmoothDownscale {

    private static final RenderingHints qualityHints;
    static {
        RenderingHints hints = new RenderingHints(
                RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
        hints.put(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
        hints.put(RenderingHints.KEY_COLOR_RENDERING, RenderingHints.VALUE_COLOR_RENDER_QUALITY);
        qualityHints = hints;
    }

    private SmoothDownscale() {/* no instances */}

    static BufferedImage resize(BufferedImage image, int targetWidth, int targetHeight) {
        BufferedImage source = image;
        int sourceWidth = source.getWidth();
        int sourceHeight = source.getHeight();
        do {
            int stepWidth = Math.max(targetWidth, sourceWidth / 2);
            int stepHeight = Math.max(targetHeight, sourceHeight / 2);
            if (sourceWidth <= targetWidth)
                stepWidth = targetWidth;
            if (sourceHeight <= targetHeight)
                stepHeight = targetHeight;

            source = draw(source, stepWidth, stepHeight);
            sourceWidth = stepWidth;
            sourceHeight = stepHeight;
        } while (sourceWidth != targetWidth || sourceHeight != targetHeight);
        return source;
    }

    private static BufferedImage draw(BufferedImage source, int width, int height) {
        BufferedImage scaled = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = scaled.createGraphics();
        try {
            g.addRenderingHints(qualityHints);
            g.drawImage(source, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return scaled;
    }

}
