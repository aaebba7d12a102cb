/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.colormeter.image;

import java.util.Optional;

import io.github.stanio.colormeter.color.ColorSample;

/**
 * Maps pointer coordinates to pixel samples of a {@code LoadedImage}.
 * Coordinates are taken relative to the top-left corner of the display
 * image, one unit per pixel.
 */
public final class PointerSampler {

    private PointerSampler() {/* no instances */}

    /**
     * Samples the pixel under the pointer.
     *
     * @param   image  the current image, or {@code null} if none is loaded
     * @param   x  pointer x-coordinate
     * @param   y  pointer y-coordinate
     * @return  the sample, or empty if no image is loaded or the coordinates
     *          fall outside it (either bound)
     */
    public static Optional<ColorSample> sample(LoadedImage image, int x, int y) {
        if (image == null || !image.colors().contains(x, y))
            return Optional.empty();

        return Optional.of(ColorSample.of(image.colors(), image.hsv(), x, y));
    }

}
