/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.colormeter.image;

import java.awt.Dimension;
import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.Objects;

import io.github.stanio.colormeter.color.ColorBuffer;
import io.github.stanio.colormeter.color.HsvBuffer;

/**
 * An opened image: the scaled-down raster shown on screen together with
 * the color and HSV buffers derived from it.  All three have the same
 * size.  Instances are never modified; opening another file produces a
 * new instance.
 *
 * @see  ImageLoader#load(Path)
 */
public final class LoadedImage {

    private final Path file;
    private final Dimension sourceSize;
    private final BufferedImage display;
    private final ColorBuffer colors;
    private final HsvBuffer hsv;

    LoadedImage(Path file,
                Dimension sourceSize,
                BufferedImage display,
                ColorBuffer colors,
                HsvBuffer hsv) {
        this.file = Objects.requireNonNull(file);
        this.sourceSize = new Dimension(sourceSize);
        this.display = Objects.requireNonNull(display);
        this.colors = Objects.requireNonNull(colors);
        this.hsv = Objects.requireNonNull(hsv);
        if (!colors.sameSize(hsv)
                || colors.width() != display.getWidth()
                || colors.height() != display.getHeight()) {
            throw new IllegalArgumentException("Size mismatch: display "
                    + display.getWidth() + "x" + display.getHeight()
                    + ", " + colors + ", " + hsv);
        }
    }

    public Path file() {
        return file;
    }

    /**
     * {@return the size of the decoded image before scaling}
     */
    public Dimension sourceSize() {
        return new Dimension(sourceSize);
    }

    /**
     * {@return the image to render; callers must not modify it}
     */
    public BufferedImage display() {
        return display;
    }

    public ColorBuffer colors() {
        return colors;
    }

    public HsvBuffer hsv() {
        return hsv;
    }

    public int width() {
        return colors.width();
    }

    public int height() {
        return colors.height();
    }

    @Override
    public String toString() {
        return "LoadedImage(" + file.getFileName() + ", "
                + sourceSize.width + "x" + sourceSize.height
                + " -> " + width() + "x" + height() + ")";
    }

}
