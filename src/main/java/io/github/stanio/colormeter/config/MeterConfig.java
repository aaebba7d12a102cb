/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.colormeter.config;

import java.awt.Dimension;

import com.google.gson.JsonParseException;

import io.github.stanio.colormeter.awt.ResampleFilter;

/**
 * Application settings.  Field names match the keys of the JSON
 * configuration.
 *
 * @see  ConfigLoader
 */
public final class MeterConfig {

    String title;
    String prompt;

    int initialWidth;
    int initialHeight;
    int loadedWidth;
    int loadedHeight;

    double scale;
    String filter;

    private MeterConfig() {
        // Gson
    }

    public String title() {
        return title;
    }

    /**
     * {@return the message shown until the first image is opened}
     */
    public String prompt() {
        return prompt;
    }

    public Dimension initialSize() {
        return new Dimension(initialWidth, initialHeight);
    }

    public Dimension loadedSize() {
        return new Dimension(loadedWidth, loadedHeight);
    }

    public double scale() {
        return scale;
    }

    public ResampleFilter filter() {
        return ResampleFilter.forName(filter);
    }

    MeterConfig validate() throws JsonParseException {
        requireText("title", title);
        requireText("prompt", prompt);
        requirePositive("initialWidth", initialWidth);
        requirePositive("initialHeight", initialHeight);
        requirePositive("loadedWidth", loadedWidth);
        requirePositive("loadedHeight", loadedHeight);
        if (!(scale > 0 && scale <= 1)) {
            throw new JsonParseException("scale not in (0, 1]: " + scale);
        }
        if (filter == null) {
            throw new JsonParseException("filter not specified");
        }
        try {
            ResampleFilter.forName(filter);
        } catch (IllegalArgumentException e) {
            throw new JsonParseException("Unknown filter: " + filter, e);
        }
        return this;
    }

    private static void requireText(String key, String value) {
        if (value == null || value.isBlank()) {
            throw new JsonParseException(key + " is null or blank");
        }
    }

    private static void requirePositive(String key, int value) {
        if (value <= 0) {
            throw new JsonParseException(key + " not positive: " + value);
        }
    }

    @Override
    public String toString() {
        return "MeterConfig(title=" + title
                + ", initialSize=" + initialWidth + "x" + initialHeight
                + ", loadedSize=" + loadedWidth + "x" + loadedHeight
                + ", scale=" + scale + ", filter=" + filter + ")";
    }

}
