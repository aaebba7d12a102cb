/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.colormeter;

import java.util.logging.Logger;

import java.awt.GraphicsEnvironment;

import io.github.stanio.colormeter.config.ConfigLoader;
import io.github.stanio.colormeter.config.MeterConfig;
import io.github.stanio.colormeter.image.ImageLoader;
import io.github.stanio.colormeter.swing.MeterFrame;

/**
 * Digital color meter: open an image, hover over it, read its RGB and HSV
 * pixel values.  Takes no arguments; the program ends when its window is
 * closed.
 */
public final class ColorMeter {

    static {
        if (System.getProperty("java.util.logging.SimpleFormatter.format") == null) {
            System.setProperty("java.util.logging.SimpleFormatter.format",
                               "[%1$tFT%1$tT] [%4$s] %3$s : %5$s%6$s%n");
        }
    }

    private static final Logger log = Logger.getLogger(ColorMeter.class.getName());

    private ColorMeter() {/* no instances */}

    public static void main(String[] args) {
        MeterConfig config = new ConfigLoader().defaults();
        if (GraphicsEnvironment.isHeadless()) {
            log.severe("No display available");
            return;
        }

        MeterSession session = new MeterSession(
                new ImageLoader(config.scale(), config.filter()));
        MeterFrame.launch(session, config);
    }

}
