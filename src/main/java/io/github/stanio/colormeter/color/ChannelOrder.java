/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.colormeter.color;

/**
 * In-memory order of the three color channels of a {@code PixelBuffer}.
 */
public enum ChannelOrder {

    RGB(0, 1, 2),

    BGR(2, 1, 0);

    final int red;
    final int green;
    final int blue;

    private ChannelOrder(int red, int green, int blue) {
        this.red = red;
        this.green = green;
        this.blue = blue;
    }

}
