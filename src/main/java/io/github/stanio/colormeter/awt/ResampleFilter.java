/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.colormeter.awt;

import java.util.Locale;

/**
 * Resampling filters available for producing the display image.
 */
public enum ResampleFilter {

    /**
     * Separable Lanczos windowed sinc with three lobes.
     *
     * @see  LanczosResampler
     */
    LANCZOS,

    /**
     * Bicubic interpolation through {@code Graphics2D}, halving the size
     * in steps until reaching the target.
     *
     * @see  SmoothDownscale
     */
    BICUBIC;

    /**
     * Case-insensitive {@code valueOf()}.
     *
     * @param   name  filter name
     * @return  the filter constant
     * @throws  IllegalArgumentException  if the name matches no filter
     */
    public static ResampleFilter forName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }

}
