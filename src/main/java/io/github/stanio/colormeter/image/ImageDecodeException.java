/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.colormeter.image;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Signals a file that couldn't be decoded as an image: no reader for its
 * format, or malformed content.  Device errors reading the file are
 * reported the same way, with the original {@code IOException} as cause.
 */
public class ImageDecodeException extends IOException {

    private static final long serialVersionUID = 4718953062735106274L;

    private final Path file;

    public ImageDecodeException(Path file, String message) {
        super(file.getFileName() + ": " + message);
        this.file = file;
    }

    public ImageDecodeException(Path file, String message, Throwable cause) {
        super(file.getFileName() + ": " + message, cause);
        this.file = file;
    }

    public Path file() {
        return file;
    }

}
