/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.colormeter.swing;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.github.stanio.colormeter.MeterSession;
import io.github.stanio.colormeter.image.ImageDecodeException;

/**
 * What the "Open" button does: asks for a file, then opens it in the
 * session.  No file chosen, no change.
 */
class OpenImageAction implements Runnable {

    private static final Logger log = Logger.getLogger(OpenImageAction.class.getName());

    private final MeterSession session;
    private final Supplier<Optional<Path>> fileChooser;
    private final Consumer<ImageDecodeException> errorHandler;

    /**
     * @param   session  the session to open images in
     * @param   fileChooser  asks for a file; empty if the user cancels
     * @param   errorHandler  reports a file that could not be opened
     */
    OpenImageAction(MeterSession session,
                    Supplier<Optional<Path>> fileChooser,
                    Consumer<ImageDecodeException> errorHandler) {
        this.session = Objects.requireNonNull(session, "session");
        this.fileChooser = Objects.requireNonNull(fileChooser, "fileChooser");
        this.errorHandler = Objects.requireNonNull(errorHandler, "errorHandler");
    }

    @Override
    public void run() {
        fileChooser.get().ifPresent(this::open);
    }

    void open(Path file) {
        try {
            session.open(file);
        } catch (ImageDecodeException e) {
            log.log(Level.WARNING, "Could not open " + file, e);
            errorHandler.accept(e);
        }
    }

}
