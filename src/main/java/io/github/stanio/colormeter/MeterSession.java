/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.colormeter;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Logger;

import io.github.stanio.colormeter.color.ColorSample;
import io.github.stanio.colormeter.image.ImageDecodeException;
import io.github.stanio.colormeter.image.ImageLoader;
import io.github.stanio.colormeter.image.LoadedImage;
import io.github.stanio.colormeter.image.PointerSampler;

/**
 * The meter's state: either no image, or one loaded image being sampled.
 * <p>
 * Not thread-safe.  The UI uses it from the event dispatch thread only, and
 * listeners are notified on the calling thread.</p>
 */
public class MeterSession {

    public enum State { NO_IMAGE, IMAGE_LOADED }

    /**
     * Receives session changes.
     */
    public interface Listener {

        default void imageLoaded(LoadedImage image) {/* no-op */}

        default void sampled(ColorSample sample) {/* no-op */}

    }

    private static final Logger log = Logger.getLogger(MeterSession.class.getName());

    private final ImageLoader loader;

    private final List<Listener> listeners = new CopyOnWriteArrayList<>();

    private LoadedImage current;

    public MeterSession(ImageLoader loader) {
        this.loader = Objects.requireNonNull(loader);
    }

    public void addListener(Listener listener) {
        listeners.add(Objects.requireNonNull(listener));
    }

    public void removeListener(Listener listener) {
        listeners.remove(listener);
    }

    public State state() {
        return (current == null) ? State.NO_IMAGE : State.IMAGE_LOADED;
    }

    public Optional<LoadedImage> image() {
        return Optional.ofNullable(current);
    }

    /**
     * Opens the given file, replacing the current image.  If loading
     * fails, the current image (if any) stays in effect.
     *
     * @param   file  image file to open
     * @return  the newly loaded image
     * @throws  ImageDecodeException  if the file can't be read or decoded
     */
    public LoadedImage open(Path file) throws ImageDecodeException {
        LoadedImage image = loader.load(file);
        current = image;
        log.info(() -> "Opened " + image);
        for (Listener l : listeners) {
            l.imageLoaded(image);
        }
        return image;
    }

    /**
     * Samples the pixel under the pointer and notifies listeners.  Does
     * nothing when no image is loaded or the pointer is outside it.
     *
     * @param   x  x-coordinate relative to the displayed image
     * @param   y  y-coordinate relative to the displayed image
     * @return  the sample, if one was taken
     */
    public Optional<ColorSample> pointerMoved(int x, int y) {
        Optional<ColorSample> sample = PointerSampler.sample(current, x, y);
        sample.ifPresent(s -> {
            for (Listener l : listeners) {
                l.sampled(s);
            }
        });
        return sample;
    }

}
