/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.colormeter.image;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Logger;

import java.awt.Dimension;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.ComponentColorModel;
import java.awt.image.Raster;

import javax.imageio.ImageIO;

import io.github.stanio.colormeter.awt.ResampleFilter;
import io.github.stanio.colormeter.awt.Resampling;
import io.github.stanio.colormeter.color.ChannelOrder;
import io.github.stanio.colormeter.color.ColorBuffer;
import io.github.stanio.colormeter.color.HsvBuffer;
import io.github.stanio.colormeter.color.HsvConversion;

/**
 * Decodes image files and prepares them for sampling.
 * <ol>
 * <li>Decodes the file with {@code ImageIO}, dropping any alpha;</li>
 * <li>Scales it by the configured factor (half size, by default);</li>
 * <li>Copies the scaled pixels into a BGR {@code ColorBuffer};</li>
 * <li>Converts that to an {@code HsvBuffer}.</li>
 * </ol>
 */
public class ImageLoader {

    private static final Logger log = Logger.getLogger(ImageLoader.class.getName());

    public static final double DEFAULT_SCALE = 0.5;

    private final double scale;

    private final ResampleFilter filter;

    public ImageLoader() {
        this(DEFAULT_SCALE, ResampleFilter.LANCZOS);
    }

    public ImageLoader(double scale, ResampleFilter filter) {
        // Fail early rather than on the first load
        Resampling.scaledSize(1, 1, scale);
        this.scale = scale;
        this.filter = Objects.requireNonNull(filter, "filter");
    }

    public double scale() {
        return scale;
    }

    public ResampleFilter filter() {
        return filter;
    }

    /**
     * Reads and prepares the given image file.
     *
     * @param   file  the image file
     * @return  the decoded, scaled image and its color buffers
     * @throws  ImageDecodeException  if the file can't be read or decoded
     */
    public LoadedImage load(Path file) throws ImageDecodeException {
        return prepare(file, decode(file));
    }

    LoadedImage prepare(Path file, BufferedImage source) throws ImageDecodeException {
        long startTime = System.nanoTime();
        LoadedImage image;
        try {
            Dimension sourceSize = new Dimension(source.getWidth(), source.getHeight());
            Dimension size = Resampling.scaledSize(sourceSize.width, sourceSize.height, scale);

            BufferedImage display = Resampling
                    .resize(source, size.width, size.height, filter);
            ColorBuffer colors = ColorBuffer.of(display, ChannelOrder.BGR);
            HsvBuffer hsv = HsvConversion.convert(colors);

            image = new LoadedImage(file, sourceSize, display, colors, hsv);
        } catch (RuntimeException e) {
            // Too large for the pixel buffers, or a failing raster
            throw new ImageDecodeException(file, "Could not prepare image: " + e, e);
        }
        log.fine(() -> image + " (" + filter + ") in "
                + (System.nanoTime() - startTime) / 1_000_000 + " ms");
        return image;
    }

    static BufferedImage decode(Path file) throws ImageDecodeException {
        BufferedImage image;
        try (InputStream fin = Files.newInputStream(file)) {
            image = ImageIO.read(fin);
        } catch (IOException e) {
            throw new ImageDecodeException(file, userMessage(e), e);
        } catch (RuntimeException e) {
            // Some plugin readers fail this way on malformed input
            throw new ImageDecodeException(file, "Malformed image data: " + e, e);
        }

        if (image == null) {
            throw new ImageDecodeException(file, "Unsupported image format");
        }
        if (image.getWidth() <= 0 || image.getHeight() <= 0) {
            throw new ImageDecodeException(file, "Empty image");
        }
        return toOpaqueRGB(image);
    }

    private static String userMessage(IOException e) {
        String message = e.getMessage();
        String type = e.getClass().getSimpleName()
                       .replaceFirst("Exception$", "");
        return (message == null) ? type : type + ": " + message;
    }

    /**
     * Keeps the color channels of each pixel as they are, discarding the
     * alpha without compositing against a background.
     */
    static BufferedImage toOpaqueRGB(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB)
            return image;

        ColorModel colorModel = image.getColorModel();
        if (colorModel instanceof ComponentColorModel
                && colorModel.getColorSpace().getType() == ColorSpace.TYPE_GRAY
                && colorModel.getComponentSize(0) <= 16) {
            return grayToRGB(image, colorModel.getComponentSize(0));
        }

        int width = image.getWidth();
        int height = image.getHeight();
        BufferedImage rgbImage = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            image.getRGB(0, y, width, 1, row, 0, width);
            rgbImage.setRGB(0, y, width, 1, row, 0, width);
        }
        return rgbImage;
    }

    /**
     * Replicates the stored gray samples into R, G and B.  {@code getRGB}
     * would treat them as linear gray and convert them to sRGB.
     */
    private static BufferedImage grayToRGB(BufferedImage image, int bits) {
        Raster raster = image.getRaster();
        int width = image.getWidth();
        int height = image.getHeight();
        int maxValue = (1 << bits) - 1;
        BufferedImage rgbImage = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int[] gray = new int[width];
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            raster.getSamples(0, y, width, 1, 0, gray);
            for (int x = 0; x < width; x++) {
                int g = (bits == 8) ? gray[x]
                                    : (gray[x] * 255 + maxValue / 2) / maxValue;
                row[x] = g << 16 | g << 8 | g;
            }
            rgbImage.setRGB(0, y, width, 1, row, 0, width);
        }
        return rgbImage;
    }

}
