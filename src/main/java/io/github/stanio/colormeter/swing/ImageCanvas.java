/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.colormeter.swing;

import java.awt.Dimension;
import java.awt.Graphics;
import java.awt.image.BufferedImage;

import javax.swing.JComponent;

/**
 * Paints an image at its natural size, anchored top-left, so component
 * coordinates are pixel coordinates.
 */
class ImageCanvas extends JComponent {

    private static final long serialVersionUID = -3190562785320945211L;

    private transient BufferedImage image;

    void setImage(BufferedImage image) {
        this.image = image;
        setPreferredSize(image == null ? null
                : new Dimension(image.getWidth(), image.getHeight()));
        revalidate();
        repaint();
    }

    @Override
    protected void paintComponent(Graphics g) {
        super.paintComponent(g);
        if (image != null) {
            g.drawImage(image, 0, 0, null);
        }
    }

}
