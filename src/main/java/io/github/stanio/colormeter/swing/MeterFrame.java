/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.colormeter.swing;

import java.io.File;
import java.nio.file.Path;
import java.util.Optional;

import java.awt.BorderLayout;
import java.awt.FlowLayout;
import java.awt.event.MouseEvent;
import java.awt.event.MouseMotionAdapter;

import javax.swing.BorderFactory;
import javax.swing.Box;
import javax.swing.BoxLayout;
import javax.swing.JButton;
import javax.swing.JFileChooser;
import javax.swing.JFrame;
import javax.swing.JLabel;
import javax.swing.JOptionPane;
import javax.swing.JPanel;
import javax.swing.SwingConstants;
import javax.swing.SwingUtilities;

import io.github.stanio.colormeter.MeterSession;
import io.github.stanio.colormeter.color.ColorSample;
import io.github.stanio.colormeter.config.MeterConfig;
import io.github.stanio.colormeter.image.ImageDecodeException;
import io.github.stanio.colormeter.image.LoadedImage;

/**
 * Main window: an "Open" button, the opened image and three readouts
 * updated as the pointer moves over the image.  Must be created and used
 * on the event dispatch thread.
 */
public class MeterFrame extends JFrame implements MeterSession.Listener {

    private static final long serialVersionUID = 8526173049178340113L;

    private final transient MeterConfig config;

    private final JLabel promptLabel;
    private final ImageCanvas canvas;
    private final JLabel rgbLabel;
    private final JLabel rawHsvLabel;
    private final JLabel hsvLabel;

    private JFileChooser fileChooser;

    public MeterFrame(MeterSession session, MeterConfig config) {
        super(config.title());
        this.config = config;
        setDefaultCloseOperation(JFrame.EXIT_ON_CLOSE);
        setLayout(new BorderLayout());

        promptLabel = new JLabel(config.prompt(), SwingConstants.CENTER);
        promptLabel.setBorder(BorderFactory.createEmptyBorder(10, 10, 0, 10));

        JButton openButton = new JButton("Open");
        OpenImageAction openAction =
                new OpenImageAction(session, this::chooseFile, this::showError);
        openButton.addActionListener(event -> openAction.run());
        JPanel buttonPanel = new JPanel(new FlowLayout(FlowLayout.CENTER));
        buttonPanel.setBorder(BorderFactory.createEmptyBorder(10, 10, 10, 10));
        buttonPanel.add(openButton);

        canvas = new ImageCanvas();
        canvas.addMouseMotionListener(new MouseMotionAdapter() {
            @Override public void mouseMoved(MouseEvent e) {
                session.pointerMoved(e.getX(), e.getY());
            }
            @Override public void mouseDragged(MouseEvent e) {
                session.pointerMoved(e.getX(), e.getY());
            }
        });
        JPanel canvasPanel = new JPanel(new FlowLayout(FlowLayout.LEADING, 30, 0));
        canvasPanel.add(canvas);
        canvasPanel.setVisible(false);

        rgbLabel = new JLabel(" ");
        rawHsvLabel = new JLabel(" ");
        hsvLabel = new JLabel(" ");
        JPanel readoutPanel = new JPanel();
        readoutPanel.setLayout(new BoxLayout(readoutPanel, BoxLayout.Y_AXIS));
        readoutPanel.setBorder(BorderFactory.createEmptyBorder(4, 4, 4, 30));
        readoutPanel.add(Box.createVerticalGlue());
        readoutPanel.add(rgbLabel);
        readoutPanel.add(rawHsvLabel);
        readoutPanel.add(hsvLabel);
        readoutPanel.add(Box.createVerticalGlue());

        add(promptLabel, BorderLayout.NORTH);
        add(canvasPanel, BorderLayout.CENTER);
        add(readoutPanel, BorderLayout.EAST);
        add(buttonPanel, BorderLayout.SOUTH);

        setSize(config.initialSize());
        setLocationRelativeTo(null);
        session.addListener(this);
    }

    private Optional<Path> chooseFile() {
        if (fileChooser == null) {
            fileChooser = new JFileChooser();
        }
        if (fileChooser.showOpenDialog(this) != JFileChooser.APPROVE_OPTION)
            return Optional.empty();

        File selected = fileChooser.getSelectedFile();
        return Optional.ofNullable(selected).map(File::toPath);
    }

    private void showError(ImageDecodeException e) {
        JOptionPane.showMessageDialog(this, e.getMessage(),
                config.title(), JOptionPane.ERROR_MESSAGE);
    }

    @Override
    public void imageLoaded(LoadedImage image) {
        if (promptLabel.getParent() != null) {
            remove(promptLabel);
            setSize(config.loadedSize());
        }
        canvas.setImage(image.display());
        canvas.getParent().setVisible(true);
        rgbLabel.setText(" ");
        rawHsvLabel.setText(" ");
        hsvLabel.setText(" ");
        setTitle(config.title() + " - " + image.file().getFileName());
        revalidate();
        repaint();
    }

    @Override
    public void sampled(ColorSample sample) {
        rgbLabel.setText(sample.rgbText());
        rawHsvLabel.setText(sample.rawHsvText());
        hsvLabel.setText(sample.hsvText());
    }

    /**
     * Creates and shows the window on the event dispatch thread.
     *
     * @param   session  the meter session
     * @param   config  window settings
     */
    public static void launch(MeterSession session, MeterConfig config) {
        SwingUtilities.invokeLater(() -> new MeterFrame(session, config).setVisible(true));
    }

}
