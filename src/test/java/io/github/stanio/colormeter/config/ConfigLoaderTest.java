/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.colormeter.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.net.URL;
import java.nio.file.Path;

import java.awt.Dimension;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.gson.JsonParseException;

import io.github.stanio.colormeter.awt.ResampleFilter;

public class ConfigLoaderTest {

    @TempDir
    Path tmpDir;

    private final ConfigLoader loader = new ConfigLoader();

    static URL getResource(String name) {
        return ConfigLoaderTest.class.getResource(name);
    }

    @Test
    void defaults() {
        MeterConfig config = loader.defaults();

        assertThat(config.title()).as("title").isEqualTo("Digital Color Meter");
        assertThat(config.prompt()).as("prompt").isEqualTo("Select an image");
        assertThat(config.initialSize()).as("initialSize").isEqualTo(new Dimension(300, 100));
        assertThat(config.loadedSize()).as("loadedSize").isEqualTo(new Dimension(800, 800));
        assertThat(config.scale()).as("scale").isEqualTo(0.5);
        assertThat(config.filter()).as("filter").isEqualTo(ResampleFilter.LANCZOS);
    }

    @Test
    void allKeysRead() throws Exception {
        MeterConfig config = loader.load(getResource("bicubic-config.json"));

        assertThat(config.title()).as("title").isEqualTo("Meter");
        assertThat(config.prompt()).as("prompt").isEqualTo("Open a picture");
        assertThat(config.initialSize()).as("initialSize").isEqualTo(new Dimension(320, 120));
        assertThat(config.loadedSize()).as("loadedSize").isEqualTo(new Dimension(1024, 768));
        assertThat(config.scale()).as("scale").isEqualTo(0.25);
        assertThat(config.filter()).as("filter").isEqualTo(ResampleFilter.BICUBIC);
    }

    @Test
    void invalidScale() {
        assertThatThrownBy(() -> loader.load(getResource("invalid-scale.json")))
                .isInstanceOf(JsonParseException.class)
                .hasMessage("scale not in (0, 1]: 2.5");
    }

    @Test
    void missingKey() {
        assertThatThrownBy(() -> loader.load(getResource("missing-title.json")))
                .isInstanceOf(JsonParseException.class)
                .hasMessage("title is null or blank");
    }

    @Test
    void notAnObject() {
        assertThatThrownBy(() -> loader.load(getResource("not-an-object.json")))
                .isInstanceOf(JsonParseException.class)
                .hasMessageEndingWith("JSON object expected");
    }

    @Test
    void malformedJson() {
        assertThatThrownBy(() -> loader.load(getResource("malformed.json")))
                .isInstanceOf(JsonParseException.class);
    }

    @Test
    void missingSource() throws Exception {
        URL missing = tmpDir.resolve("missing.json").toUri().toURL();

        assertThatThrownBy(() -> loader.load(missing))
                .isInstanceOf(IOException.class);
    }

}
