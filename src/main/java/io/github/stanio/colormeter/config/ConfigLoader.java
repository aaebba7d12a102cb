/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.colormeter.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.logging.Logger;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonIOException;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

/**
 * Reads {@code MeterConfig} from JSON.  The built-in
 * {@code default-config.json} supplies every key.
 */
public class ConfigLoader {

    private static final Logger log = Logger.getLogger(ConfigLoader.class.getName());

    static final String DEFAULT_CONFIG = "default-config.json";

    private final Gson gson;

    public ConfigLoader() {
        this.gson = new Gson();
    }

    /**
     * {@return the built-in configuration}
     */
    public MeterConfig defaults() {
        URL resource = ConfigLoader.class.getResource(DEFAULT_CONFIG);
        if (resource == null) {
            throw new IllegalStateException("Resource not found: " + DEFAULT_CONFIG);
        }
        try {
            return load(resource);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + DEFAULT_CONFIG, e);
        }
    }

    /**
     * Reads and validates a configuration.
     *
     * @param   source  JSON object with a value for every key
     * @return  the configuration
     * @throws  IOException  if an I/O error occurs reading the source
     * @throws  JsonParseException  if the source is not a JSON object, or
     *          its values are not valid
     */
    MeterConfig load(URL source) throws IOException, JsonParseException {
        JsonObject values;
        try (InputStream stream = source.openStream();
                Reader text = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            values = readObject(text, source.toString());
        }
        MeterConfig config = toConfig(values);
        log.fine(() -> "Loaded " + config + " from " + source);
        return config;
    }

    private JsonObject readObject(Reader text, String source)
            throws IOException, JsonParseException
    {
        JsonElement json;
        try {
            json = gson.fromJson(text, JsonElement.class);
        } catch (JsonIOException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw e;
        }
        if (json == null || !json.isJsonObject()) {
            throw new JsonParseException(source + ": JSON object expected");
        }
        return json.getAsJsonObject();
    }

    private MeterConfig toConfig(JsonObject values) throws JsonParseException {
        try {
            return gson.fromJson(values, MeterConfig.class).validate();
        } catch (NumberFormatException | IllegalStateException e) {
            throw new JsonParseException(e);
        }
    }

}
