package io.github.cyfko.flatdae.integration;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

final class ModelSources {

    private ModelSources() {
    }

    static String load(String fileName) {
        try (InputStream in = ModelSources.class.getResourceAsStream("/models/" + fileName)) {
            if (in == null) {
                throw new IllegalStateException("Missing test model: " + fileName);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
