package com.tyron.markj.testFramework;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads text fixtures from the test classpath ({@code src/test/resources/fixtures}).
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static String load(String name) {
        String resource = "/fixtures/" + name;
        try (InputStream in = Fixtures.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("fixture not found: " + resource);
            }
            // Normalize so offsets in tests do not depend on checkout line endings.
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).replace("\r\n", "\n");
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read fixture " + resource, e);
        }
    }
}
