package com.tyron.markj.core.snippets;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * YAML persistence for snippets. The file holds a list of mappings with the keys
 * {@code name}, {@code trigger}, {@code description} and {@code body}.
 */
public final class SnippetFile {

    private static final Logger LOG = Logger.getLogger(SnippetFile.class.getName());

    public static final String BUILTIN_RESOURCE = "/com/tyron/markj/core/snippets/html-snippets.yaml";

    private final Path file;

    public SnippetFile(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    /**
     * Loads the snippets bundled with the editor.
     */
    public static List<Snippet> loadBuiltins() throws IOException {
        try (InputStream in = SnippetFile.class.getResourceAsStream(BUILTIN_RESOURCE)) {
            if (in == null) {
                throw new IOException("Missing resource " + BUILTIN_RESOURCE);
            }
            return read(in, BUILTIN_RESOURCE);
        }
    }

    /**
     * @return the stored snippets, or an empty list if the file does not exist yet
     */
    public List<Snippet> load() throws IOException {
        if (!Files.exists(file)) {
            return List.of();
        }
        try (InputStream in = Files.newInputStream(file)) {
            return read(in, file.toString());
        }
    }

    public void save(SnippetStore store) throws IOException {
        Objects.requireNonNull(store, "store");

        List<Map<String, String>> data = new ArrayList<>();
        for (Snippet s : store.getAll()) {
            Map<String, String> m = new LinkedHashMap<>();
            m.put("name", s.name());
            m.put("trigger", s.trigger());
            m.put("description", s.description());
            m.put("body", s.body());
            data.add(m);
        }

        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);

        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            new Yaml(options).dump(data, out);
        }
    }

    private static List<Snippet> read(InputStream in, String origin) throws IOException {
        Object doc;
        try {
            doc = new Yaml().load(in);
        } catch (RuntimeException e) {
            throw new IOException("Malformed snippet file: " + origin, e);
        }
        if (doc == null) {
            return List.of();
        }
        if (!(doc instanceof List<?> list)) {
            throw new IOException("Snippet file is not a list: " + origin);
        }

        List<Snippet> result = new ArrayList<>();
        for (Object item : list) {
            if (!(item instanceof Map<?, ?> m) || m.get("name") == null || m.get("body") == null) {
                LOG.warning("Skipping malformed snippet in " + origin + ": " + item);
                continue;
            }
            result.add(new Snippet(
                    String.valueOf(m.get("name")),
                    m.get("trigger") != null ? String.valueOf(m.get("trigger")) : "",
                    m.get("description") != null ? String.valueOf(m.get("description")) : "",
                    String.valueOf(m.get("body"))));
        }
        return result;
    }
}
