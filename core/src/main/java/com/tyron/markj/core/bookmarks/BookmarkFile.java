package com.tyron.markj.core.bookmarks;

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
import java.util.SortedSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads and writes a {@link BookmarkStore} as YAML:
 *
 * <pre>
 * /home/me/site/index.html: [3, 42]
 * /home/me/site/about.html: [0]
 * </pre>
 */
public final class BookmarkFile {

    private static final Logger LOG = Logger.getLogger(BookmarkFile.class.getName());

    private final Path file;

    public BookmarkFile(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    public Path getPath() {
        return file;
    }

    /**
     * Loads bookmarks, keeping only files that still exist. A missing bookmark file yields an empty store.
     */
    public BookmarkStore load() throws IOException {
        BookmarkStore store = new BookmarkStore();
        if (!Files.exists(file)) {
            return store;
        }

        Object doc;
        try (InputStream in = Files.newInputStream(file)) {
            doc = new Yaml().load(in);
        } catch (RuntimeException e) {
            throw new IOException("Malformed bookmark file: " + file, e);
        }
        if (doc == null) {
            return store;
        }
        if (!(doc instanceof Map<?, ?> map)) {
            throw new IOException("Bookmark file is not a mapping: " + file);
        }

        for (Map.Entry<?, ?> e : map.entrySet()) {
            if (e.getKey() == null || !(e.getValue() instanceof List<?> lines)) {
                LOG.warning("Skipping malformed bookmark entry: " + e.getKey());
                continue;
            }
            String path = String.valueOf(e.getKey());
            for (Object line : lines) {
                if (line instanceof Integer n && n >= 0) {
                    store.add(path, n);
                } else {
                    LOG.warning("Skipping invalid bookmark line '" + line + "' for " + path);
                }
            }
        }

        int removed = store.retainExistingFiles();
        if (removed > 0 && LOG.isLoggable(Level.FINE)) {
            LOG.fine("Dropped bookmarks of " + removed + " missing files");
        }
        return store;
    }

    public void save(BookmarkStore store) throws IOException {
        Objects.requireNonNull(store, "store");

        Map<String, List<Integer>> data = new LinkedHashMap<>();
        for (Map.Entry<String, SortedSet<Integer>> e : store.asMap().entrySet()) {
            data.put(e.getKey(), new ArrayList<>(e.getValue()));
        }

        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.AUTO);

        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            new Yaml(options).dump(data, out);
        }
    }
}
