package com.tyron.markj.core.bookmarks;

import org.jetbrains.annotations.NotNull;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Bookmarked lines, grouped by file path.
 *
 * Line numbers are 0-based and are not kept in sync with edits; a bookmark that points past the end of
 * a file is simply skipped when navigating. Persistence is handled by {@link BookmarkFile}.
 */
public final class BookmarkStore {

    private final Map<String, TreeSet<Integer>> linesByPath = new TreeMap<>();

    /**
     * @return true if the line is bookmarked after the call
     */
    public boolean toggle(@NotNull String path, int line) {
        if (contains(path, line)) {
            remove(path, line);
            return false;
        }
        add(path, line);
        return true;
    }

    public boolean add(@NotNull String path, int line) {
        Objects.requireNonNull(path, "path");
        checkLine(line);
        return linesByPath.computeIfAbsent(path, p -> new TreeSet<>()).add(line);
    }

    public boolean remove(@NotNull String path, int line) {
        Objects.requireNonNull(path, "path");
        TreeSet<Integer> lines = linesByPath.get(path);
        if (lines == null || !lines.remove(line)) {
            return false;
        }
        if (lines.isEmpty()) {
            linesByPath.remove(path);
        }
        return true;
    }

    public boolean contains(@NotNull String path, int line) {
        TreeSet<Integer> lines = linesByPath.get(Objects.requireNonNull(path, "path"));
        return lines != null && lines.contains(line);
    }

    public void clear(@NotNull String path) {
        linesByPath.remove(Objects.requireNonNull(path, "path"));
    }

    public @NotNull SortedSet<Integer> getLines(@NotNull String path) {
        TreeSet<Integer> lines = linesByPath.get(Objects.requireNonNull(path, "path"));
        return lines == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(new TreeSet<>(lines));
    }

    /**
     * Finds the first bookmark after {@code fromLine}, wrapping around to the start of the file.
     *
     * @param lineCount current line count of the file; bookmarks at or beyond it are skipped
     */
    public @NotNull OptionalInt next(@NotNull String path, int fromLine, int lineCount) {
        NavigableSet<Integer> valid = validLines(path, lineCount);
        if (valid.isEmpty()) {
            return OptionalInt.empty();
        }
        Integer next = valid.higher(fromLine);
        return OptionalInt.of(next != null ? next : valid.first());
    }

    /**
     * Finds the last bookmark before {@code fromLine}, wrapping around to the end of the file.
     */
    public @NotNull OptionalInt previous(@NotNull String path, int fromLine, int lineCount) {
        NavigableSet<Integer> valid = validLines(path, lineCount);
        if (valid.isEmpty()) {
            return OptionalInt.empty();
        }
        Integer previous = valid.lower(fromLine);
        return OptionalInt.of(previous != null ? previous : valid.last());
    }

    /**
     * Drops bookmarks of files that no longer exist on disk.
     *
     * @return number of paths removed
     */
    public int retainExistingFiles() {
        return retainPaths(path -> Files.isRegularFile(Path.of(path)));
    }

    public int retainPaths(@NotNull Predicate<String> keep) {
        int before = linesByPath.size();
        linesByPath.keySet().removeIf(keep.negate());
        return before - linesByPath.size();
    }

    /**
     * @return a copy of all bookmarks, ordered by path then line
     */
    public @NotNull Map<String, SortedSet<Integer>> asMap() {
        Map<String, SortedSet<Integer>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, TreeSet<Integer>> e : linesByPath.entrySet()) {
            copy.put(e.getKey(), Collections.unmodifiableSortedSet(new TreeSet<>(e.getValue())));
        }
        return Collections.unmodifiableMap(copy);
    }

    public boolean isEmpty() {
        return linesByPath.isEmpty();
    }

    private NavigableSet<Integer> validLines(String path, int lineCount) {
        TreeSet<Integer> lines = linesByPath.get(Objects.requireNonNull(path, "path"));
        if (lines == null || lineCount <= 0) {
            return Collections.emptyNavigableSet();
        }
        return lines.headSet(lineCount, false);
    }

    private static void checkLine(int line) {
        if (line < 0) {
            throw new IllegalArgumentException("line < 0: " + line);
        }
    }
}
