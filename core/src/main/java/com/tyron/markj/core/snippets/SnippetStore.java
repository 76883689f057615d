package com.tyron.markj.core.snippets;

import me.xdrop.fuzzywuzzy.FuzzySearch;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory snippet collection, keyed by snippet name.
 */
public final class SnippetStore {

    /**
     * The minimum fuzzy score needed for a snippet to be listed as a partial match.
     */
    private static final int MINIMUM_SCORE = 70;

    private static final int EXACT_TRIGGER_SCORE = 1000;
    private static final int PREFIX_SCORE = 500;

    private final Map<String, Snippet> byName = new LinkedHashMap<>();

    public SnippetStore() {
    }

    public SnippetStore(Collection<Snippet> snippets) {
        snippets.forEach(this::put);
    }

    /**
     * Adds or replaces the snippet with the same name.
     *
     * @return the replaced snippet, if any
     */
    public Optional<Snippet> put(@NotNull Snippet snippet) {
        Objects.requireNonNull(snippet, "snippet");
        return Optional.ofNullable(byName.put(snippet.name(), snippet));
    }

    public boolean remove(@NotNull String name) {
        return byName.remove(name) != null;
    }

    public Optional<Snippet> get(@NotNull String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public Optional<Snippet> findByTrigger(@NotNull String trigger) {
        for (Snippet s : byName.values()) {
            if (s.trigger().equals(trigger)) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }

    public @NotNull List<Snippet> getAll() {
        return List.copyOf(byName.values());
    }

    public int size() {
        return byName.size();
    }

    /**
     * Ranks snippets against a user query: an exact trigger first, then trigger/name prefixes, then
     * fuzzy matches on the name and description. A blank query lists everything by name.
     */
    public @NotNull List<Snippet> search(@NotNull String query, int limit) {
        Objects.requireNonNull(query, "query");
        if (limit <= 0) {
            return List.of();
        }

        String q = query.trim().toLowerCase(Locale.ROOT);
        if (q.isEmpty()) {
            return byName.values().stream()
                    .sorted(Comparator.comparing(Snippet::name, String.CASE_INSENSITIVE_ORDER))
                    .limit(limit)
                    .toList();
        }

        record Scored(Snippet snippet, int score) {
        }

        List<Scored> scored = new ArrayList<>();
        for (Snippet s : byName.values()) {
            int score = score(q, s);
            if (score >= MINIMUM_SCORE) {
                scored.add(new Scored(s, score));
            }
        }

        return scored.stream()
                .sorted(Comparator.comparingInt(Scored::score).reversed()
                        .thenComparing(sc -> sc.snippet().name(), String.CASE_INSENSITIVE_ORDER))
                .limit(limit)
                .map(Scored::snippet)
                .toList();
    }

    private static int score(String q, Snippet s) {
        String trigger = s.trigger().toLowerCase(Locale.ROOT);
        String name = s.name().toLowerCase(Locale.ROOT);

        if (!trigger.isEmpty() && trigger.equals(q)) {
            return EXACT_TRIGGER_SCORE;
        }
        if ((!trigger.isEmpty() && trigger.startsWith(q)) || name.startsWith(q)) {
            return PREFIX_SCORE - Math.min(name.length(), PREFIX_SCORE - MINIMUM_SCORE);
        }

        int nameScore = FuzzySearch.partialRatio(q, name);
        int descriptionScore = s.description().isEmpty()
                ? 0
                : FuzzySearch.partialRatio(q, s.description().toLowerCase(Locale.ROOT)) - 10;
        return Math.max(nameScore, descriptionScore);
    }
}
