package com.tyron.markj.api.html;

import com.tyron.markj.api.editor.HighlightSpan;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of asking "which tag is at this offset, and where is its partner?".
 *
 * Every outcome is a normal result; none of them signal an error.
 */
public final class TagMatch {

    public enum Kind {
        /** No tag contains the offset. */
        NO_TAG,
        /** The tag at the offset is self-closing and has no partner. */
        SELF_CLOSING,
        /** The tag at the offset has no partner in the document. */
        UNMATCHED,
        /** The tag at the offset and its partner were both found. */
        MATCHED
    }

    private static final TagMatch NONE = new TagMatch(Kind.NO_TAG, null, null);

    private final Kind kind;
    private final TagToken token;
    private final TagToken partner;

    private TagMatch(Kind kind, TagToken token, TagToken partner) {
        this.kind = kind;
        this.token = token;
        this.partner = partner;
    }

    public static TagMatch noTag() {
        return NONE;
    }

    public static TagMatch selfClosing(@NotNull TagToken token) {
        return new TagMatch(Kind.SELF_CLOSING, Objects.requireNonNull(token, "token"), null);
    }

    public static TagMatch unmatched(@NotNull TagToken token) {
        return new TagMatch(Kind.UNMATCHED, Objects.requireNonNull(token, "token"), null);
    }

    public static TagMatch matched(@NotNull TagToken token, @NotNull TagToken partner) {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(partner, "partner");
        TagMatch match = new TagMatch(Kind.MATCHED, token, partner);
        // Validates ordering and names.
        match.toPair();
        return match;
    }

    public @NotNull Kind getKind() {
        return kind;
    }

    public boolean isMatched() {
        return kind == Kind.MATCHED;
    }

    /**
     * @return the tag at the queried offset, or null for {@link Kind#NO_TAG}
     */
    public @Nullable TagToken getToken() {
        return token;
    }

    public @NotNull Optional<TagToken> getPartner() {
        return Optional.ofNullable(partner);
    }

    /**
     * @return the opening/closing pair, present only for {@link Kind#MATCHED}
     */
    public @NotNull Optional<TagPair> toPair() {
        if (kind != Kind.MATCHED) {
            return Optional.empty();
        }
        return Optional.of(token.isClosing() ? new TagPair(partner, token) : new TagPair(token, partner));
    }

    /**
     * Ranges to paint for this result: none, the lone tag, or the tag and its partner in document order.
     */
    public @NotNull List<HighlightSpan> toHighlightSpans() {
        switch (kind) {
            case SELF_CLOSING:
                return List.of(span(token, HighlightSpan.Kind.SELF_CLOSING_TAG));
            case UNMATCHED:
                return List.of(span(token, HighlightSpan.Kind.UNMATCHED_TAG));
            case MATCHED: {
                TagPair pair = toPair().orElseThrow();
                return List.of(
                        span(pair.opening(), HighlightSpan.Kind.MATCHED_TAG),
                        span(pair.closing(), HighlightSpan.Kind.MATCHED_TAG));
            }
            default:
                return List.of();
        }
    }

    private static HighlightSpan span(TagToken t, HighlightSpan.Kind kind) {
        return new HighlightSpan(t.getStartOffset(), t.getLength(), kind);
    }

    @Override
    public String toString() {
        return "TagMatch{" + kind + ", token=" + token + ", partner=" + partner + '}';
    }
}
