package com.tyron.markj.core.html;

import com.tyron.markj.api.html.TagMatch;
import com.tyron.markj.api.html.TagToken;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable tag token list for one text snapshot.
 *
 * This is the single token source for a document: tag matching, caret highlighting and the markup
 * checkers all query it instead of scanning the text again.
 */
public final class TagIndex {

    private static final TagPairMatcher MATCHER = new TagPairMatcher();

    private static final TagIndex EMPTY = new TagIndex(List.of(), 0, -1L);

    private final List<TagToken> tokens;
    private final int textLength;
    private final long modificationStamp;

    private TagIndex(List<TagToken> tokens, int textLength, long modificationStamp) {
        this.tokens = tokens;
        this.textLength = textLength;
        this.modificationStamp = modificationStamp;
    }

    public static TagIndex empty() {
        return EMPTY;
    }

    public static TagIndex build(HtmlTagTokenizer tokenizer, CharSequence text, long modificationStamp) {
        Objects.requireNonNull(tokenizer, "tokenizer");
        Objects.requireNonNull(text, "text");
        return new TagIndex(tokenizer.tokenize(text), text.length(), modificationStamp);
    }

    public @NotNull List<TagToken> getTokens() {
        return tokens;
    }

    public int getTextLength() {
        return textLength;
    }

    /**
     * @return stamp of the document state this index was built from, -1 for {@link #empty()}
     */
    public long getModificationStamp() {
        return modificationStamp;
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public @NotNull Optional<TagToken> tokenAt(int offset) {
        int index = TagPairMatcher.indexOfTokenAt(tokens, offset);
        return index < 0 ? Optional.empty() : Optional.of(tokens.get(index));
    }

    public @NotNull TagMatch match(int offset) {
        return MATCHER.match(tokens, offset);
    }

    public @NotNull List<TagToken> tokensNamed(String name) {
        String wanted = name.toLowerCase(Locale.ROOT);
        List<TagToken> result = new ArrayList<>();
        for (TagToken token : tokens) {
            if (token.getName().equals(wanted)) {
                result.add(token);
            }
        }
        return result;
    }
}
