package com.tyron.markj.core.folding;

import com.tyron.markj.api.folding.FoldRegion;
import com.tyron.markj.core.html.HtmlElements;
import com.tyron.markj.core.text.Indentation;
import com.tyron.markj.core.text.LineIndex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Computes foldable regions from line structure alone, without parsing any particular language.
 *
 * A line opens a region when, trimmed, it ends with an opening bracket, is a block keyword line
 * ending in {@code :} (such as {@code if x:}), starts a multi-line comment, or starts with an HTML
 * opening tag that is not closed on the same line. Prose ending in {@code :} opens nothing. The region runs until the line before the next non-blank line indented no deeper
 * than the opener; blank lines never end a region. Regions that would hide nothing are dropped.
 */
public final class FoldRegionDetector {

    private static final Pattern KEYWORD_BLOCK = Pattern.compile(
            "^(if|elif|else|for|while|def|class|try|except|finally|with)\\b.*:$");

    private static final Pattern OPENING_TAG = Pattern.compile("^<([A-Za-z][A-Za-z0-9:_.-]*)(?=[\\s/>]|$)");

    private final Logger log;

    public FoldRegionDetector() {
        this(Logger.getLogger(FoldRegionDetector.class.getName()));
    }

    public FoldRegionDetector(Logger log) {
        this.log = Objects.requireNonNull(log, "log");
    }

    /**
     * @return regions ordered by start line; nested regions are included
     */
    public List<FoldRegion> detect(CharSequence text) {
        Objects.requireNonNull(text, "text");

        LineIndex lines = LineIndex.of(text);
        int lineCount = lines.getLineCount();
        String[] content = new String[lineCount];
        for (int i = 0; i < lineCount; i++) {
            content[i] = lines.getLineText(text, i);
        }

        List<FoldRegion> regions = new ArrayList<>();
        for (int start = 0; start < lineCount; start++) {
            String line = content[start];
            if (!isFoldStart(line.trim())) {
                continue;
            }

            int indent = Indentation.measure(line);
            int end = lineCount - 1;
            for (int next = start + 1; next < lineCount; next++) {
                String candidate = content[next];
                if (Indentation.isBlank(candidate)) {
                    continue;
                }
                if (Indentation.measure(candidate) <= indent) {
                    end = next - 1;
                    break;
                }
            }

            if (end > start) {
                regions.add(new FoldRegion(start, end, indent));
            }
        }

        if (log.isLoggable(Level.FINE)) {
            log.fine("Detected " + regions.size() + " fold regions in " + lineCount + " lines");
        }
        return Collections.unmodifiableList(regions);
    }

    /**
     * @param trimmed a line with leading and trailing whitespace removed
     */
    public static boolean isFoldStart(String trimmed) {
        if (trimmed.isEmpty()) {
            return false;
        }

        char last = trimmed.charAt(trimmed.length() - 1);
        if (last == '{' || last == '[' || last == '(') {
            return true;
        }
        if (last == ':' && KEYWORD_BLOCK.matcher(trimmed).matches()) {
            return true;
        }

        if (trimmed.startsWith("/*") && !trimmed.contains("*/")) {
            return true;
        }
        if (trimmed.startsWith("<!--") && !trimmed.contains("-->")) {
            return true;
        }

        return isUnclosedOpeningTag(trimmed);
    }

    private static boolean isUnclosedOpeningTag(String trimmed) {
        Matcher m = OPENING_TAG.matcher(trimmed);
        if (!m.find()) {
            return false;
        }
        String name = m.group(1).toLowerCase(Locale.ROOT);
        if (HtmlElements.isVoidElement(name) || trimmed.endsWith("/>")) {
            return false;
        }
        return !trimmed.toLowerCase(Locale.ROOT).contains("</" + name);
    }
}
