package com.tyron.markj.core.html.check;

import com.tyron.markj.api.diagnostics.Diagnostic;
import com.tyron.markj.api.diagnostics.DiagnosticSeverity;
import com.tyron.markj.api.diagnostics.MarkupChecker;
import com.tyron.markj.api.html.TagMatch;
import com.tyron.markj.api.html.TagToken;
import com.tyron.markj.core.html.HtmlElements;
import com.tyron.markj.core.html.TagPairMatcher;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Lightweight accessibility lint over the tag tokens of a document.
 *
 * <ul>
 *   <li>{@code img-alt}: {@code <img>} without an {@code alt} attribute</li>
 *   <li>{@code heading-order}: a heading that skips a level, e.g. {@code h2} followed by {@code h4}</li>
 *   <li>{@code multiple-h1}: every {@code h1} after the first (info)</li>
 *   <li>{@code aria-unknown}: an {@code aria-*} attribute that is not defined by WAI-ARIA</li>
 *   <li>{@code role-unknown}: a {@code role} value that is not a WAI-ARIA role</li>
 *   <li>{@code html-lang}: {@code <html>} without a non-blank {@code lang}</li>
 *   <li>{@code empty-interactive}: {@code <a>} or {@code <button>} with no text and no accessible label</li>
 * </ul>
 */
public final class AccessibilityChecker implements MarkupChecker {

    public static final String ID = "a11y";

    public static final String IMG_ALT = "img-alt";
    public static final String HEADING_ORDER = "heading-order";
    public static final String MULTIPLE_H1 = "multiple-h1";
    public static final String ARIA_UNKNOWN = "aria-unknown";
    public static final String ROLE_UNKNOWN = "role-unknown";
    public static final String HTML_LANG = "html-lang";
    public static final String EMPTY_INTERACTIVE = "empty-interactive";

    static final Set<String> ARIA_ATTRIBUTES = Set.of(
            "aria-activedescendant", "aria-atomic", "aria-autocomplete", "aria-braillelabel",
            "aria-brailleroledescription", "aria-busy", "aria-checked", "aria-colcount", "aria-colindex",
            "aria-colindextext", "aria-colspan", "aria-controls", "aria-current", "aria-describedby",
            "aria-description", "aria-details", "aria-disabled", "aria-dropeffect", "aria-errormessage",
            "aria-expanded", "aria-flowto", "aria-grabbed", "aria-haspopup", "aria-hidden", "aria-invalid",
            "aria-keyshortcuts", "aria-label", "aria-labelledby", "aria-level", "aria-live", "aria-modal",
            "aria-multiline", "aria-multiselectable", "aria-orientation", "aria-owns", "aria-placeholder",
            "aria-posinset", "aria-pressed", "aria-readonly", "aria-relevant", "aria-required",
            "aria-roledescription", "aria-rowcount", "aria-rowindex", "aria-rowindextext", "aria-rowspan",
            "aria-selected", "aria-setsize", "aria-sort", "aria-valuemax", "aria-valuemin", "aria-valuenow",
            "aria-valuetext");

    static final Set<String> ROLES = Set.of(
            "alert", "alertdialog", "application", "article", "banner", "blockquote", "button", "caption",
            "cell", "checkbox", "code", "columnheader", "combobox", "complementary", "contentinfo",
            "definition", "deletion", "dialog", "directory", "document", "emphasis", "feed", "figure", "form",
            "generic", "grid", "gridcell", "group", "heading", "img", "insertion", "link", "list", "listbox",
            "listitem", "log", "main", "marquee", "math", "menu", "menubar", "menuitem", "menuitemcheckbox",
            "menuitemradio", "meter", "navigation", "none", "note", "option", "paragraph", "presentation",
            "progressbar", "radio", "radiogroup", "region", "row", "rowgroup", "rowheader", "scrollbar",
            "search", "searchbox", "separator", "slider", "spinbutton", "status", "strong", "subscript",
            "superscript", "switch", "tab", "table", "tablist", "tabpanel", "term", "textbox", "time", "timer",
            "toolbar", "tooltip", "tree", "treegrid", "treeitem");

    private final TagPairMatcher matcher = new TagPairMatcher();

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public List<Diagnostic> check(List<TagToken> tokens, String text) {
        List<Diagnostic> out = new ArrayList<>();
        int previousHeading = 0;
        boolean seenH1 = false;

        for (TagToken token : tokens) {
            if (token.isClosing()) {
                continue;
            }
            String name = token.getName();
            Map<String, String> attributes = token.getAttributes();

            checkAria(token, attributes, out);

            int level = HtmlElements.headingLevel(name);
            if (level > 0) {
                if (previousHeading > 0 && level > previousHeading + 1) {
                    out.add(warning(token, HEADING_ORDER,
                            "Heading <" + name + "> skips from level " + previousHeading + " to " + level));
                }
                if (level == 1) {
                    if (seenH1) {
                        out.add(new Diagnostic(DiagnosticSeverity.INFO, token.getStartOffset(), token.getEndOffset(),
                                "Document has more than one <h1>", MULTIPLE_H1, ID));
                    }
                    seenH1 = true;
                }
                previousHeading = level;
            }

            switch (name) {
                case "img":
                    if (!attributes.containsKey("alt")) {
                        out.add(warning(token, IMG_ALT, "<img> is missing an alt attribute"));
                    }
                    break;
                case "html":
                    if (isBlank(attributes.get("lang"))) {
                        out.add(warning(token, HTML_LANG, "<html> should declare the document language with lang"));
                    }
                    break;
                case "a":
                case "button":
                    if (!hasAccessibleName(token, attributes, tokens, text)) {
                        out.add(warning(token, EMPTY_INTERACTIVE,
                                "<" + name + "> has no text content and no aria-label"));
                    }
                    break;
                default:
                    break;
            }
        }
        return out;
    }

    private static void checkAria(TagToken token, Map<String, String> attributes, List<Diagnostic> out) {
        for (Map.Entry<String, String> attribute : attributes.entrySet()) {
            String key = attribute.getKey();
            if (key.startsWith("aria-") && !ARIA_ATTRIBUTES.contains(key)) {
                out.add(warning(token, ARIA_UNKNOWN, "Unknown ARIA attribute '" + key + "'"));
            }
        }

        String role = attributes.get("role");
        if (role == null) {
            return;
        }
        // role may list fallbacks separated by whitespace
        for (String value : role.trim().toLowerCase(Locale.ROOT).split("\\s+")) {
            if (!value.isEmpty() && !ROLES.contains(value)) {
                out.add(warning(token, ROLE_UNKNOWN, "Unknown role '" + value + "'"));
            }
        }
    }

    private boolean hasAccessibleName(TagToken token, Map<String, String> attributes,
                                      List<TagToken> tokens, String text) {
        if (!isBlank(attributes.get("aria-label"))
                || !isBlank(attributes.get("aria-labelledby"))
                || !isBlank(attributes.get("title"))) {
            return true;
        }
        if (token.isSelfClosing()) {
            return false;
        }

        TagMatch match = matcher.match(tokens, token.getStartOffset());
        if (!match.isMatched()) {
            // Nothing to inspect; the balance checker reports the missing end tag.
            return true;
        }
        int contentStart = token.getEndOffset();
        int contentEnd = Math.min(match.getPartner().orElseThrow().getStartOffset(), text.length());

        int cursor = contentStart;
        int index = TagPairMatcher.indexOfTokenAt(tokens, token.getStartOffset()) + 1;
        while (cursor < contentEnd) {
            TagToken inner = index < tokens.size() ? tokens.get(index) : null;
            int limit = inner != null ? Math.min(inner.getStartOffset(), contentEnd) : contentEnd;
            if (!isBlank(text.substring(cursor, limit))) {
                return true;
            }
            if (inner == null || inner.getStartOffset() >= contentEnd) {
                break;
            }
            if ("img".equals(inner.getName()) && !isBlank(inner.getAttributes().get("alt"))) {
                return true;
            }
            cursor = inner.getEndOffset();
            index++;
        }
        return false;
    }

    private static Diagnostic warning(TagToken token, String code, String message) {
        return new Diagnostic(DiagnosticSeverity.WARNING, token.getStartOffset(), token.getEndOffset(), message, code, ID);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
