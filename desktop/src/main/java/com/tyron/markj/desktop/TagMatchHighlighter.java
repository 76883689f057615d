package com.tyron.markj.desktop;

import com.tyron.markj.api.editor.HighlightSpan;
import com.tyron.markj.api.folding.FoldRegion;
import com.tyron.markj.api.service.Disposable;
import com.tyron.markj.core.editor.HtmlEditorSession;
import com.tyron.markj.core.editor.StructureListener;
import com.tyron.markj.core.html.TagIndex;

import javax.swing.event.CaretEvent;
import javax.swing.event.CaretListener;
import javax.swing.text.BadLocationException;
import javax.swing.text.DefaultHighlighter;
import javax.swing.text.Highlighter;
import javax.swing.text.JTextComponent;
import java.awt.Color;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Paints the tag under the caret and its partner.
 *
 * Repaints on caret moves and after every structure rescan, so highlights follow edits once the
 * rescan delay has elapsed.
 */
final class TagMatchHighlighter implements CaretListener, StructureListener, Disposable {

    private static final Logger LOG = Logger.getLogger(TagMatchHighlighter.class.getName());

    private final JTextComponent component;
    private final HtmlEditorSession session;
    private final Map<HighlightSpan.Kind, Highlighter.HighlightPainter> painters = new EnumMap<>(HighlightSpan.Kind.class);
    private final List<Object> tags = new ArrayList<>();

    TagMatchHighlighter(JTextComponent component, HtmlEditorSession session, boolean dark) {
        this.component = component;
        this.session = session;
        painters.put(HighlightSpan.Kind.MATCHED_TAG,
                new DefaultHighlighter.DefaultHighlightPainter(dark ? new Color(0x3B514D) : new Color(0xC8E6C9)));
        painters.put(HighlightSpan.Kind.UNMATCHED_TAG,
                new DefaultHighlighter.DefaultHighlightPainter(dark ? new Color(0x6B2E2E) : new Color(0xFFCDD2)));
        painters.put(HighlightSpan.Kind.SELF_CLOSING_TAG,
                new DefaultHighlighter.DefaultHighlightPainter(dark ? new Color(0x3A4A63) : new Color(0xBBDEFB)));

        component.addCaretListener(this);
        session.getStructure().addStructureListener(this);
    }

    @Override
    public void caretUpdate(CaretEvent e) {
        refresh();
    }

    @Override
    public void structureUpdated(TagIndex index, List<FoldRegion> regions) {
        refresh();
    }

    void refresh() {
        Highlighter highlighter = component.getHighlighter();
        for (Object tag : tags) {
            highlighter.removeHighlight(tag);
        }
        tags.clear();

        if (session.getStructure().isStale()) {
            // Offsets may no longer line up with the text; wait for the rescan.
            return;
        }

        int length = component.getDocument().getLength();
        for (HighlightSpan span : session.tagHighlightsAtCaret()) {
            if (span.end() > length) continue;
            try {
                tags.add(highlighter.addHighlight(span.start(), span.end(), painters.get(span.kind())));
            } catch (BadLocationException e) {
                LOG.log(Level.WARNING, "Cannot highlight " + span, e);
            }
        }
    }

    @Override
    public void dispose() {
        component.removeCaretListener(this);
        session.getStructure().removeStructureListener(this);
        Highlighter highlighter = component.getHighlighter();
        for (Object tag : tags) {
            highlighter.removeHighlight(tag);
        }
        tags.clear();
    }
}
