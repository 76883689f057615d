package com.tyron.markj.desktop.diagnostics;

import com.tyron.markj.api.diagnostics.Diagnostic;
import com.tyron.markj.api.diagnostics.DiagnosticSeverity;
import com.tyron.markj.core.editor.HtmlEditorSession;
import org.fife.ui.rsyntaxtextarea.RSyntaxDocument;
import org.fife.ui.rsyntaxtextarea.RSyntaxTextArea;
import org.fife.ui.rsyntaxtextarea.parser.AbstractParser;
import org.fife.ui.rsyntaxtextarea.parser.DefaultParseResult;
import org.fife.ui.rsyntaxtextarea.parser.DefaultParserNotice;
import org.fife.ui.rsyntaxtextarea.parser.ParseResult;
import org.fife.ui.rsyntaxtextarea.parser.ParserNotice;

import javax.swing.text.BadLocationException;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bridges the markup checkers' diagnostics into RSyntaxTextArea's parser/notice system.
 */
public final class MarkupDiagnosticsParser extends AbstractParser {

    private static final Logger LOG = Logger.getLogger(MarkupDiagnosticsParser.class.getName());

    private final HtmlEditorSession session;
    private final RSyntaxTextArea textArea;

    public MarkupDiagnosticsParser(HtmlEditorSession session, RSyntaxTextArea textArea) {
        this.session = Objects.requireNonNull(session, "session");
        this.textArea = Objects.requireNonNull(textArea, "textArea");
    }

    @Override
    public ParseResult parse(RSyntaxDocument doc, String style) {
        DefaultParseResult result = new DefaultParseResult(this);

        List<Diagnostic> diags;
        try {
            diags = session.getDiagnostics();
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "Markup checkers failed", e);
            result.setError(e);
            return result;
        }

        int length = doc.getLength();
        for (Diagnostic d : diags) {
            int start = Math.max(0, Math.min(d.getStartOffset(), length));
            int end = Math.max(start, Math.min(d.getEndOffset(), length));
            int len = Math.max(1, end - start);

            int line;
            try {
                line = textArea.getLineOfOffset(start);
            } catch (BadLocationException e) {
                line = 0;
            }

            String message = d.getCode() != null ? d.getMessage() + " [" + d.getCode() + "]" : d.getMessage();
            DefaultParserNotice notice = new DefaultParserNotice(this, message, line, start, len);
            notice.setLevel(toLevel(d.getSeverity()));
            notice.setShowInEditor(true);
            result.addNotice(notice);
        }

        return result;
    }

    static ParserNotice.Level toLevel(DiagnosticSeverity s) {
        if (s == null) return ParserNotice.Level.INFO;
        return switch (s) {
            case ERROR -> ParserNotice.Level.ERROR;
            case WARNING -> ParserNotice.Level.WARNING;
            case INFO -> ParserNotice.Level.INFO;
        };
    }
}
