package com.tyron.markj.core.html.check;

import com.tyron.markj.api.diagnostics.Diagnostic;
import com.tyron.markj.api.diagnostics.DiagnosticSeverity;
import com.tyron.markj.core.html.HtmlTagTokenizer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TagBalanceCheckerTest {

    private final TagBalanceChecker checker = new TagBalanceChecker();

    private List<Diagnostic> check(String text) {
        return checker.check(new HtmlTagTokenizer().tokenize(text), text);
    }

    @Test
    public void balancedDocumentHasNoDiagnostics() {
        assertTrue(check("<html><body><p>a<br>b<img src=x></p><hr/></body></html>").isEmpty());
    }

    @Test
    public void reportsUnclosedOpeningTag() {
        List<Diagnostic> diags = check("<div><p>text</div>");

        assertEquals(1, diags.size());
        Diagnostic d = diags.get(0);
        assertEquals(DiagnosticSeverity.ERROR, d.getSeverity());
        assertEquals(TagBalanceChecker.UNMATCHED_OPEN, d.getCode());
        assertEquals(TagBalanceChecker.ID, d.getSource());
        assertEquals(5, d.getStartOffset());
        assertEquals(8, d.getEndOffset());
    }

    @Test
    public void reportsStrayClosingTag() {
        List<Diagnostic> diags = check("<p>a</p></span>");

        assertEquals(1, diags.size());
        assertEquals(TagBalanceChecker.STRAY_CLOSE, diags.get(0).getCode());
        assertEquals(8, diags.get(0).getStartOffset());
    }

    @Test
    public void voidElementsAreNeverReported() {
        assertTrue(check("<br><input type=text></br>").isEmpty());
    }

    @Test
    public void diagnosticsAreOrderedByOffset() {
        List<Diagnostic> diags = check("</b><i><u>");

        assertEquals(3, diags.size());
        assertEquals(0, diags.get(0).getStartOffset());
        assertEquals(4, diags.get(1).getStartOffset());
        assertEquals(7, diags.get(2).getStartOffset());
    }
}
