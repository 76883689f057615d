package com.tyron.markj.desktop;

import com.tyron.markj.api.editor.Editor;

import javax.swing.text.BadLocationException;
import javax.swing.text.JTextComponent;
import java.awt.geom.Rectangle2D;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

final class SwingEditor implements Editor {

    private static final Logger LOG = Logger.getLogger(SwingEditor.class.getName());

    private final JTextComponent component;
    private final SwingTextDocument document;
    private final Carets carets;

    SwingEditor(JTextComponent component) {
        this.component = Objects.requireNonNull(component, "component");
        this.document = new SwingTextDocument(component);
        this.carets = new Carets() {
            @Override
            public int getOffset() {
                return component.getCaretPosition();
            }

            @Override
            public void moveToOffset(int offset) {
                component.setCaretPosition(Math.max(0, Math.min(offset, component.getDocument().getLength())));
            }
        };
    }

    @Override
    public SwingTextDocument getDocument() {
        return document;
    }

    @Override
    public Carets getCaretModel() {
        return carets;
    }

    @Override
    public void scrollToCaret() {
        try {
            Rectangle2D r = component.modelToView2D(component.getCaretPosition());
            if (r != null) {
                component.scrollRectToVisible(r.getBounds());
            }
        } catch (BadLocationException e) {
            LOG.log(Level.WARNING, "Caret outside document", e);
        }
    }
}
