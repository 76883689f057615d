package com.tyron.markj.desktop;

import com.formdev.flatlaf.FlatDarkLaf;
import com.formdev.flatlaf.FlatLightLaf;
import com.tyron.markj.api.diagnostics.Diagnostic;
import com.tyron.markj.api.folding.FoldRegion;
import com.tyron.markj.core.bookmarks.BookmarkFile;
import com.tyron.markj.core.bookmarks.BookmarkStore;
import com.tyron.markj.core.editor.DocumentStructureIndex;
import com.tyron.markj.core.editor.HtmlEditorSession;
import com.tyron.markj.core.editor.StructureListener;
import com.tyron.markj.core.html.TagIndex;
import com.tyron.markj.core.html.check.AccessibilityChecker;
import com.tyron.markj.core.html.check.MarkupCheckers;
import com.tyron.markj.core.html.check.TagBalanceChecker;
import com.tyron.markj.core.settings.EditorSettings;
import com.tyron.markj.core.snippets.Snippet;
import com.tyron.markj.core.snippets.SnippetExpansion;
import com.tyron.markj.core.snippets.SnippetFile;
import com.tyron.markj.core.snippets.SnippetStore;
import com.tyron.markj.core.text.Indentation;
import com.tyron.markj.desktop.diagnostics.MarkupDiagnosticsParser;
import com.tyron.markj.desktop.folding.FoldSync;
import com.tyron.markj.desktop.folding.StructureFoldParser;
import org.fife.ui.rsyntaxtextarea.RSyntaxTextArea;
import org.fife.ui.rsyntaxtextarea.SyntaxConstants;
import org.fife.ui.rsyntaxtextarea.Theme;
import org.fife.ui.rsyntaxtextarea.folding.FoldParserManager;
import org.fife.ui.rtextarea.RTextScrollPane;

import javax.swing.*;
import java.awt.*;
import java.awt.event.ActionEvent;
import java.awt.event.InputEvent;
import java.awt.event.KeyEvent;
import java.awt.event.WindowAdapter;
import java.awt.event.WindowEvent;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Single-window HTML editor: {@code DesktopApp [file.html]}.
 */
public final class DesktopApp {

    private static final Logger LOG = Logger.getLogger(DesktopApp.class.getName());

    private final EditorSettings settings;
    private final Path file;

    private RSyntaxTextArea textArea;
    private HtmlEditorSession session;
    private BookmarkStore bookmarks;
    private BookmarkFile bookmarkFile;
    private SnippetStore snippets;
    private JLabel status;

    private DesktopApp(EditorSettings settings, Path file) {
        this.settings = settings;
        this.file = file;
    }

    public static void main(String[] args) {
        configureLogging();

        String display = System.getenv("DISPLAY");
        String wayland = System.getenv("WAYLAND_DISPLAY");
        if (!System.getProperty("os.name", "").startsWith("Windows")
                && !System.getProperty("os.name", "").startsWith("Mac")
                && (display == null || display.isBlank()) && (wayland == null || wayland.isBlank())) {
            System.err.println("markj: no DISPLAY/WAYLAND_DISPLAY; skipping UI startup.");
            System.err.println("Run this on a machine with a graphical session.");
            return;
        }

        EditorSettings settings;
        try {
            settings = EditorSettings.load(EditorSettings.defaultConfigDir());
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Could not read settings; using defaults", e);
            settings = EditorSettings.defaults(EditorSettings.defaultConfigDir());
        }
        LOG.info("Starting with " + settings);

        Path file = args.length > 0 ? Path.of(args[0]).toAbsolutePath() : null;
        EditorSettings finalSettings = settings;
        try {
            SwingUtilities.invokeLater(() -> {
                try {
                    new DesktopApp(finalSettings, file).start();
                } catch (IOException e) {
                    LOG.log(Level.SEVERE, "Failed to start", e);
                    System.exit(1);
                }
            });
        } catch (UnsatisfiedLinkError e) {
            LOG.log(Level.SEVERE, "Failed to load AWT native libraries; skipping UI startup.", e);
        }
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = DesktopApp.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("markj: failed to read logging.properties: " + e);
        }
    }

    private void start() throws IOException {
        boolean dark = !"light".equals(settings.getTheme());
        installLookAndFeel(dark);

        bookmarkFile = new BookmarkFile(settings.getBookmarksFile());
        bookmarks = bookmarkFile.load();
        snippets = loadSnippets();

        String initialText = file != null && Files.exists(file)
                ? Files.readString(file, StandardCharsets.UTF_8)
                : defaultHtml();

        FoldParserManager.get().addFoldParserMapping(SyntaxConstants.SYNTAX_STYLE_HTML, new StructureFoldParser());

        textArea = new RSyntaxTextArea(30, 100);
        textArea.setSyntaxEditingStyle(SyntaxConstants.SYNTAX_STYLE_HTML);
        textArea.setCodeFoldingEnabled(true);
        textArea.setAntiAliasingEnabled(true);
        textArea.setTabSize(settings.getIndentUnit());
        textArea.setText(initialText);
        textArea.setCaretPosition(0);
        textArea.discardAllEdits();
        applyEditorTheme(textArea, dark);

        SwingEditor editor = new SwingEditor(textArea);
        SwingTimerDebouncer debouncer = new SwingTimerDebouncer(settings.getRescanDelayMs());
        DocumentStructureIndex structure = new DocumentStructureIndex(
                editor.getDocument(), debouncer, settings.getIndentUnit());
        session = new HtmlEditorSession(editor, structure, bookmarks, documentPath(), MarkupCheckers.defaults());

        structure.getFoldingModel().addFoldingListener(new FoldSync(textArea));
        TagMatchHighlighter highlighter = new TagMatchHighlighter(textArea, session, dark);
        structure.addStructureListener(new StructureListener() {
            @Override
            public void structureUpdated(TagIndex index, List<FoldRegion> regions) {
                textArea.forceReparsing(0);
                updateStatus();
            }

            @Override
            public void structureFailed(Throwable error) {
                status.setText("Structure scan failed: " + error);
            }
        });
        textArea.addParser(new MarkupDiagnosticsParser(session, textArea));
        textArea.addCaretListener(e -> updateStatus());

        JFrame frame = new JFrame(title());
        frame.setDefaultCloseOperation(WindowConstants.DISPOSE_ON_CLOSE);
        frame.setLayout(new BorderLayout());
        frame.setJMenuBar(createMenuBar(frame));
        frame.add(new RTextScrollPane(textArea), BorderLayout.CENTER);

        status = new JLabel();
        status.setBorder(BorderFactory.createEmptyBorder(4, 8, 4, 8));
        frame.add(status, BorderLayout.SOUTH);

        frame.addWindowListener(new WindowAdapter() {
            @Override
            public void windowClosed(WindowEvent e) {
                try {
                    bookmarks.retainExistingFiles();
                    bookmarkFile.save(bookmarks);
                } catch (IOException ex) {
                    LOG.log(Level.WARNING, "Failed to save bookmarks to " + bookmarkFile.getPath(), ex);
                } finally {
                    highlighter.dispose();
                    session.dispose();
                    debouncer.dispose();
                    editor.getDocument().dispose();
                }
            }
        });

        refreshBookmarkHighlights();
        updateStatus();

        frame.pack();
        frame.setLocationRelativeTo(null);
        frame.setVisible(true);
    }

    private JMenuBar createMenuBar(JFrame frame) {
        JMenuBar bar = new JMenuBar();
        int menuMask = Toolkit.getDefaultToolkit().getMenuShortcutKeyMaskEx();

        JMenu fileMenu = new JMenu("File");
        fileMenu.add(item("Save", KeyStroke.getKeyStroke(KeyEvent.VK_S, menuMask), () -> save(frame)));
        fileMenu.addSeparator();
        fileMenu.add(item("Exit", KeyStroke.getKeyStroke(KeyEvent.VK_Q, menuMask), frame::dispose));
        bar.add(fileMenu);

        JMenu editMenu = new JMenu("Edit");
        editMenu.add(item("Jump to Matching Tag",
                KeyStroke.getKeyStroke(KeyEvent.VK_M, menuMask | InputEvent.SHIFT_DOWN_MASK),
                session::jumpToMatchingTag));
        editMenu.add(item("Insert Snippet...", KeyStroke.getKeyStroke(KeyEvent.VK_J, menuMask),
                () -> insertSnippet(frame)));
        bar.add(editMenu);

        JMenu foldMenu = new JMenu("Folding");
        foldMenu.add(item("Toggle Fold", KeyStroke.getKeyStroke(KeyEvent.VK_PERIOD, menuMask),
                session::toggleFoldAtCaret));
        foldMenu.add(item("Fold All", KeyStroke.getKeyStroke(KeyEvent.VK_MINUS, menuMask | InputEvent.SHIFT_DOWN_MASK),
                () -> session.getFoldingModel().foldAll()));
        foldMenu.add(item("Unfold All", KeyStroke.getKeyStroke(KeyEvent.VK_EQUALS, menuMask | InputEvent.SHIFT_DOWN_MASK),
                () -> session.getFoldingModel().unfoldAll()));
        JMenu levelMenu = new JMenu("Fold Level");
        for (int level = 0; level <= 4; level++) {
            int l = level;
            levelMenu.add(item("Level " + level, null, () -> session.getFoldingModel().foldAtLevel(l)));
        }
        foldMenu.add(levelMenu);
        bar.add(foldMenu);

        JMenu bookmarkMenu = new JMenu("Bookmarks");
        bookmarkMenu.add(item("Toggle Bookmark", KeyStroke.getKeyStroke(KeyEvent.VK_F2, menuMask), () -> {
            session.toggleBookmarkAtCaret();
            refreshBookmarkHighlights();
        }));
        bookmarkMenu.add(item("Next Bookmark", KeyStroke.getKeyStroke(KeyEvent.VK_F2, 0), session::nextBookmark));
        bookmarkMenu.add(item("Previous Bookmark", KeyStroke.getKeyStroke(KeyEvent.VK_F2, InputEvent.SHIFT_DOWN_MASK),
                session::previousBookmark));
        bar.add(bookmarkMenu);

        JMenu toolsMenu = new JMenu("Tools");
        toolsMenu.add(item("Validate HTML", KeyStroke.getKeyStroke(KeyEvent.VK_F7, 0),
                () -> showDiagnostics(frame, "Validate HTML", TagBalanceChecker.ID)));
        toolsMenu.add(item("Check Accessibility", KeyStroke.getKeyStroke(KeyEvent.VK_F8, 0),
                () -> showDiagnostics(frame, "Check Accessibility", AccessibilityChecker.ID)));
        bar.add(toolsMenu);

        return bar;
    }

    private static JMenuItem item(String text, KeyStroke accelerator, Runnable action) {
        JMenuItem item = new JMenuItem(new AbstractAction(text) {
            @Override
            public void actionPerformed(ActionEvent e) {
                action.run();
            }
        });
        if (accelerator != null) {
            item.setAccelerator(accelerator);
        }
        return item;
    }

    private void save(JFrame frame) {
        Path target = file;
        if (target == null) {
            JFileChooser chooser = new JFileChooser();
            if (chooser.showSaveDialog(frame) != JFileChooser.APPROVE_OPTION) {
                return;
            }
            target = chooser.getSelectedFile().toPath();
        }
        try {
            Files.writeString(target, textArea.getText(), StandardCharsets.UTF_8);
            status.setText("Saved " + target);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to save " + target, e);
            JOptionPane.showMessageDialog(frame, "Could not save " + target + ":\n" + e.getMessage(),
                    "Save", JOptionPane.ERROR_MESSAGE);
        }
    }

    private void insertSnippet(JFrame frame) {
        String query = JOptionPane.showInputDialog(frame, "Snippet:", "Insert Snippet", JOptionPane.PLAIN_MESSAGE);
        if (query == null) {
            return;
        }
        List<Snippet> found = snippets.search(query, 20);
        if (found.isEmpty()) {
            status.setText("No snippet matches '" + query + "'");
            return;
        }

        Snippet chosen = found.get(0);
        if (found.size() > 1) {
            String[] names = found.stream().map(Snippet::name).toArray(String[]::new);
            Object picked = JOptionPane.showInputDialog(frame, "Choose a snippet:", "Insert Snippet",
                    JOptionPane.PLAIN_MESSAGE, null, names, names[0]);
            if (picked == null) {
                return;
            }
            chosen = snippets.get((String) picked).orElse(chosen);
        }

        int caret = textArea.getSelectionStart();
        var document = session.getEditor().getDocument();
        int lineStart = document.getLineStartOffset(document.getLineNumber(caret));
        String indent = Indentation.leadingWhitespace(document.getText(lineStart, caret - lineStart));

        SnippetExpansion expansion = chosen.expand(indent);
        textArea.replaceSelection(expansion.text());
        textArea.setCaretPosition(caret + expansion.caretOffset());
    }

    private void showDiagnostics(JFrame frame, String title, String checkerId) {
        DefaultListModel<String> model = new DefaultListModel<>();
        for (Diagnostic d : session.getDiagnostics()) {
            if (!checkerId.equals(d.getSource())) continue;
            int line = session.getEditor().getDocument().getLineNumber(d.getStartOffset()) + 1;
            model.addElement(d.getSeverity() + "  line " + line + ": " + d.getMessage() + " [" + d.getCode() + "]");
        }
        if (model.isEmpty()) {
            JOptionPane.showMessageDialog(frame, "No problems found.", title, JOptionPane.INFORMATION_MESSAGE);
            return;
        }
        JList<String> list = new JList<>(model);
        list.setVisibleRowCount(Math.min(15, model.size()));
        JOptionPane.showMessageDialog(frame, new JScrollPane(list), title, JOptionPane.WARNING_MESSAGE);
    }

    private void refreshBookmarkHighlights() {
        textArea.removeAllLineHighlights();
        Color color = new Color(0x55, 0x8B, 0xD6, 0x40);
        int lineCount = textArea.getLineCount();
        for (int line : bookmarks.getLines(documentPath())) {
            if (line >= lineCount) continue;
            try {
                textArea.addLineHighlight(line, color);
            } catch (javax.swing.text.BadLocationException e) {
                LOG.log(Level.FINE, "Bookmark line " + line + " no longer in document", e);
            }
        }
    }

    private void updateStatus() {
        if (status == null) {
            return;
        }
        int caret = textArea.getCaretPosition();
        int line = textArea.getCaretLineNumber() + 1;
        int column = textArea.getCaretOffsetFromLineStart() + 1;
        String tag = session.getStructure().isStale() ? "..." : session.matchAtCaret().getKind().name();
        status.setText("Ln " + line + ", Col " + column + "   Offset " + caret
                + "   Tag: " + tag
                + "   Folds: " + session.getFoldingModel().getRegions().size()
                + "   Bookmarks: " + bookmarks.getLines(documentPath()).size());
    }

    private SnippetStore loadSnippets() {
        SnippetStore store = new SnippetStore();
        try {
            SnippetFile.loadBuiltins().forEach(store::put);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to load built-in snippets", e);
        }
        try {
            new SnippetFile(settings.getSnippetsFile()).load().forEach(store::put);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to load snippets from " + settings.getSnippetsFile(), e);
        }
        return store;
    }

    private String documentPath() {
        return file != null ? file.toString() : "untitled.html";
    }

    private String title() {
        return "markj - " + (file != null ? file.getFileName() : "untitled.html");
    }

    private static void installLookAndFeel(boolean dark) {
        try {
            UIManager.setLookAndFeel(dark ? new FlatDarkLaf() : new FlatLightLaf());
        } catch (UnsupportedLookAndFeelException e) {
            LOG.log(Level.WARNING, "FlatLaf unavailable; using the platform look and feel", e);
        }
    }

    private static void applyEditorTheme(RSyntaxTextArea editor, boolean dark) {
        String resource = dark
                ? "/org/fife/ui/rsyntaxtextarea/themes/dark.xml"
                : "/org/fife/ui/rsyntaxtextarea/themes/default.xml";
        try (InputStream in = DesktopApp.class.getResourceAsStream(resource)) {
            if (in == null) {
                LOG.warning("Missing editor theme " + resource);
                return;
            }
            Theme.load(in).apply(editor);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to apply editor theme " + resource, e);
        }
    }

    private static String defaultHtml() {
        return "<!DOCTYPE html>\n" +
                "<html lang=\"en\">\n" +
                "    <head>\n" +
                "        <meta charset=\"utf-8\">\n" +
                "        <title>Untitled</title>\n" +
                "    </head>\n" +
                "    <body>\n" +
                "        <h1>Hello</h1>\n" +
                "        <p>\n" +
                "            Edit me.\n" +
                "        </p>\n" +
                "    </body>\n" +
                "</html>\n";
    }
}
