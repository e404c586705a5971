package genko;

import javax.swing.*;
import javax.swing.border.EmptyBorder;
import java.awt.*;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Minimal host window for one manuscript: the pane in a scroll pane plus a status line.
 * Usage: {@code GenkoApp [file]}.
 */
public class GenkoApp extends JFrame {

    private final ManuscriptDocument doc = new ManuscriptDocument();
    private final ManuscriptPane pane = new ManuscriptPane(doc);
    private final JLabel status = new JLabel("Ready.");
    private final ThemeManager themes = new ThemeManager();

    public static void main(String[] args) {
        SwingUtilities.invokeLater(() -> {
            GenkoApp app = new GenkoApp();
            if (args.length > 0) {
                app.open(Path.of(args[0]));
            }
            app.setVisible(true);
        });
    }

    public GenkoApp() {
        super("Genko");
        setDefaultCloseOperation(EXIT_ON_CLOSE);
        setMinimumSize(new Dimension(900, 700));

        themes.apply(pane);

        JScrollPane scroll = new JScrollPane(pane);
        scroll.setBorder(new EmptyBorder(4, 4, 4, 4));
        scroll.getViewport().setBackground(pane.palette().background());

        status.setBorder(new EmptyBorder(4, 10, 4, 10));
        getContentPane().add(scroll, BorderLayout.CENTER);
        getContentPane().add(status, BorderLayout.SOUTH);

        doc.addListener(new ManuscriptListener() {
            @Override public void cursorPositionChanged(CursorPosition position) { refreshStatus(); }
            @Override public void dirtyChanged(boolean dirty) { refreshStatus(); }
            @Override public void characterCountChanged(int count) { refreshStatus(); }
        });
        refreshStatus();
    }

    void open(Path path) {
        try {
            String raw = Files.readString(path);
            doc.setPlainText(raw);
            setTitle("Genko - " + path.getFileName());
        } catch (IOException ex) {
            status.setText("Failed to read " + path + ": " + ex.getMessage());
        }
    }

    private void refreshStatus() {
        String dirty = doc.isDirty() ? "Modified" : "Saved";
        status.setText(doc.currentPosition() + " | " + doc.characterCount() + " chars | "
                + doc.layout().totalPages() + " page(s) | " + dirty);
    }
}
