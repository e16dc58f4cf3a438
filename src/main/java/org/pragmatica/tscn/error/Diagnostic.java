package org.pragmatica.tscn.error;

import org.pragmatica.tscn.parser.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Diagnostic message recorded while recovering from scene errors.
 *
 * <p>Example output:
 * <pre>
 * error: Parse error at 7:1: unknown section [nodee]
 *   --> player.tscn:7:1
 *    |
 *  7 | [nodee name="Sprite" type="Sprite2D" parent="."]
 *    | ^
 *    = note: section skipped
 * </pre>
 *
 * @param severity Severity level
 * @param message  Primary message
 * @param location Where the problem starts
 * @param notes    Additional notes
 */
public record Diagnostic(
    Severity severity,
    String message,
    SourceLocation location,
    List<String> notes
) {
    public enum Severity {
        ERROR("error"),
        WARNING("warning");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    public Diagnostic {
        notes = List.copyOf(notes);
    }

    public static Diagnostic error(ParseError error) {
        return new Diagnostic(Severity.ERROR, error.message(), error.location(), List.of());
    }

    public static Diagnostic warning(String message, SourceLocation location) {
        return new Diagnostic(Severity.WARNING, message, location, List.of());
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(severity, message, location, newNotes);
    }

    /**
     * Format with the offending source line and a caret under the column.
     *
     * @param source   The scene text
     * @param filename Optional filename for display
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\r?\n", -1);

        sb.append(severity.display()).append(": ").append(message).append("\n");
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(location.line()).append(":").append(location.column()).append("\n");

        int gutterWidth = String.valueOf(location.line()).length();
        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        if (location.line() >= 1 && location.line() <= lines.length) {
            var lineNumStr = String.format("%" + gutterWidth + "d", location.line());
            sb.append(lineNumStr).append(" | ").append(lines[location.line() - 1]).append("\n");
            sb.append(" ".repeat(gutterWidth)).append(" | ")
              .append(" ".repeat(Math.max(0, location.column() - 1)))
              .append("^\n");
        }

        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1)).append("= note: ").append(note).append("\n");
        }
        return sb.toString();
    }

    /**
     * Single-line form for logs.
     */
    public String formatSimple() {
        return String.format("%d:%d: %s: %s", location.line(), location.column(), severity.display(), message);
    }
}
