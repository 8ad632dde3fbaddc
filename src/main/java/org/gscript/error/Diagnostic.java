package org.gscript.error;

import org.gscript.tree.SourceSpan;

import java.util.Optional;

/**
 * Error report in Rust style, pointing at the source line where the failure happened.
 *
 * <p>Example output:
 * <pre>
 * error[runtime]: undefined variable 'total'
 *   --> main.gs:3:7
 *   |
 * 3 | print(total + 1);
 *   |       ^^^^^ runtime error
 *   |
 * </pre>
 *
 * Only the first line of a span is shown; a span running past it is underlined to the end of that line.
 *
 * @param code    failure kind shown in brackets
 * @param message primary error message
 * @param span    source span where the error occurred
 * @param label   text printed after the underline, may be empty
 */
public record Diagnostic(
    String code,
    String message,
    SourceSpan span,
    String label
) {
    public static Diagnostic error(String code, String message, SourceSpan span) {
        return new Diagnostic(code, message, span, "");
    }

    public Diagnostic withLabel(String newLabel) {
        return new Diagnostic(code, message, span, newLabel);
    }

    /**
     * Render the report against the script source.
     *
     * @param filename name shown in the location line, or {@code null} for none
     */
    public String format(String source, String filename) {
        var start = span.start();
        var gutter = " ".repeat(String.valueOf(start.line()).length());

        var sb = new StringBuilder();
        sb.append("error[").append(code).append("]: ").append(message).append("\n");
        sb.append("  --> ").append(location(filename)).append("\n");
        sb.append(gutter).append(" |\n");

        sourceLine(source, start.line()).ifPresent(text -> {
            sb.append(start.line()).append(" | ").append(text).append("\n");
            sb.append(gutter).append(" | ")
              .append(" ".repeat(start.column() - 1))
              .append("^".repeat(underlineWidth(text)));
            if (!label.isEmpty()) {
                sb.append(" ").append(label);
            }
            sb.append("\n");
        });

        sb.append(gutter).append(" |\n");
        return sb.toString();
    }

    /**
     * One-line form: {@code file:line:col: error[code]: message}.
     */
    public String formatSimple(String filename) {
        return location(filename) + ": error[" + code + "]: " + message;
    }

    private String location(String filename) {
        return filename == null ? span.start().toString() : filename + ":" + span.start();
    }

    private int underlineWidth(String text) {
        int available = text.length() - (span.start().column() - 1);
        int width = span.end().line() == span.start().line() ? Math.min(span.length(), available) : available;
        return Math.max(1, width);
    }

    private static Optional<String> sourceLine(String source, int line) {
        var lines = source.split("\n", -1);
        if (line < 1 || line > lines.length) {
            return Optional.empty();
        }
        return Optional.of(lines[line - 1]);
    }
}
