package org.kumeo.dsl.error;

import org.kumeo.dsl.tree.SourceSpan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * A compile error rendered against its source text.
 *
 * <p>Example output:
 * <pre>
 * error[E0201]: Duplicate workflow name: Alerts
 *   --> pipeline.kumeo:7:10
 *   |
 * 1 | workflow Alerts {
 *   |          ------ first declared here
 * ...
 * 7 | workflow Alerts {
 *   |          ^^^^^^ declared again here
 *   |
 *   = help: workflows and subworkflows share one namespace
 * </pre>
 *
 * @param code    stable error code, e.g. "E0207"
 * @param message primary message
 * @param span    where the error is reported
 * @param labels  annotated spans; when empty the primary span is underlined without text
 * @param notes   trailing notes such as help lines
 */
public record Diagnostic(String code, String message, SourceSpan span, List<Label> labels, List<String> notes) {

    /**
     * An annotated span. Primary labels underline with {@code ^}, secondary ones with {@code -}.
     */
    public record Label(SourceSpan span, String message, boolean primary) {
        boolean covers(int line) {
            return span.start().line() <= line && line <= span.end().line();
        }
    }

    public Diagnostic {
        labels = List.copyOf(labels);
        notes = List.copyOf(notes);
    }

    public static Diagnostic error(String code, String message, SourceSpan span) {
        return new Diagnostic(code, message, span, List.of(), List.of());
    }

    /**
     * Annotate the primary span.
     */
    public Diagnostic withLabel(String labelMessage) {
        return withLabels(new Label(span, labelMessage, true));
    }

    /**
     * Point at a related span, e.g. an earlier declaration.
     */
    public Diagnostic withSecondaryLabel(SourceSpan labelSpan, String labelMessage) {
        return withLabels(new Label(labelSpan, labelMessage, false));
    }

    public Diagnostic withHelp(String help) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add("help: " + help);
        return new Diagnostic(code, message, span, labels, newNotes);
    }

    private Diagnostic withLabels(Label label) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(label);
        return new Diagnostic(code, message, span, newLabels, notes);
    }

    /**
     * Render in Rust style. Only lines carrying a label are shown; gaps between them print as {@code ...}.
     *
     * @param filename shown in the location line, may be null
     */
    public String format(String source, String filename) {
        var lines = source.split("\n", -1);
        var effective = labels.isEmpty() ? List.of(new Label(span, "", true)) : labels;
        var shown = effective.stream()
                             .flatMap(label -> IntStream.rangeClosed(label.span().start().line(),
                                                                     label.span().end().line())
                                                        .boxed())
                             .filter(line -> line >= 1 && line <= lines.length)
                             .distinct()
                             .sorted()
                             .toList();
        var gutter = shown.isEmpty() ? 1 : String.valueOf(shown.get(shown.size() - 1)).length();
        var pad = " ".repeat(gutter);

        var sb = new StringBuilder();
        sb.append("error");
        if (code != null) {
            sb.append('[').append(code).append(']');
        }
        sb.append(": ").append(message).append('\n');
        sb.append(pad).append(" --> ");
        if (filename != null) {
            sb.append(filename).append(':');
        }
        sb.append(span.start()).append('\n');
        sb.append(pad).append(" |\n");

        int previous = -1;
        for (int line : shown) {
            if (previous != -1 && line > previous + 1) {
                sb.append("...\n");
            }
            previous = line;
            var text = stripCarriageReturn(lines[line - 1]);
            sb.append(String.format("%" + gutter + "d", line)).append(" | ").append(text).append('\n');
            sb.append(pad).append(" | ").append(underlines(line, text, effective)).append('\n');
        }

        sb.append(pad).append(" |\n");
        for (var note : notes) {
            sb.append(pad).append(" = ").append(note).append('\n');
        }
        return sb.toString();
    }

    private static String underlines(int line, String text, List<Label> all) {
        var onLine = all.stream()
                        .filter(label -> label.covers(line))
                        .sorted(Comparator.comparingInt(label -> startColumn(label, line)))
                        .toList();
        var sb = new StringBuilder();
        int column = 1;
        for (var label : onLine) {
            int start = startColumn(label, line);
            int end = label.span().end().line() == line ? label.span().end().column() : text.length() + 1;
            if (column > start) {
                // previous label text runs past this one
                sb.append(' ');
                column++;
            }
            for (; column < start; column++) {
                sb.append(' ');
            }
            int width = Math.max(1, end - start);
            sb.append(String.valueOf(label.primary() ? '^' : '-').repeat(width));
            column += width;
            if (!label.message().isEmpty()) {
                sb.append(' ').append(label.message());
                column += label.message().length() + 1;
            }
        }
        return sb.toString();
    }

    private static int startColumn(Label label, int line) {
        return label.span().start().line() == line ? label.span().start().column() : 1;
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
