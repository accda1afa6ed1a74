package com.jliquid.output;

import com.jliquid.lexer.Token;
import org.eclipse.collections.api.list.ListIterable;

/**
 * Renders slice reports as JSON, pretty-printed or compact.
 */
public class OutputFormatter {
    private final boolean prettyPrint;

    private static final ThreadLocal<StringBuilder> STRING_BUILDER_POOL =
        ThreadLocal.withInitial(() -> new StringBuilder(512));

    public OutputFormatter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }

    public String format(ListIterable<SliceReport> reports) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0);

        if (reports.isEmpty()) {
            return "[]";
        }

        sb.append('[');
        boolean first = true;
        for (SliceReport report : reports) {
            if (!first) {
                sb.append(',');
            }
            first = false;
            newline(sb, 1);
            formatReport(report, sb);
        }
        newline(sb, 0);
        sb.append(']');

        return sb.toString();
    }

    private void formatReport(SliceReport report, StringBuilder sb) {
        sb.append('{');
        field(sb, "kind", 2, true);
        string(sb, report.slice().tag() ? "tag" : "literal");
        field(sb, "start", 2, false);
        sb.append(report.slice().start());
        field(sb, "end", 2, false);
        sb.append(report.slice().end());
        field(sb, "text", 2, false);
        string(sb, report.text());

        if (report.slice().tag()) {
            field(sb, "tokens", 2, false);
            formatTokens(report, sb);
        }
        if (report.expression() != null) {
            field(sb, "expression", 2, false);
            string(sb, report.expression());
        }
        if (report.hasError()) {
            field(sb, "error", 2, false);
            string(sb, report.error());
        }

        newline(sb, 1);
        sb.append('}');
    }

    private void formatTokens(SliceReport report, StringBuilder sb) {
        if (report.tokens().isEmpty()) {
            sb.append("[]");
            return;
        }

        sb.append('[');
        boolean first = true;
        for (Token token : report.tokens()) {
            if (!first) {
                sb.append(',');
            }
            first = false;
            newline(sb, 3);
            sb.append('{');
            string(sb, "kind");
            sb.append(prettyPrint ? ": " : ":");
            string(sb, token.kind().name());
            sb.append(prettyPrint ? ", " : ",");
            string(sb, "lexeme");
            sb.append(prettyPrint ? ": " : ":");
            string(sb, token.lexeme());
            sb.append('}');
        }
        newline(sb, 2);
        sb.append(']');
    }

    private void field(StringBuilder sb, String name, int level, boolean first) {
        if (!first) {
            sb.append(',');
        }
        newline(sb, level);
        string(sb, name);
        sb.append(prettyPrint ? ": " : ":");
    }

    private void newline(StringBuilder sb, int level) {
        if (prettyPrint) {
            sb.append('\n').append("  ".repeat(level));
        }
    }

    private void string(StringBuilder sb, String value) {
        sb.append('"').append(escapeString(value)).append('"');
    }

    private String escapeString(String s) {
        boolean needsEscaping = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' || c == '"' || c < 0x20) {
                needsEscaping = true;
                break;
            }
        }

        if (!needsEscaping) {
            return s;
        }

        StringBuilder result = new StringBuilder(s.length() + 16);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> result.append("\\\\");
                case '"'  -> result.append("\\\"");
                case '\n' -> result.append("\\n");
                case '\r' -> result.append("\\r");
                case '\t' -> result.append("\\t");
                default   -> {
                    if (c < 0x20) {
                        result.append(String.format("\\u%04x", (int) c));
                    } else {
                        result.append(c);
                    }
                }
            }
        }
        return result.toString();
    }
}
