package com.jliquid;

import com.jliquid.error.LiquidException;
import com.jliquid.lexer.Lexer;
import com.jliquid.lexer.Token;
import com.jliquid.output.SliceReport;
import com.jliquid.parser.Parser;
import com.jliquid.template.Slice;
import com.jliquid.template.Tokenizer;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a template through the tokenizer, lexer and parser and reports on every slice.
 * In strict mode the first error aborts the run; otherwise the offending tag is
 * reported with its error and inspection carries on.
 */
public class TemplateInspector {
    private static final Logger LOGGER = LoggerFactory.getLogger(TemplateInspector.class);

    private final boolean strict;
    private final int maxDepth;

    public TemplateInspector(boolean strict, int maxDepth) {
        this.strict = strict;
        this.maxDepth = maxDepth;
    }

    public MutableList<SliceReport> inspect(String template) {
        MutableList<SliceReport> reports = Lists.mutable.empty();
        for (Slice slice : new Tokenizer(template).slices()) {
            String text = slice.of(template);
            reports.add(slice.tag() ? inspectTag(slice, text) : SliceReport.literal(slice, text));
        }
        return reports;
    }

    private SliceReport inspectTag(Slice slice, String text) {
        MutableList<Token> tokens = Lists.mutable.empty();
        try {
            tokens.addAll(new Lexer(interior(text)).tokenize());

            String expression = null;
            if (text.startsWith("{{") && !tokens.isEmpty()) {
                expression = new Parser(tokens, maxDepth).expression().orElse(null);
            }
            return new SliceReport(slice, text, tokens.toImmutable(), expression, null);
        } catch (LiquidException e) {
            if (strict) {
                throw e;
            }
            LOGGER.debug("Skipping tag at {}: {}", slice.start(), e.getMessage());
            return new SliceReport(slice, text, tokens.toImmutable(), null, e.getMessage());
        }
    }

    /**
     * Strips the tag delimiters, tolerating a missing or half closing delimiter.
     */
    static String interior(String tag) {
        String body = tag.substring(2);
        if (tag.startsWith("{%")) {
            return body.endsWith("%}") ? body.substring(0, body.length() - 2) : body;
        }
        if (body.endsWith("}}")) {
            return body.substring(0, body.length() - 2);
        }
        return body.endsWith("}") ? body.substring(0, body.length() - 1) : body;
    }
}
