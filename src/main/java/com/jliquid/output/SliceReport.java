package com.jliquid.output;

import com.jliquid.lexer.Token;
import com.jliquid.template.Slice;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * What the front end made of one slice. Literal slices carry no tokens;
 * {@code expression} and {@code error} are {@code null} when absent.
 */
public record SliceReport(Slice slice, String text, ImmutableList<Token> tokens, String expression, String error) {

    public static SliceReport literal(Slice slice, String text) {
        return new SliceReport(slice, text, Lists.immutable.empty(), null, null);
    }

    public boolean hasError() {
        return error != null;
    }
}
