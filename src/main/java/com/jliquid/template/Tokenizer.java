package com.jliquid.template;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits template text into tag and literal slices. The slices are
 * contiguous and concatenate back to the source text.
 */
public class Tokenizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(Tokenizer.class);

    private final String source;

    public Tokenizer(String source) {
        this.source = source;
    }

    public MutableList<String> tokenize() {
        return tokenize(TagPattern.TEMPLATE.toPattern());
    }

    public MutableList<String> tokenize(Pattern pattern) {
        return slices(pattern).collect(slice -> slice.of(source));
    }

    public MutableList<Slice> slices() {
        return slices(TagPattern.TEMPLATE.toPattern());
    }

    public MutableList<Slice> slices(Pattern pattern) {
        MutableList<Slice> slices = matchedSlices(pattern);
        slices.addAll(findMissingSlices(slices));
        slices.sortThis(Comparator.comparingInt(Slice::start));

        LOGGER.debug("Tokenized {} chars into {} slices", source.length(), slices.size());
        return slices;
    }

    private MutableList<Slice> matchedSlices(Pattern pattern) {
        MutableList<Slice> slices = Lists.mutable.empty();
        Matcher matcher = pattern.matcher(source);
        while (matcher.find()) {
            // An empty match would never advance past the gap it sits in.
            if (matcher.end() > matcher.start()) {
                slices.add(Slice.tag(matcher.start(), matcher.end()));
            }
        }
        return slices;
    }

    private MutableList<Slice> findMissingSlices(MutableList<Slice> slices) {
        if (slices.isEmpty()) {
            return Lists.mutable.of(Slice.literal(0, source.length()));
        }

        MutableList<Slice> missing = missingMiddleSlices(slices);

        Slice first = slices.getFirst();
        if (first.start() != 0) {
            missing.add(Slice.literal(0, first.start()));
        }

        Slice last = slices.getLast();
        if (last.end() != source.length()) {
            missing.add(Slice.literal(last.end(), source.length()));
        }

        return missing;
    }

    private MutableList<Slice> missingMiddleSlices(MutableList<Slice> slices) {
        MutableList<Slice> missing = Lists.mutable.empty();
        for (int i = 0; i < slices.size() - 1; i++) {
            int right = slices.get(i).end();
            int edge = slices.get(i + 1).start();
            if (right != edge) {
                missing.add(Slice.literal(right, edge));
            }
        }
        return missing;
    }
}
