package com.fxscreenreader.cgm.camaps;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordered list of alternative patterns for the same value. The first pattern that matches and
 * whose converter yields a non-null result wins.
 */
public final class PatternCascade<T> {

    private final List<Step<T>> steps;

    private PatternCascade(final List<Step<T>> steps) {
        this.steps = Collections.unmodifiableList(steps);
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    public T match(final String text) {
        if (text == null) return null;
        for (final Step<T> step : steps) {
            final Matcher matcher = step.pattern.matcher(text);
            if (matcher.find()) {
                final T result = step.converter.apply(matcher);
                if (result != null) return result;
            }
        }
        return null;
    }

    public int size() {
        return steps.size();
    }

    private static final class Step<T> {
        private final Pattern pattern;
        private final Function<Matcher, T> converter;

        private Step(final Pattern pattern, final Function<Matcher, T> converter) {
            this.pattern = pattern;
            this.converter = converter;
        }
    }

    public static final class Builder<T> {
        private final List<Step<T>> steps = new ArrayList<>();

        private Builder() {
        }

        public Builder<T> then(final String regex, final Function<Matcher, T> converter) {
            return then(Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE), converter);
        }

        public Builder<T> then(final Pattern pattern, final Function<Matcher, T> converter) {
            steps.add(new Step<>(pattern, converter));
            return this;
        }

        public PatternCascade<T> build() {
            return new PatternCascade<>(new ArrayList<>(steps));
        }
    }
}
