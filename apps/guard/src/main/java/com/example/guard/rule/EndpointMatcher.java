package com.example.guard.rule;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Matches an endpoint either by exact path or by regular expression.
 * Regex matchers succeed when the pattern is found anywhere in the endpoint.
 */
public sealed interface EndpointMatcher permits EndpointMatcher.Exact, EndpointMatcher.Regex {

    String REGEX_PREFIX = "regex:";

    boolean matches(String endpoint);

    /**
     * Textual form accepted by {@link #parse(String)}.
     */
    String expression();

    static EndpointMatcher exact(String path) {
        return new Exact(path);
    }

    static EndpointMatcher regex(String regex) {
        return new Regex(Pattern.compile(regex));
    }

    /**
     * {@code regex:<pattern>} compiles a regex matcher, anything else is an exact path.
     */
    static EndpointMatcher parse(String expression) {
        Objects.requireNonNull(expression, "expression");
        if (expression.startsWith(REGEX_PREFIX)) {
            return regex(expression.substring(REGEX_PREFIX.length()));
        }
        return exact(expression);
    }

    record Exact(String path) implements EndpointMatcher {

        public Exact {
            Objects.requireNonNull(path, "path");
        }

        @Override
        public boolean matches(String endpoint) {
            return path.equals(endpoint);
        }

        @Override
        @JsonValue
        public String expression() {
            return path;
        }
    }

    record Regex(Pattern pattern) implements EndpointMatcher {

        public Regex {
            Objects.requireNonNull(pattern, "pattern");
        }

        @Override
        public boolean matches(String endpoint) {
            return endpoint != null && pattern.matcher(endpoint).find();
        }

        @Override
        @JsonValue
        public String expression() {
            return REGEX_PREFIX + pattern.pattern();
        }
    }
}
