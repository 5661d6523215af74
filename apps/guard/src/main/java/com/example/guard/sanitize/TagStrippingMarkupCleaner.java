package com.example.guard.sanitize;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Drops script, style and iframe elements with their content, keeps a small set of
 * formatting tags without attributes, and strips every other tag.
 */
public class TagStrippingMarkupCleaner implements MarkupCleaner {

    private static final Pattern FORBIDDEN_ELEMENT = Pattern.compile(
            "(?is)<(script|style|iframe)\\b[^>]*>.*?</\\1\\s*>|<(script|style|iframe)\\b[^>]*/?>");
    private static final Pattern TAG = Pattern.compile("(?s)<\\s*(/?)\\s*([a-zA-Z][a-zA-Z0-9]*)[^>]*>|<[^>]*>");

    private final Set<String> allowedTags;

    public TagStrippingMarkupCleaner() {
        this(Set.of("b", "i", "em", "strong"));
    }

    public TagStrippingMarkupCleaner(Set<String> allowedTags) {
        this.allowedTags = Set.copyOf(allowedTags);
    }

    @Override
    public String clean(String markup) {
        String withoutForbidden = FORBIDDEN_ELEMENT.matcher(markup).replaceAll("");
        Matcher matcher = TAG.matcher(withoutForbidden);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(2);
            String replacement = "";
            if (name != null && allowedTags.contains(name.toLowerCase(Locale.ROOT))) {
                replacement = "<" + matcher.group(1) + name.toLowerCase(Locale.ROOT) + ">";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
