package com.eryxon.gateway.domain.naming;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Finds placeholders in a topic pattern that {@link TopicResolver} does not know.
 * The resolver silently drops them, so a typo like "{cel}" would otherwise go unnoticed.
 */
public final class TopicPatternInspector {

    private TopicPatternInspector() {
    }

    /**
     * @param pattern a topic pattern, may be null
     * @return unknown placeholder names in order of first appearance
     */
    public static Set<String> unknownPlaceholders(String pattern) {
        Set<String> unknown = new LinkedHashSet<>();
        if (pattern == null) {
            return unknown;
        }
        Matcher matcher = TopicResolver.PLACEHOLDER.matcher(pattern);
        while (matcher.find()) {
            String name = matcher.group(1);
            if (!TopicResolver.SUPPORTED_VARIABLES.contains(name)) {
                unknown.add(name);
            }
        }
        return unknown;
    }
}
