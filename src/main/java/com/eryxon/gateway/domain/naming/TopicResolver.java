package com.eryxon.gateway.domain.naming;

import com.eryxon.gateway.domain.event.EventContext;
import com.eryxon.gateway.domain.model.HierarchyDefaults;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Builds Unified Namespace topics from a broker's topic pattern.
 *
 * Supported placeholders:
 * - {enterprise}, {site}, {area}: event context, else broker default, else eryxon/main/production
 * - {cell}, {line}, {operation}, {job_number}, {part_number}: event context, else empty
 * - {event}: the event type with every '.' turned into '/'
 * - {tenant_id}: the tenant id, unmodified
 *
 * Example: "{enterprise}/{site}/{cell}/{event}" with enterprise "Acme Co", site "Factory 1",
 * cell "Laser Cutting" and event "operation.started" resolves to
 * "acme_co/factory_1/laser_cutting/operation/started".
 *
 * Placeholders that resolve to nothing, including unknown ones, disappear together with their
 * segment. Resolution has no side effects and no I/O.
 */
public final class TopicResolver {

    public static final String FALLBACK_ENTERPRISE = "eryxon";
    public static final String FALLBACK_SITE = "main";
    public static final String FALLBACK_AREA = "production";

    public static final Set<String> SUPPORTED_VARIABLES = Collections.unmodifiableSet(
            new LinkedHashSet<>(Arrays.asList(
                    "enterprise", "site", "area", "cell", "line", "operation",
                    "event", "tenant_id", "job_number", "part_number")));

    static final Pattern PLACEHOLDER = Pattern.compile("\\{([^{}]*)}");

    private TopicResolver() {
    }

    /**
     * Resolves a topic pattern for one broker and one event.
     *
     * @param pattern the broker's topic pattern
     * @param context hierarchy context of the event, may be null
     * @param brokerDefaults the broker's enterprise/site/area defaults, may be null
     * @param eventType dot-delimited event type, e.g. "operation.started"
     * @param tenantId the tenant id
     * @return the concrete topic without empty segments
     */
    public static String resolve(String pattern, EventContext context, HierarchyDefaults brokerDefaults,
                                 String eventType, String tenantId) {
        Map<String, String> variables = buildVariables(
                context == null ? EventContext.empty() : context,
                brokerDefaults == null ? HierarchyDefaults.none() : brokerDefaults,
                eventType,
                tenantId);

        Matcher matcher = PLACEHOLDER.matcher(pattern == null ? "" : pattern);
        StringBuilder substituted = new StringBuilder();
        while (matcher.find()) {
            String value = variables.getOrDefault(matcher.group(1), "");
            matcher.appendReplacement(substituted, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(substituted);

        return Arrays.stream(substituted.toString().split("/"))
                .filter(segment -> !segment.isEmpty())
                .collect(Collectors.joining("/"));
    }

    static Map<String, String> buildVariables(EventContext context, HierarchyDefaults defaults,
                                              String eventType, String tenantId) {
        Map<String, String> variables = new LinkedHashMap<>();
        variables.put("enterprise", TopicNormalizer.normalize(
                firstPresent(context.getEnterprise(), defaults.getEnterprise(), FALLBACK_ENTERPRISE)));
        variables.put("site", TopicNormalizer.normalize(
                firstPresent(context.getSite(), defaults.getSite(), FALLBACK_SITE)));
        variables.put("area", TopicNormalizer.normalize(
                firstPresent(context.getArea(), defaults.getArea(), FALLBACK_AREA)));
        variables.put("cell", TopicNormalizer.normalize(context.getCell()));
        variables.put("line", TopicNormalizer.normalize(context.getLine()));
        variables.put("operation", TopicNormalizer.normalize(context.getOperation()));
        variables.put("event", eventType == null ? "" : eventType.replace('.', '/'));
        variables.put("tenant_id", tenantId == null ? "" : tenantId);
        variables.put("job_number", TopicNormalizer.normalize(context.getJobNumber()));
        variables.put("part_number", TopicNormalizer.normalize(context.getPartNumber()));
        return variables;
    }

    private static String firstPresent(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate;
            }
        }
        return "";
    }
}
