package com.eryxon.gateway.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Per-broker fallback values for the top three hierarchy levels of a topic.
 * Used when an event does not carry its own enterprise, site or area.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class HierarchyDefaults {

    private static final HierarchyDefaults NONE = new HierarchyDefaults(null, null, null);

    private final String enterprise;
    private final String site;
    private final String area;

    public HierarchyDefaults(String enterprise, String site, String area) {
        this.enterprise = enterprise;
        this.site = site;
        this.area = area;
    }

    public static HierarchyDefaults none() {
        return NONE;
    }
}
