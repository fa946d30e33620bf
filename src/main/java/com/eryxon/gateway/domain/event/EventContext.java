package com.eryxon.gateway.domain.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Optional plant-hierarchy context carried by an event.
 * Follows the ISA-95 levels (enterprise, site, area, cell, line, operation) plus the
 * production identifiers that can appear in a UNS topic. Every field may be null.
 */
@Getter
@EqualsAndHashCode
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class EventContext {

    private static final EventContext EMPTY = new EventContext(
            null, null, null, null, null, null, null, null, null);

    private final String enterprise;
    private final String site;
    private final String area;
    private final String cell;
    private final String line;
    private final String operation;
    private final String jobNumber;
    private final String partNumber;
    private final String operatorName;

    @JsonCreator
    public EventContext(
            @JsonProperty("enterprise") String enterprise,
            @JsonProperty("site") String site,
            @JsonProperty("area") String area,
            @JsonProperty("cell") String cell,
            @JsonProperty("line") String line,
            @JsonProperty("operation") String operation,
            @JsonProperty("job_number") String jobNumber,
            @JsonProperty("part_number") String partNumber,
            @JsonProperty("operator_name") String operatorName) {
        this.enterprise = enterprise;
        this.site = site;
        this.area = area;
        this.cell = cell;
        this.line = line;
        this.operation = operation;
        this.jobNumber = jobNumber;
        this.partNumber = partNumber;
        this.operatorName = operatorName;
    }

    /**
     * @return a context with no hierarchy values
     */
    public static EventContext empty() {
        return EMPTY;
    }

    @JsonProperty("job_number")
    public String getJobNumber() {
        return jobNumber;
    }

    @JsonProperty("part_number")
    public String getPartNumber() {
        return partNumber;
    }

    @JsonProperty("operator_name")
    public String getOperatorName() {
        return operatorName;
    }
}
