package com.eryxon.gateway.application.query;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Query for the delivery health of every broker a tenant has configured.
 */
@Getter
@AllArgsConstructor
public class GetBrokerHealthQuery {

    private final String tenantId;
}
