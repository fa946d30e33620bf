package com.eryxon.gateway.infrastructure.transport;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Body posted to a broker's HTTP publish API.
 * The message itself travels as a JSON string in {@code payload}, the shape HiveMQ and EMQX expect.
 */
@Getter
@AllArgsConstructor
public class BridgePublishRequest {

    private final String topic;
    private final String payload;
    private final int qos;
    private final boolean retain;
}
