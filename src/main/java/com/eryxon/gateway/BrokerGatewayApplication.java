package com.eryxon.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point of the broker gateway service.
 */
@SpringBootApplication
public class BrokerGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(BrokerGatewayApplication.class, args);
    }
}
