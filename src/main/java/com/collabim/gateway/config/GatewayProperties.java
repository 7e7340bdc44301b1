package com.collabim.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "collab.gateway.ws")
public record GatewayProperties(
        String host,
        int port,
        String path
) {
}
