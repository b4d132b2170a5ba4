package com.example.scaler.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "scaler")
public record ScalerProperties(
        @DefaultValue("5000") long timeoutMs,
        @DefaultValue("queue1") String defaultQueue,
        @DefaultValue AdminProperties admin
) implements ScalerProps {

    public record AdminProperties(
            @DefaultValue("http://localhost:3001") String baseUrl
    ) implements ScalerProps.Admin {
    }
}
