package com.example.scaler.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class WebClientConfig {

    /**
     * Admin server client. Fractional numbers are not accepted for integer fields.
     */
    @Bean
    public WebClient queueAdminWebClient(WebClient.Builder builder, ScalerProps props, ObjectMapper objectMapper) {
        ObjectMapper strict = objectMapper.copy()
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
        return builder
                .baseUrl(props.admin().baseUrl())
                .codecs(c -> c.defaultCodecs().jackson2JsonDecoder(new Jackson2JsonDecoder(strict)))
                .build();
    }
}
