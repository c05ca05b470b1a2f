package com.example.todoapi.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.ZoneId;

/**
 * Process-wide settings bound once at start-up from the {@code todo-api.*} properties.
 *
 * @param cors cross-origin policy for the {@code /api/**} endpoints
 * @param localTimeZone zone used to read request timestamps that carry no offset
 */
@ConfigurationProperties(prefix = "todo-api")
public record TodoApiProperties(
        @DefaultValue Cors cors,
        @DefaultValue("UTC") ZoneId localTimeZone
) {

    /**
     * @param allowedOrigin the single origin allowed to call the API, with any header and method
     */
    public record Cors(@DefaultValue("http://localhost:3000") String allowedOrigin) {
    }
}
