package com.example.todoapi.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.config.CorsRegistry;
import org.springframework.web.reactive.config.WebFluxConfigurer;

@Configuration
@EnableConfigurationProperties(TodoApiProperties.class)
public class WebConfig implements WebFluxConfigurer {

    private static final Logger log = LoggerFactory.getLogger(WebConfig.class);

    private final TodoApiProperties properties;

    public WebConfig(TodoApiProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        String origin = properties.cors().allowedOrigin();
        log.info("Allowing cross-origin requests from {}", origin);
        registry.addMapping("/api/**")
                .allowedOrigins(origin)
                .allowedHeaders("*")
                .allowedMethods("*");
    }
}
