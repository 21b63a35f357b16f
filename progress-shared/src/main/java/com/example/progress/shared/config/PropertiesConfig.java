package com.example.progress.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PropertiesConfig {

    @Value("${pod.name:${POD_NAME:progress-notifier-0}}")
    private String podName;

    @Bean
    @ConfigurationProperties(prefix = "progress")
    public AppProperties appProperties() {
        AppProperties properties = new AppProperties();
        properties.setPodName(podName);
        // The rest (progress.websocket.*, progress.workflow.*, progress.agents.*) is bound by
        // @ConfigurationProperties after this method returns.
        return properties;
    }
}
