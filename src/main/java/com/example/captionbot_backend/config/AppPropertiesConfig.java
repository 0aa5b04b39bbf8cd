package com.example.captionbot_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables application-specific configuration properties.
 */
@Configuration
@EnableConfigurationProperties({CaptionProperties.class, StorageProperties.class})
public class AppPropertiesConfig {
}
