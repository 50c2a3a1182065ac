package com.hargapangan.override.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(OverrideProperties.class)
public class OverrideConfig {
}
