package com.chainfeed.merge.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Registers merge properties and the merger factory.
 */
@Configuration
@EnableConfigurationProperties(MergeProperties.class)
@ComponentScan(basePackages = "com.chainfeed.merge")
public class MergeConfig {
}
