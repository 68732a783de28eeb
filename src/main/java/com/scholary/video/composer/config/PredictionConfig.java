package com.scholary.video.composer.config;

import com.scholary.video.composer.prediction.PredictionProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the prediction client.
 *
 * <p>Enables the PredictionProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(PredictionProperties.class)
public class PredictionConfig {}
