package com.scholary.video.composer.config;

import com.scholary.video.composer.objectstore.ObjectStoreClient;
import com.scholary.video.composer.objectstore.ObjectStoreProperties;
import com.scholary.video.composer.objectstore.S3ObjectStoreClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage.
 *
 * <p>Wires the ObjectStoreClient from the {@code objectstore.*} properties. The client is closed
 * on shutdown.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean(destroyMethod = "close")
  public ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }
}
