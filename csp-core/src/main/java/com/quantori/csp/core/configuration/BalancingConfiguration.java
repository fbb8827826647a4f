package com.quantori.csp.core.configuration;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads {@link BalancingProperties} from the {@code csp} section of the Typesafe configuration.
 * Defaults live in {@code reference.conf} and may be overridden by an {@code application.conf}.
 */
@Slf4j
public class BalancingConfiguration {
  public static final String ROOT_PATH = "csp";

  private final Config config;

  public BalancingConfiguration() {
    this(ConfigFactory.load());
  }

  public BalancingConfiguration(Config config) {
    this.config = config.withFallback(ConfigFactory.defaultReference()).getConfig(ROOT_PATH);
  }

  public BalancingProperties properties() {
    Config balancer = config.getConfig("balancer");
    Config pipeline = config.getConfig("pipeline");
    var properties = BalancingProperties.builder()
        .maxParticipants(balancer.getInt("max-participants"))
        .maxElements(balancer.getInt("max-elements"))
        .parallelism(pipeline.getInt("parallelism"))
        .bufferSize(pipeline.getInt("buffer-size"))
        .systemName(pipeline.getString("system-name"))
        .build();
    if (properties.getMaxParticipants() < 2 || properties.getParallelism() < 1 || properties.getBufferSize() < 0) {
      throw new IllegalArgumentException("Invalid balancing configuration: " + properties);
    }
    log.debug("csp balancing configuration = {}", properties);
    return properties;
  }
}
