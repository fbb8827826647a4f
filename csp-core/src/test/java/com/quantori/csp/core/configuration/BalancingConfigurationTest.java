package com.quantori.csp.core.configuration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;

class BalancingConfigurationTest {

  @Test
  void referenceDefaults() {
    var properties = new BalancingConfiguration(ConfigFactory.empty()).properties();

    assertEquals(64, properties.getMaxParticipants());
    assertEquals(64, properties.getMaxElements());
    assertEquals(4, properties.getParallelism());
    assertEquals(0, properties.getBufferSize());
    assertEquals("csp-balancing-system", properties.getSystemName());
  }

  @Test
  void overrides() {
    var config = ConfigFactory.parseString("csp.balancer.max-participants = 8\ncsp.pipeline.parallelism = 2");

    var properties = new BalancingConfiguration(config).properties();

    assertEquals(8, properties.getMaxParticipants());
    assertEquals(2, properties.getParallelism());
    assertEquals(64, properties.getMaxElements());
  }

  @Test
  void invalidValues() {
    var config = ConfigFactory.parseString("csp.pipeline.parallelism = 0");
    var configuration = new BalancingConfiguration(config);

    assertThrows(IllegalArgumentException.class, configuration::properties);
  }

  @Test
  void builderDefaults() {
    var properties = BalancingProperties.defaults();

    assertEquals(BalancingProperties.DEFAULT_MAX_PARTICIPANTS, properties.getMaxParticipants());
    assertEquals(1, properties.getParallelism());
  }
}
