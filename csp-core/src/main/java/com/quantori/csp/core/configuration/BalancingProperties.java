package com.quantori.csp.core.configuration;

import lombok.Builder;
import lombok.Data;

@Builder
@Data
public class BalancingProperties {
  public static final int DEFAULT_MAX_PARTICIPANTS = 64;
  public static final int DEFAULT_MAX_ELEMENTS = 64;

  @Builder.Default
  int maxParticipants = DEFAULT_MAX_PARTICIPANTS;
  @Builder.Default
  int maxElements = DEFAULT_MAX_ELEMENTS;
  @Builder.Default
  int parallelism = 1;
  int bufferSize;
  @Builder.Default
  String systemName = "csp-balancing-system";

  public static BalancingProperties defaults() {
    return BalancingProperties.builder().build();
  }
}
