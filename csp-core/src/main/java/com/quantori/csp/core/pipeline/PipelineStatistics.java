package com.quantori.csp.core.pipeline;

import lombok.Value;

@Value
public class PipelineStatistics {

  int countOfSuccessfullyProcessed;
  int countOfErrors;
  int countOfAmbiguous;

  public boolean isFailed() {
    return countOfErrors != 0;
  }
}
