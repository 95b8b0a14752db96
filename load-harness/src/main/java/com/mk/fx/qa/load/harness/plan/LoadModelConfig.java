package com.mk.fx.qa.load.harness.plan;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mk.fx.qa.load.harness.executors.ConcurrentLoadStrategy;
import com.mk.fx.qa.load.harness.executors.LoadStrategy;
import com.mk.fx.qa.load.harness.executors.SequentialLoadStrategy;
import lombok.Getter;

@Getter
@JsonIgnoreProperties(ignoreUnknown = true)
public class LoadModelConfig {

  @JsonProperty("type")
  private LoadModelType type;

  @JsonProperty("concurrency")
  private Integer concurrency;

  @JsonProperty("duration")
  private String duration;

  @JsonProperty("path")
  private String path;

  LoadStrategy toStrategy() {
    var modelType = type != null ? type : LoadModelType.SEQUENTIAL;
    return switch (modelType) {
      case SEQUENTIAL -> new SequentialLoadStrategy();
      case CONCURRENT -> {
        if (concurrency == null || concurrency < 1) {
          throw new IllegalArgumentException("CONCURRENT load model requires concurrency >= 1");
        }
        yield new ConcurrentLoadStrategy(concurrency);
      }
    };
  }
}
