package com.mk.fx.qa.load.harness.plan;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

@Getter
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReportConfig {

  /** Cells for the busiest second of the density chart. */
  @JsonProperty("columns")
  private Integer columns;

  /** Where to write the JSON summary; nothing is written when absent. */
  @JsonProperty("jsonFile")
  private String jsonFile;
}
