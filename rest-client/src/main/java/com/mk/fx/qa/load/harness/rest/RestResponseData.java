package com.mk.fx.qa.load.harness.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import lombok.Data;

@Data
public class RestResponseData {
  private URI uri;
  private int statusCode;
  private Map<String, String> headers;
  private String body;
  private Duration elapsed;

  /** True for any 2xx status. */
  public boolean isOk() {
    return statusCode >= 200 && statusCode < 300;
  }

  public Map<String, Object> bodyAsMap() {
    try {
      return JsonUtil.mapper().readValue(body, new TypeReference<>() {});
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Response body from " + uri + " is not a JSON object: " + body, e);
    }
  }
}
