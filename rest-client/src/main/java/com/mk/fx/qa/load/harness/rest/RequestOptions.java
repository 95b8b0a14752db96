package com.mk.fx.qa.load.harness.rest;

import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class RequestOptions {

    private static final RequestOptions NONE = RequestOptions.builder().build();

    @Singular Map<String, String> headers;
    @Singular("queryParam") Map<String, String> query;

    public static RequestOptions none() {
        return NONE;
    }
}
