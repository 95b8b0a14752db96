package com.mk.fx.qa.load.harness.plan;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.util.Arrays;

public enum LoadModelType {
    SEQUENTIAL,
    CONCURRENT;

    @JsonCreator
    public static LoadModelType fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported load model type: " + value));
    }
}
