package com.mk.fx.qa.load.harness.process;

import java.util.List;

/**
 * Outcome of releasing a service.
 *
 * @param exitCode exit code of the service process, or null if it could not be observed
 * @param forced true when the process ignored the interrupt and had to be killed
 * @param diagnosticLog every line the service wrote to stderr, in order
 * @param accessLog distinct stdout lines, in order of first appearance
 */
public record ShutdownReport(
    Integer exitCode, boolean forced, List<String> diagnosticLog, List<String> accessLog) {}
