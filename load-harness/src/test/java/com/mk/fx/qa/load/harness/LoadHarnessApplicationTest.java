package com.mk.fx.qa.load.harness;

import static org.assertj.core.api.Assertions.assertThat;

import com.mk.fx.qa.load.harness.config.HarnessProperties;
import com.mk.fx.qa.load.harness.process.ServiceProcessManager;
import com.mk.fx.qa.load.harness.rest.JsonUtil;
import com.mk.fx.qa.load.items.ItemsApiSettings;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LoadHarnessApplicationTest {

  @TempDir Path dir;

  private final ServiceProcessManager manager = new ServiceProcessManager();

  @Test
  void passingRun_writesReportAndExitsZero() throws IOException {
    var reportFile = dir.resolve("reports/people.json");
    var plan = writePlan("people/3", Map.of("type", "CONCURRENT", "concurrency", 3), reportFile, 0);

    int exit = LoadHarnessApplication.run(new String[] {plan.toString()}, manager, shortRun());

    assertThat(exit).isEqualTo(LoadHarnessApplication.EXIT_PASSED);
    assertThat(reportFile).exists();
    var report = JsonUtil.mapper().readTree(reportFile.toFile());
    assertThat(report.path("path").asText()).isEqualTo("people/3");
    assertThat(report.path("strategy").asText()).isEqualTo("concurrent x3");
    assertThat(report.path("summary").path("failedCount").asLong()).isZero();
    assertThat(report.path("workerSampleCounts")).hasSize(3);
  }

  @Test
  void failuresOverBudget_exitOne() throws IOException {
    var plan = writePlan("people/" + (ItemsApiProcess.ID_LIMIT + 1), Map.of("type", "SEQUENTIAL"), null, 0);

    int exit = LoadHarnessApplication.run(new String[] {plan.toString()}, manager, shortRun());

    assertThat(exit).isEqualTo(LoadHarnessApplication.EXIT_FAILED);
  }

  @Test
  void badArgumentsOrPlan_exitTwo() throws IOException {
    var broken = Files.writeString(dir.resolve("broken.json"), "{\"load\": {\"path\": \"people/0\"}}");
    var zeroWorkers =
        Files.writeString(
            dir.resolve("zero-workers.json"),
            "{\"service\": {\"command\": [\"serve\"], \"expectedWorkers\": 0},"
                + " \"load\": {\"path\": \"people/0\"}}");
    var negativeDuration =
        Files.writeString(
            dir.resolve("negative-duration.json"),
            "{\"service\": {\"command\": [\"serve\"]},"
                + " \"load\": {\"path\": \"people/0\", \"duration\": \"-1s\"}}");

    assertThat(LoadHarnessApplication.run(new String[] {}, manager, shortRun()))
        .isEqualTo(LoadHarnessApplication.EXIT_ERROR);
    assertThat(
            LoadHarnessApplication.run(
                new String[] {dir.resolve("absent.json").toString()}, manager, shortRun()))
        .isEqualTo(LoadHarnessApplication.EXIT_ERROR);
    assertThat(LoadHarnessApplication.run(new String[] {broken.toString()}, manager, shortRun()))
        .isEqualTo(LoadHarnessApplication.EXIT_ERROR);
    assertThat(LoadHarnessApplication.run(new String[] {zeroWorkers.toString()}, manager, shortRun()))
        .isEqualTo(LoadHarnessApplication.EXIT_ERROR);
    assertThat(
            LoadHarnessApplication.run(
                new String[] {negativeDuration.toString()}, manager, shortRun()))
        .isEqualTo(LoadHarnessApplication.EXIT_ERROR);
  }

  @Test
  void invalidDurationOverride_exitsTwo() throws IOException {
    var plan = writePlan("people/0", Map.of("type", "SEQUENTIAL"), null, 0);

    assertThat(
            LoadHarnessApplication.run(
                new String[] {plan.toString()}, manager, durationOverride("soon")))
        .isEqualTo(LoadHarnessApplication.EXIT_ERROR);
    assertThat(
            LoadHarnessApplication.run(
                new String[] {plan.toString()}, manager, durationOverride("-1s")))
        .isEqualTo(LoadHarnessApplication.EXIT_ERROR);
  }

  @Test
  void serviceThatNeverStarts_exitsTwo() throws IOException {
    Map<String, Object> document = new LinkedHashMap<>();
    document.put(
        "service", Map.of("command", List.of("/nonexistent/items-api-binary"), "startupTimeout", "2s"));
    document.put("load", Map.of("path", "people/0", "duration", "1s"));
    var plan = Files.writeString(dir.resolve("missing-binary.json"), JsonUtil.toJson(document));

    assertThat(LoadHarnessApplication.run(new String[] {plan.toString()}, manager, shortRun()))
        .isEqualTo(LoadHarnessApplication.EXIT_ERROR);
  }

  private static HarnessProperties shortRun() {
    return durationOverride("1s");
  }

  private static HarnessProperties durationOverride(String duration) {
    var properties = new Properties();
    properties.setProperty(HarnessProperties.PREFIX + "duration", duration);
    return HarnessProperties.from(properties);
  }

  private Path writePlan(String path, Map<String, Object> load, Path reportFile, long maxFailures)
      throws IOException {
    Map<String, Object> service = new LinkedHashMap<>();
    service.put("command", ItemsApiProcess.command());
    service.put(
        "environment",
        Map.of(
            ItemsApiSettings.WORKERS_ENV, Integer.toString(ItemsApiProcess.SERVER_WORKERS),
            ItemsApiSettings.ID_LIMIT_ENV, Integer.toString(ItemsApiProcess.ID_LIMIT)));
    service.put("expectedWorkers", ItemsApiProcess.SERVER_WORKERS);
    service.put("startupTimeout", "30s");

    Map<String, Object> loadSection = new LinkedHashMap<>(load);
    loadSection.put("path", path);
    loadSection.put("duration", "10m");

    Map<String, Object> document = new LinkedHashMap<>();
    document.put("service", service);
    document.put("load", loadSection);
    if (reportFile != null) {
      document.put("report", Map.of("jsonFile", reportFile.toString()));
    }
    document.put("maxFailures", maxFailures);
    return Files.writeString(dir.resolve("plan-" + path.replace('/', '-') + ".json"), JsonUtil.toJson(document));
  }
}
