package com.mk.fx.qa.load.items;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ItemsApiServerTest {

  private static final int ID_LIMIT = 10;

  private final ObjectMapper mapper = new ObjectMapper();
  private final HttpClient client = HttpClient.newHttpClient();
  private ByteArrayOutputStream accessLog;
  private ItemsApiServer server;

  @BeforeEach
  void setUp() throws Exception {
    accessLog = new ByteArrayOutputStream();
    server =
        new ItemsApiServer(
            new InetSocketAddress("127.0.0.1", 0),
            new ItemsApiSettings(2, ID_LIMIT, Duration.ZERO),
            new PrintStream(accessLog, true, StandardCharsets.UTF_8));
    server.start();
  }

  @AfterEach
  void tearDown() {
    server.stop();
  }

  @Test
  void itemsUpToLimit_areServedOnEveryCollection() throws Exception {
    for (String collection : ItemsApiServer.COLLECTIONS) {
      for (int id = 0; id <= ID_LIMIT; id++) {
        HttpResponse<String> response = get("/" + collection + "/" + id);
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(json(response)).isEqualTo(Map.of("item_id", id));
      }
    }
  }

  @Test
  void itemAboveLimit_isNotFoundWithDetail() throws Exception {
    HttpResponse<String> response = get("/planets/" + (ID_LIMIT + 1));

    assertThat(response.statusCode()).isEqualTo(404);
    assertThat(json(response)).isEqualTo(Map.of("detail", "Item 11 was not found."));
  }

  @Test
  void missingOrMalformedIds_areRejected() throws Exception {
    assertThat(get("/starships").statusCode()).isEqualTo(404);
    assertThat(get("/starships/").statusCode()).isEqualTo(404);
    assertThat(get("/starships/1/extra").statusCode()).isEqualTo(404);
    assertThat(get("/starships/abc").statusCode()).isEqualTo(422);
    assertThat(get("/vehicles/1").statusCode()).isEqualTo(404);
  }

  @Test
  void everyExchange_isWrittenToTheAccessLog() throws Exception {
    get("/people/3");
    get("/people/99");

    await()
        .atMost(Duration.ofSeconds(2))
        .untilAsserted(
            () ->
                assertThat(accessLog.toString(StandardCharsets.UTF_8))
                    .contains("\"GET /people/3 HTTP/1.1\" 200 ")
                    .contains("\"GET /people/99 HTTP/1.1\" 404 "));
  }

  @Test
  void artificialDelay_staysWithinConfiguredMaximum() throws Exception {
    server.stop();
    server =
        new ItemsApiServer(
            new InetSocketAddress("127.0.0.1", 0),
            new ItemsApiSettings(1, ID_LIMIT, Duration.ofMillis(50)),
            new PrintStream(accessLog, true, StandardCharsets.UTF_8));
    server.start();

    long started = System.nanoTime();
    HttpResponse<String> response = get("/people/1");
    long tookMillis = Duration.ofNanos(System.nanoTime() - started).toMillis();

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(tookMillis).isLessThan(1_000);
  }

  private HttpResponse<String> get(String path) throws Exception {
    var request =
        HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.port() + path))
            .timeout(Duration.ofSeconds(2))
            .GET()
            .build();
    return client.send(request, HttpResponse.BodyHandlers.ofString());
  }

  private Map<String, Object> json(HttpResponse<String> response) throws Exception {
    return mapper.readValue(response.body(), new TypeReference<>() {});
  }
}
