package com.mk.fx.qa.load.items;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Serves {@code GET <collection>/{id}}. Every collection behaves the same: ids up to the configured
 * limit answer {@code {"item_id": id}} after an optional random delay, larger ids answer 404.
 */
@Slf4j
final class ItemHandler implements HttpHandler {

  private final String collectionPath;
  private final ItemsApiSettings settings;
  private final ObjectMapper mapper;

  ItemHandler(String collectionPath, ItemsApiSettings settings, ObjectMapper mapper) {
    this.collectionPath = collectionPath;
    this.settings = settings;
    this.mapper = mapper;
  }

  @Override
  public void handle(HttpExchange exchange) throws IOException {
    try {
      if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
        send(exchange, 405, Map.of("detail", "Method Not Allowed"));
        return;
      }
      String remainder = exchange.getRequestURI().getPath().substring(collectionPath.length());
      if (!remainder.startsWith("/") || remainder.length() == 1 || remainder.indexOf('/', 1) >= 0) {
        send(exchange, 404, Map.of("detail", "Not Found"));
        return;
      }

      int itemId;
      try {
        itemId = Integer.parseInt(remainder.substring(1));
      } catch (NumberFormatException e) {
        send(exchange, 422, Map.of("detail", "Item id must be an integer."));
        return;
      }

      if (itemId > settings.idLimit()) {
        send(exchange, 404, Map.of("detail", "Item " + itemId + " was not found."));
        return;
      }
      if (!settings.maxDelay().isZero()) {
        try {
          simulateWork();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          send(exchange, 503, Map.of("detail", "Server overloaded"));
          return;
        }
      }
      send(exchange, 200, Map.of("item_id", itemId));
    } finally {
      exchange.close();
    }
  }

  private void simulateWork() throws InterruptedException {
    long delayNanos = (long) (ThreadLocalRandom.current().nextDouble() * settings.maxDelay().toNanos());
    TimeUnit.NANOSECONDS.sleep(delayNanos);
  }

  private void send(HttpExchange exchange, int status, Map<String, ?> body) throws IOException {
    byte[] bytes = mapper.writeValueAsBytes(body);
    exchange.getResponseHeaders().set("Content-Type", "application/json");
    exchange.sendResponseHeaders(status, bytes.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(bytes);
    }
  }
}
