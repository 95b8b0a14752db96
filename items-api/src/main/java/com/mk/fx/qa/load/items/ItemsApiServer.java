package com.mk.fx.qa.load.items;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.PrintStream;
import java.net.InetSocketAddress;
import java.util.List;
import java.util.Map;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Items service on top of the JDK HTTP server. Requests are handled by a fixed pool of worker
 * threads; each worker logs {@link #READY_MARKER} once it is up, which is what process supervisors
 * wait for.
 */
@Slf4j
public final class ItemsApiServer {

  public static final String READY_MARKER = "Application startup complete.";
  public static final List<String> COLLECTIONS = List.of("people", "planets", "starships");

  private static final int STOP_GRACE_SECONDS = 1;

  private final ItemsApiSettings settings;
  private final HttpServer server;
  private final ThreadPoolExecutor workers;

  public ItemsApiServer(InetSocketAddress bindAddress, ItemsApiSettings settings, PrintStream accessLog)
      throws IOException {
    this.settings = settings;
    this.server = HttpServer.create(bindAddress, 0);
    this.workers =
        new ThreadPoolExecutor(
            settings.workers(),
            settings.workers(),
            0L,
            TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(),
            workerThreadFactory());

    var mapper = new ObjectMapper();
    var accessLogFilter = new AccessLogFilter(accessLog);
    for (String collection : COLLECTIONS) {
      var path = "/" + collection;
      server
          .createContext(path, new ItemHandler(path, settings, mapper))
          .getFilters()
          .add(accessLogFilter);
    }
    server
        .createContext("/", new NotFoundHandler(mapper))
        .getFilters()
        .add(accessLogFilter);
    server.setExecutor(workers);
  }

  /** Starts listening and brings every worker thread up. */
  public void start() {
    server.start();
    log.info(
        "Listening at http://{}:{} with {} workers (item limit {}, max delay {} ms)",
        server.getAddress().getHostString(),
        server.getAddress().getPort(),
        settings.workers(),
        settings.idLimit(),
        settings.maxDelay().toMillis());
    workers.prestartAllCoreThreads();
  }

  public int port() {
    return server.getAddress().getPort();
  }

  /** Stops accepting connections, lets in-flight exchanges finish briefly, then stops the workers. */
  public void stop() {
    log.info("Shutting down");
    server.stop(STOP_GRACE_SECONDS);
    workers.shutdown();
    try {
      if (!workers.awaitTermination(STOP_GRACE_SECONDS, TimeUnit.SECONDS)) {
        workers.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      workers.shutdownNow();
    }
    log.info("Finished server process");
  }

  private static ThreadFactory workerThreadFactory() {
    var counter = new AtomicInteger();
    return runnable -> {
      Thread thread =
          new Thread(
              () -> {
                log.info(READY_MARKER);
                runnable.run();
              });
      thread.setName("items-worker-" + counter.incrementAndGet());
      return thread;
    };
  }

  private static final class NotFoundHandler implements HttpHandler {
    private final ObjectMapper mapper;

    private NotFoundHandler(ObjectMapper mapper) {
      this.mapper = mapper;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
      try {
        byte[] bytes = mapper.writeValueAsBytes(Map.of("detail", "Not Found"));
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(404, bytes.length);
        exchange.getResponseBody().write(bytes);
      } finally {
        exchange.close();
      }
    }
  }
}
