package com.mk.fx.qa.load.items;

import java.io.IOException;
import java.net.InetSocketAddress;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point: {@code ItemsApiApplication [--bind host:port]}. Settings come from the
 * {@code WEB_CONCURRENCY}, {@code ID_LIMIT} and {@code MAX_DELAY} environment variables. The process
 * stops cleanly on SIGINT or SIGTERM.
 */
@Slf4j
public final class ItemsApiApplication {

  static final String DEFAULT_BIND = "127.0.0.1:8000";

  private ItemsApiApplication() {
    throw new UnsupportedOperationException("ItemsApiApplication cannot be instantiated");
  }

  public static void main(String[] args) throws IOException {
    var bindAddress = parseBindAddress(args);
    var settings = ItemsApiSettings.fromEnvironment(System.getenv());

    var server = new ItemsApiServer(bindAddress, settings, System.out);
    Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "items-api-shutdown"));
    server.start();
  }

  static InetSocketAddress parseBindAddress(String[] args) {
    String bind = DEFAULT_BIND;
    for (int i = 0; i < args.length; i++) {
      if (args[i].startsWith("--bind=")) {
        bind = args[i].substring("--bind=".length());
      } else if ("--bind".equals(args[i])) {
        if (i + 1 >= args.length) {
          throw new IllegalArgumentException("--bind requires a host:port value");
        }
        bind = args[++i];
      } else {
        throw new IllegalArgumentException("Unrecognised argument: " + args[i]);
      }
    }

    int separator = bind.lastIndexOf(':');
    if (separator <= 0 || separator == bind.length() - 1) {
      throw new IllegalArgumentException("Bind address must look like host:port, got " + bind);
    }
    var host = bind.substring(0, separator);
    int port;
    try {
      port = Integer.parseInt(bind.substring(separator + 1));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Bind port must be numeric, got " + bind, e);
    }
    return new InetSocketAddress(host, port);
  }
}
