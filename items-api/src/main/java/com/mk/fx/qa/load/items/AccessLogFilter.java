package com.mk.fx.qa.load.items;

import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpExchange;
import java.io.IOException;
import java.io.PrintStream;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Writes one common-log-format line per exchange: {@code host - - [time] "request" status bytes}.
 * Timestamps have second resolution, so repeated requests within a second produce identical lines.
 */
final class AccessLogFilter extends Filter {

  private static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern("dd/MMM/yyyy:HH:mm:ss Z", Locale.US);

  private final PrintStream out;

  AccessLogFilter(PrintStream out) {
    this.out = out;
  }

  @Override
  public void doFilter(HttpExchange exchange, Chain chain) throws IOException {
    try {
      chain.doFilter(exchange);
    } finally {
      out.println(format(exchange));
    }
  }

  @Override
  public String description() {
    return "common log format access log";
  }

  static String format(HttpExchange exchange) {
    String length = exchange.getResponseHeaders().getFirst("Content-length");
    return String.format(
        "%s - - [%s] \"%s %s %s\" %d %s",
        exchange.getRemoteAddress().getAddress().getHostAddress(),
        TIMESTAMP.format(ZonedDateTime.now()),
        exchange.getRequestMethod(),
        exchange.getRequestURI(),
        exchange.getProtocol(),
        exchange.getResponseCode(),
        length != null ? length : "-");
  }
}
