package com.polybot.arb.polymarket.http;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds requests against one base URI, adding query parameters and extra headers.
 */
public final class HttpRequestFactory {

  private final URI baseUri;
  private final Duration timeout;

  public HttpRequestFactory(URI baseUri, Duration timeout) {
    this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  public HttpRequest get(String path, Map<String, String> query, Map<String, String> headers) {
    HttpRequest.Builder builder = HttpRequest.newBuilder(uri(path, query)).GET().timeout(timeout);
    applyHeaders(builder, headers);
    return builder.build();
  }

  public HttpRequest withJsonBody(String method, String path, Map<String, String> headers, String body) {
    HttpRequest.Builder builder = HttpRequest.newBuilder(uri(path, Map.of()))
        .method(method, HttpRequest.BodyPublishers.ofString(body == null ? "" : body))
        .timeout(timeout)
        .header("Content-Type", "application/json");
    applyHeaders(builder, headers);
    return builder.build();
  }

  URI uri(String path, Map<String, String> query) {
    String base = baseUri.toString();
    if (base.endsWith("/") && path.startsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    StringBuilder sb = new StringBuilder(base).append(path);
    if (query != null && !query.isEmpty()) {
      sb.append('?').append(query.entrySet().stream()
          .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
          .collect(Collectors.joining("&")));
    }
    return URI.create(sb.toString());
  }

  private static void applyHeaders(HttpRequest.Builder builder, Map<String, String> headers) {
    if (headers == null) {
      return;
    }
    headers.forEach(builder::header);
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
