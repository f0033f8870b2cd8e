package com.polybot.arb.polymarket.http;

import java.net.URI;
import java.util.Objects;

/**
 * Non-2xx response from a Polymarket HTTP API. Holds at most 2000 characters of the body.
 */
public final class PolymarketHttpException extends RuntimeException {

  private static final int SNIPPET_LIMIT = 2000;

  private final String method;
  private final URI uri;
  private final int statusCode;
  private final String responseSnippet;

  public PolymarketHttpException(String method, URI uri, int statusCode, String responseBody) {
    super("HTTP " + statusCode + " from " + method + " " + uri + ": " + snippet(responseBody));
    this.method = Objects.requireNonNull(method, "method");
    this.uri = Objects.requireNonNull(uri, "uri");
    this.statusCode = statusCode;
    this.responseSnippet = snippet(responseBody);
  }

  public String method() {
    return method;
  }

  public URI uri() {
    return uri;
  }

  public int statusCode() {
    return statusCode;
  }

  public String responseSnippet() {
    return responseSnippet;
  }

  public boolean isNotFound() {
    return statusCode == 404;
  }

  private static String snippet(String body) {
    if (body == null) {
      return "";
    }
    return body.length() <= SNIPPET_LIMIT ? body : body.substring(0, SNIPPET_LIMIT) + "...";
  }
}
