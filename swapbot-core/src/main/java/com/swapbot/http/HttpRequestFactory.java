package com.swapbot.http;


import lombok.NonNull;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

public final class HttpRequestFactory {

  private final URI baseUri;
  private final Duration timeout;

  public HttpRequestFactory(@NonNull URI baseUri, @NonNull Duration timeout) {
    this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  public URI baseUri() {
    return baseUri;
  }

  public HttpRequest get(String path, Map<String, String> query) {
    return HttpRequest.newBuilder(resolve(path, query))
        .timeout(timeout)
        .header("Accept", "application/json")
        .GET()
        .build();
  }

  public HttpRequest postJson(String path, String jsonBody) {
    return HttpRequest.newBuilder(resolve(path, Map.of()))
        .timeout(timeout)
        .header("Accept", "application/json")
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(jsonBody, StandardCharsets.UTF_8))
        .build();
  }

  URI resolve(String path, Map<String, String> query) {
    String base = baseUri.toString();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    StringBuilder sb = new StringBuilder(base);
    if (path != null && !path.isEmpty()) {
      if (!path.startsWith("/")) {
        sb.append('/');
      }
      sb.append(path);
    }
    if (query != null && !query.isEmpty()) {
      String qs = query.entrySet().stream()
          .filter(e -> e.getValue() != null)
          .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
          .collect(Collectors.joining("&"));
      if (!qs.isEmpty()) {
        sb.append(sb.indexOf("?") >= 0 ? '&' : '?').append(qs);
      }
    }
    return URI.create(sb.toString());
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
