package com.polybot.arb.web;

import com.polybot.arb.polymarket.http.PolymarketHttpException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
public class ArbExceptionHandler {

  @ExceptionHandler(PolymarketHttpException.class)
  public ResponseEntity<UpstreamHttpErrorResponse> handle(PolymarketHttpException e) {
    log.warn("upstream error: status={} method={} url={}", e.statusCode(), e.method(), e.uri());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(new UpstreamHttpErrorResponse(e.statusCode(), e.method(), e.uri().toString(), e.responseSnippet()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> badRequest(IllegalArgumentException e) {
    return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage()));
  }

  @ExceptionHandler(IllegalStateException.class)
  public ResponseEntity<ErrorResponse> conflict(IllegalStateException e) {
    log.warn("request rejected: {}", e.getMessage());
    return ResponseEntity.status(HttpStatus.CONFLICT).body(new ErrorResponse(e.getMessage()));
  }

  public record UpstreamHttpErrorResponse(int status, String method, String url, String bodySnippet) {
  }

  public record ErrorResponse(String error) {
  }
}
