package dev.vidcrawl.api;

/** HTTP 429: the daily request quota is exhausted. */
public class ApiRateLimitException extends ResearchApiException {

  public ApiRateLimitException(String message) {
    super(message);
  }
}
