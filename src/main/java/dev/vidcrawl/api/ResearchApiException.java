package dev.vidcrawl.api;

/** Base class for failures reported by, or while talking to, the research API. */
public class ResearchApiException extends RuntimeException {

  public ResearchApiException(String message) {
    super(message);
  }

  public ResearchApiException(String message, Throwable cause) {
    super(message, cause);
  }
}
