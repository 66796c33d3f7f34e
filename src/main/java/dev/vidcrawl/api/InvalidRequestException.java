package dev.vidcrawl.api;

import org.jspecify.annotations.Nullable;

/**
 * HTTP 4xx other than 429. Not retried, except for the subclasses the semantic retry layer knows
 * to be transient.
 */
public class InvalidRequestException extends ResearchApiException {

  private final int statusCode;
  private final String responseBody;
  private final @Nullable ApiError error;

  public InvalidRequestException(int statusCode, String responseBody, @Nullable ApiError error) {
    super("API rejected request with " + statusCode + ": " + responseBody);
    this.statusCode = statusCode;
    this.responseBody = responseBody;
    this.error = error;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public String getResponseBody() {
    return responseBody;
  }

  /** The decoded {@code error} object of the response, if the body could be parsed. */
  public @Nullable ApiError getError() {
    return error;
  }
}
