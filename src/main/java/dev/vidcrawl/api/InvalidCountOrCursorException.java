package dev.vidcrawl.api;

import org.jspecify.annotations.Nullable;

/**
 * The API rejected the page cursor. Seen together with search id rejections and retried the same
 * way.
 */
public class InvalidCountOrCursorException extends InvalidRequestException {

  public InvalidCountOrCursorException(
      int statusCode, String responseBody, @Nullable ApiError error) {
    super(statusCode, responseBody, error);
  }
}
