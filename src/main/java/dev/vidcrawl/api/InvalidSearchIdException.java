package dev.vidcrawl.api;

import org.jspecify.annotations.Nullable;

/**
 * The API rejected a search id it issued moments earlier. Usually accepted again after a short
 * wait.
 */
public class InvalidSearchIdException extends InvalidRequestException {

  public InvalidSearchIdException(int statusCode, String responseBody, @Nullable ApiError error) {
    super(statusCode, responseBody, error);
  }
}
