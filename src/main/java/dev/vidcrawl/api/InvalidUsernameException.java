package dev.vidcrawl.api;

import org.jspecify.annotations.Nullable;

/** User info was requested for a username the API cannot find. */
public class InvalidUsernameException extends InvalidRequestException {

  public InvalidUsernameException(int statusCode, String responseBody, @Nullable ApiError error) {
    super(statusCode, responseBody, error);
  }
}
