package dev.vidcrawl.api;

import org.jspecify.annotations.Nullable;

/** The API refuses to return information about this user. */
public class RefusedUsernameException extends InvalidRequestException {

  public RefusedUsernameException(int statusCode, String responseBody, @Nullable ApiError error) {
    super(statusCode, responseBody, error);
  }
}
