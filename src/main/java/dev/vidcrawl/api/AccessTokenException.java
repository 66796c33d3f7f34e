package dev.vidcrawl.api;

/** The client-credentials exchange failed or did not return an access token. */
public class AccessTokenException extends ResearchApiException {

  public AccessTokenException(String message) {
    super(message);
  }

  public AccessTokenException(String message, Throwable cause) {
    super(message, cause);
  }
}
