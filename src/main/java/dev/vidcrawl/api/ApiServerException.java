package dev.vidcrawl.api;

/** HTTP 5xx from the research API. The API answers 500 occasionally under normal operation. */
public class ApiServerException extends ResearchApiException {

  private final int statusCode;

  public ApiServerException(int statusCode, String body) {
    super("API responded " + statusCode + ": " + body);
    this.statusCode = statusCode;
  }

  public int getStatusCode() {
    return statusCode;
  }
}
