package dev.vidcrawl.api;

/** A response the API reported as successful did not carry a decodable JSON body. */
public class ResponseDecodingException extends ResearchApiException {

  public ResponseDecodingException(String message, Throwable cause) {
    super(message, cause);
  }
}
