package dev.vidcrawl.api;

/**
 * Sends one authenticated JSON POST to the research API.
 *
 * <p>Implementations must not interpret the status code; they throw {@link
 * org.springframework.web.client.ResourceAccessException} only when no response was received.
 */
public interface ApiTransport {

  ApiHttpResponse post(String url, String jsonBody);
}
