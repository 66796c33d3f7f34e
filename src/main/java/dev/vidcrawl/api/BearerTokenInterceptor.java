package dev.vidcrawl.api;

import java.io.IOException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;

/**
 * Adds {@code Authorization: Bearer} to every request. A 401 response triggers exactly one token
 * refresh and one replay of the same request; the replay's response is returned whatever its
 * status.
 */
public class BearerTokenInterceptor implements ClientHttpRequestInterceptor {

  private static final Logger log = LoggerFactory.getLogger(BearerTokenInterceptor.class);

  private final AccessTokenClient tokenClient;
  private @Nullable String accessToken;

  public BearerTokenInterceptor(AccessTokenClient tokenClient) {
    this.tokenClient = tokenClient;
  }

  @Override
  public ClientHttpResponse intercept(
      HttpRequest request, byte[] body, ClientHttpRequestExecution execution) throws IOException {
    request.getHeaders().setBearerAuth(currentToken());
    ClientHttpResponse response = execution.execute(request, body);
    if (response.getStatusCode().value() != HttpStatus.UNAUTHORIZED.value()) {
      return response;
    }

    log.info("Fetching new token as the previous token expired");
    response.close();
    request.getHeaders().setBearerAuth(refreshToken());
    return execution.execute(request, body);
  }

  private synchronized String currentToken() {
    if (accessToken == null) {
      accessToken = tokenClient.fetchAccessToken();
    }
    return accessToken;
  }

  private synchronized String refreshToken() {
    accessToken = tokenClient.fetchAccessToken();
    return accessToken;
  }
}
