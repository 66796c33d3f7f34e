package dev.vidcrawl.api;

import java.nio.charset.StandardCharsets;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;

/** {@link ApiTransport} backed by the bearer-authenticated {@code researchApiRestClient}. */
@Component
public class RestClientApiTransport implements ApiTransport {

  private final RestClient restClient;

  public RestClientApiTransport(@Qualifier("researchApiRestClient") RestClient restClient) {
    this.restClient = restClient;
  }

  @Override
  public ApiHttpResponse post(String url, String jsonBody) {
    return restClient
        .post()
        .uri(url)
        .contentType(MediaType.APPLICATION_JSON)
        .body(jsonBody)
        .exchange(
            (request, response) ->
                new ApiHttpResponse(
                    response.getStatusCode().value(),
                    StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8)));
  }
}
