package dev.vidcrawl.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.nio.file.Path;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

/**
 * Exchanges client credentials for a bearer token. The credentials file is read on the first
 * exchange and kept for later refreshes.
 */
public class AccessTokenClient {

  private static final Logger log = LoggerFactory.getLogger(AccessTokenClient.class);

  private final RestClient restClient;
  private final String tokenUrl;
  private final Path credentialsFile;
  private @Nullable ApiCredentials credentials;

  public AccessTokenClient(RestClient restClient, String tokenUrl, Path credentialsFile) {
    this.restClient = restClient;
    this.tokenUrl = tokenUrl;
    this.credentialsFile = credentialsFile;
  }

  /**
   * Requests a fresh access token.
   *
   * @return the {@code access_token} of the response
   * @throws AccessTokenException if the exchange fails or the response carries no token
   */
  public synchronized String fetchAccessToken() {
    if (credentials == null) {
      credentials = ApiCredentials.load(credentialsFile);
    }
    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("client_key", credentials.clientKey());
    form.add("client_secret", credentials.clientSecret());
    form.add("grant_type", "client_credentials");

    TokenResponse response =
        restClient
            .post()
            .uri(tokenUrl)
            .contentType(MediaType.APPLICATION_FORM_URLENCODED)
            .header(HttpHeaders.CACHE_CONTROL, "no-cache")
            .body(form)
            .retrieve()
            .onStatus(
                HttpStatusCode::isError,
                (request, errorResponse) -> {
                  throw new AccessTokenException(
                      "Token request failed with status " + errorResponse.getStatusCode().value());
                })
            .body(TokenResponse.class);

    if (response == null || response.accessToken() == null || response.accessToken().isBlank()) {
      throw new AccessTokenException("Token response did not contain an access_token");
    }
    log.info("Access token retrieval succeeded (expires in {}s)", response.expiresIn());
    return response.accessToken();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record TokenResponse(
      @JsonProperty("access_token") @Nullable String accessToken,
      @JsonProperty("expires_in") @Nullable Long expiresIn,
      @JsonProperty("token_type") @Nullable String tokenType) {}
}
