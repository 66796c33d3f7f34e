package dev.vidcrawl.api;

import java.net.http.HttpClient;
import java.time.Duration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient}s used to talk to the research API.
 *
 * <p>Both clients share the timeouts from {@code vidcrawl.api.*}. The JDK {@link HttpClient}
 * factory is used so that a 401 on a streamed POST body is returned as a response instead of
 * failing inside the connection.
 */
@Configuration
@EnableConfigurationProperties(ResearchApiProperties.class)
public class ResearchApiConfig {

  /**
   * Token endpoint client. Not intercepted: it authenticates with the client credentials.
   *
   * @param builder Spring-provided builder with common defaults
   * @param properties API configuration
   * @return a client for the OAuth token exchange
   */
  @Bean
  public AccessTokenClient accessTokenClient(
      RestClient.Builder builder, ResearchApiProperties properties) {
    RestClient restClient = builder.requestFactory(requestFactory(properties)).build();
    return new AccessTokenClient(
        restClient, properties.tokenUrl(), properties.credentialsFile());
  }

  @Bean
  public BearerTokenInterceptor bearerTokenInterceptor(AccessTokenClient accessTokenClient) {
    return new BearerTokenInterceptor(accessTokenClient);
  }

  /**
   * Research API client carrying the bearer token and JSON headers.
   *
   * @param builder Spring-provided builder with common defaults
   * @param properties API configuration
   * @param bearerTokenInterceptor token injection and 401 replay
   * @return a named REST client bean for injection into {@link RestClientApiTransport}
   */
  @Bean
  public RestClient researchApiRestClient(
      RestClient.Builder builder,
      ResearchApiProperties properties,
      BearerTokenInterceptor bearerTokenInterceptor) {
    return builder
        .requestFactory(requestFactory(properties))
        .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
        .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
        .requestInterceptor(bearerTokenInterceptor)
        .build();
  }

  private static JdkClientHttpRequestFactory requestFactory(ResearchApiProperties properties) {
    HttpClient httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofMillis(properties.connectTimeoutMs()))
            .build();
    JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(Duration.ofMillis(properties.readTimeoutMs()));
    return requestFactory;
  }
}
