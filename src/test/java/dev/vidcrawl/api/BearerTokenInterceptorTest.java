package dev.vidcrawl.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withUnauthorizedRequest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

@ExtendWith(MockitoExtension.class)
class BearerTokenInterceptorTest {

  static final String URL = "https://api.example.com/video/query/";

  @Mock private AccessTokenClient tokenClient;

  private MockRestServiceServer server;
  private RestClientApiTransport transport;

  @BeforeEach
  void setUp() {
    RestClient.Builder builder =
        RestClient.builder().requestInterceptor(new BearerTokenInterceptor(tokenClient));
    server = MockRestServiceServer.bindTo(builder).build();
    transport = new RestClientApiTransport(builder.build());
  }

  @Test
  void firstRequestFetchesTokenAndSendsBearerHeader() {
    when(tokenClient.fetchAccessToken()).thenReturn("token-1");
    server
        .expect(requestTo(URL))
        .andExpect(method(HttpMethod.POST))
        .andExpect(header("Authorization", "Bearer token-1"))
        .andExpect(content().json("{\"username\":\"alice\"}"))
        .andRespond(withSuccess("{\"data\":{}}", MediaType.APPLICATION_JSON));

    ApiHttpResponse response = transport.post(URL, "{\"username\":\"alice\"}");

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.body()).isEqualTo("{\"data\":{}}");
    server.verify();
  }

  @Test
  void tokenIsReusedAcrossRequests() {
    when(tokenClient.fetchAccessToken()).thenReturn("token-1");
    server
        .expect(requestTo(URL))
        .andExpect(header("Authorization", "Bearer token-1"))
        .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));
    server
        .expect(requestTo(URL))
        .andExpect(header("Authorization", "Bearer token-1"))
        .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

    transport.post(URL, "{}");
    transport.post(URL, "{}");

    verify(tokenClient, times(1)).fetchAccessToken();
    server.verify();
  }

  @Test
  void unauthorizedResponseRefreshesTokenAndReplaysOnce() {
    when(tokenClient.fetchAccessToken()).thenReturn("expired", "fresh");
    server
        .expect(requestTo(URL))
        .andExpect(header("Authorization", "Bearer expired"))
        .andRespond(withUnauthorizedRequest());
    server
        .expect(requestTo(URL))
        .andExpect(header("Authorization", "Bearer fresh"))
        .andExpect(content().json("{\"video_id\":1}"))
        .andRespond(withSuccess("{\"data\":{\"comments\":[]}}", MediaType.APPLICATION_JSON));

    ApiHttpResponse response = transport.post(URL, "{\"video_id\":1}");

    assertThat(response.statusCode()).isEqualTo(200);
    verify(tokenClient, times(2)).fetchAccessToken();
    server.verify();
  }

  @Test
  void secondUnauthorizedResponseIsReturnedToCaller() {
    when(tokenClient.fetchAccessToken()).thenReturn("expired", "also-rejected");
    server.expect(requestTo(URL)).andRespond(withUnauthorizedRequest());
    server
        .expect(requestTo(URL))
        .andRespond(
            withStatus(HttpStatus.UNAUTHORIZED)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"error\":{\"code\":\"access_token_invalid\"}}"));

    ApiHttpResponse response = transport.post(URL, "{}");

    assertThat(response.statusCode()).isEqualTo(401);
    assertThat(response.body()).contains("access_token_invalid");
    verify(tokenClient, times(2)).fetchAccessToken();
    server.verify();
  }
}
