package dev.vidcrawl.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.vidcrawl.fixture.RecordingSleeper;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collections;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;

@ExtendWith(MockitoExtension.class)
class ResearchApiClientTest {

  static final String VIDEO_URL = "https://api.example.com/video/query/";
  static final String USER_URL = "https://api.example.com/user/info/";
  static final String COMMENT_URL = "https://api.example.com/video/comment/list/";

  static final String QUERY = "{\"and\":[{\"operation\":\"IN\",\"field_name\":\"region_code\","
      + "\"field_values\":[\"US\"]}]}";

  static final String OK_ERROR = "\"error\":{\"code\":\"ok\",\"message\":\"\",\"log_id\":\"l1\"}";

  static final String VIDEO_PAGE =
      "{\"data\":{\"videos\":[{\"id\":1,\"username\":\"alice\",\"create_time\":1709251200}],"
          + "\"cursor\":100,\"has_more\":true,\"search_id\":\"7345\"},"
          + OK_ERROR
          + "}";

  @Mock private ApiTransport transport;

  private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
  private final RecordingSleeper sleeper = new RecordingSleeper();
  private final Clock clock = Clock.fixed(Instant.parse("2024-03-01T22:30:00Z"), ZoneOffset.UTC);

  private ResearchApiClient client;

  @BeforeEach
  void setUp() {
    client = client(null, RateLimitWaitStrategy.WAIT_FOUR_HOURS);
  }

  private ResearchApiClient client(
      @Nullable Integer maxRateLimitRetries, RateLimitWaitStrategy strategy) {
    ResearchApiProperties properties =
        new ResearchApiProperties(
            VIDEO_URL,
            USER_URL,
            COMMENT_URL,
            "https://api.example.com/oauth/token/",
            Path.of("secrets.yaml"),
            null,
            strategy,
            maxRateLimitRetries,
            1000,
            1000,
            new ResearchApiProperties.TransportRetry(10, 1000, 3000, 300_000),
            new ResearchApiProperties.InvalidSearchIdRetry(5, 5000));
    return new ResearchApiClient(
        transport,
        objectMapper,
        properties,
        new RawResponseArchiver((Path) null, clock),
        clock,
        sleeper);
  }

  private static VideoRequest firstPageRequest() {
    return new VideoRequest(
        QUERY, LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 8), 100, false, null, null);
  }

  private static ApiHttpResponse badRequest(String message) {
    return new ApiHttpResponse(
        400,
        "{\"error\":{\"code\":\"invalid_params\",\"message\":\""
            + message
            + "\",\"log_id\":\"l2\"}}");
  }

  @Test
  void fetchVideosSendsQueryVerbatimAndParsesPage() throws Exception {
    when(transport.post(eq(VIDEO_URL), anyString()))
        .thenReturn(new ApiHttpResponse(200, VIDEO_PAGE));

    VideoResponse response = client.fetchVideos(firstPageRequest());

    ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
    verify(transport).post(eq(VIDEO_URL), body.capture());
    JsonNode sent = objectMapper.readTree(body.getValue());
    assertThat(sent.get("query")).isEqualTo(objectMapper.readTree(QUERY));
    assertThat(sent.get("start_date").asText()).isEqualTo("20240301");
    assertThat(sent.get("end_date").asText()).isEqualTo("20240308");
    assertThat(sent.get("max_count").asInt()).isEqualTo(100);
    assertThat(sent.get("is_random").asBoolean()).isFalse();
    assertThat(sent.has("cursor")).isFalse();
    assertThat(sent.has("search_id")).isFalse();

    assertThat(response.videos()).hasSize(1);
    assertThat(response.videos().get(0)).containsEntry("username", "alice");
    assertThat(response.cursor()).isEqualTo(100L);
    assertThat(response.hasMore()).isTrue();
    assertThat(response.searchId()).isEqualTo("7345");
    assertThat(response.error()).isNotNull();
    assertThat(response.error().isOk()).isTrue();
    assertThat(client.getRequestsSent()).isEqualTo(1);
  }

  @Test
  void followUpPageCarriesCursorAndSearchId() throws Exception {
    when(transport.post(eq(VIDEO_URL), anyString()))
        .thenReturn(new ApiHttpResponse(200, VIDEO_PAGE));

    client.fetchVideos(
        new VideoRequest(
            QUERY, LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 8), 100, false, 100L, "7345"));

    ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
    verify(transport).post(eq(VIDEO_URL), body.capture());
    JsonNode sent = objectMapper.readTree(body.getValue());
    assertThat(sent.get("cursor").asLong()).isEqualTo(100L);
    assertThat(sent.get("search_id").asText()).isEqualTo("7345");
  }

  @Test
  void rateLimitIsRetriedWithFourHourWaitsUntilAttemptCap() {
    client = client(5, RateLimitWaitStrategy.WAIT_FOUR_HOURS);
    when(transport.post(anyString(), anyString())).thenReturn(new ApiHttpResponse(429, "{}"));

    assertThatThrownBy(() -> client.fetchVideos(firstPageRequest()))
        .isInstanceOf(ApiRateLimitException.class);

    verify(transport, times(5)).post(anyString(), anyString());
    assertThat(sleeper.sleeps()).isEqualTo(Collections.nCopies(4, 14_400_000L));
    assertThat(client.getRequestsSent()).isEqualTo(5);
  }

  @Test
  void rateLimitThenSuccessReturnsPage() {
    when(transport.post(anyString(), anyString()))
        .thenReturn(new ApiHttpResponse(429, "{}"), new ApiHttpResponse(200, VIDEO_PAGE));

    VideoResponse response = client.fetchVideos(firstPageRequest());

    assertThat(response.videos()).hasSize(1);
    assertThat(sleeper.sleeps()).containsExactly(14_400_000L);
    assertThat(client.getRequestsSent()).isEqualTo(2);
  }

  @Test
  void rateLimitWaitsUntilNextUtcMidnightWhenConfigured() {
    client = client(null, RateLimitWaitStrategy.WAIT_NEXT_UTC_MIDNIGHT);
    when(transport.post(anyString(), anyString()))
        .thenReturn(new ApiHttpResponse(429, "{}"), new ApiHttpResponse(200, VIDEO_PAGE));

    client.fetchVideos(firstPageRequest());

    // clock is at 22:30 UTC
    assertThat(sleeper.sleeps()).containsExactly(90L * 60 * 1000);
  }

  @Test
  void undecodableBodyIsRetriedOnceWithoutWaiting() {
    when(transport.post(anyString(), anyString()))
        .thenReturn(new ApiHttpResponse(200, "<html>gateway</html>"));

    assertThatThrownBy(() -> client.fetchVideos(firstPageRequest()))
        .isInstanceOf(ResponseDecodingException.class);

    verify(transport, times(2)).post(anyString(), anyString());
    assertThat(sleeper.sleeps()).containsExactly(0L);
  }

  @Test
  void invalidSearchIdIsRetriedFiveTimesWithFixedWait() {
    when(transport.post(anyString(), anyString()))
        .thenReturn(badRequest("Search Id 7345 is invalid or expired"));

    assertThatThrownBy(() -> client.fetchVideos(firstPageRequest()))
        .isInstanceOf(InvalidSearchIdException.class);

    verify(transport, times(6)).post(anyString(), anyString());
    assertThat(sleeper.sleeps()).isEqualTo(Collections.nCopies(5, 5000L));
  }

  @Test
  void invalidCountOrCursorRecoversOnRetry() {
    when(transport.post(anyString(), anyString()))
        .thenReturn(badRequest("Invalid count or cursor"), new ApiHttpResponse(200, VIDEO_PAGE));

    VideoResponse response = client.fetchVideos(firstPageRequest());

    assertThat(response.searchId()).isEqualTo("7345");
    assertThat(sleeper.sleeps()).containsExactly(5000L);
  }

  @Test
  void otherBadRequestFailsImmediately() {
    when(transport.post(anyString(), anyString())).thenReturn(badRequest("Invalid query field"));

    assertThatThrownBy(() -> client.fetchVideos(firstPageRequest()))
        .isExactlyInstanceOf(InvalidRequestException.class)
        .satisfies(
            e -> {
              InvalidRequestException error = (InvalidRequestException) e;
              assertThat(error.getStatusCode()).isEqualTo(400);
              assertThat(error.getError()).isNotNull();
              assertThat(error.getError().message()).isEqualTo("Invalid query field");
            });

    verify(transport, times(1)).post(anyString(), anyString());
    assertThat(sleeper.sleeps()).isEmpty();
  }

  @Test
  void serverErrorIsNotRetriedBySemanticLayer() {
    when(transport.post(anyString(), anyString()))
        .thenReturn(new ApiHttpResponse(500, "{\"error\":{\"code\":\"internal_error\"}}"));

    assertThatThrownBy(() -> client.fetchVideos(firstPageRequest()))
        .isInstanceOf(ApiServerException.class)
        .extracting(e -> ((ApiServerException) e).getStatusCode())
        .isEqualTo(500);

    verify(transport, times(1)).post(anyString(), anyString());
  }

  @Test
  void transportFailuresAreRetriedWithClampedExponentialWait() {
    when(transport.post(anyString(), anyString()))
        .thenThrow(new ResourceAccessException("connection reset"))
        .thenThrow(new ResourceAccessException("connection reset"))
        .thenThrow(new ResourceAccessException("connection reset"))
        .thenReturn(new ApiHttpResponse(200, VIDEO_PAGE));

    VideoResponse response = client.fetchVideos(firstPageRequest());

    assertThat(response.videos()).hasSize(1);
    assertThat(sleeper.sleeps()).containsExactly(3000L, 3000L, 4000L);
  }

  @Test
  void transportFailureIsRethrownAfterTenAttempts() {
    when(transport.post(anyString(), anyString()))
        .thenThrow(new ResourceAccessException("connection refused"));

    assertThatThrownBy(() -> client.fetchVideos(firstPageRequest()))
        .isInstanceOf(ResourceAccessException.class)
        .hasMessage("connection refused");

    verify(transport, times(10)).post(anyString(), anyString());
    assertThat(sleeper.sleeps()).hasSize(9);
  }

  @Test
  void fetchUserInfoAddsUsernameToProfile() {
    when(transport.post(eq(USER_URL), anyString()))
        .thenReturn(
            new ApiHttpResponse(
                200,
                "{\"data\":{\"display_name\":\"Alice\",\"follower_count\":12}," + OK_ERROR + "}"));

    UserInfoResponse response = client.fetchUserInfo(new UserInfoRequest("alice"));

    assertThat(response.isOk()).isTrue();
    assertThat(response.userInfo())
        .containsEntry("username", "alice")
        .containsEntry("display_name", "Alice")
        .containsEntry("follower_count", 12);
  }

  @Test
  void unknownUserIsClassified() {
    when(transport.post(eq(USER_URL), anyString()))
        .thenReturn(badRequest("User ghost is invalid: cannot find the user"));

    assertThatThrownBy(() -> client.fetchUserInfo(new UserInfoRequest("ghost")))
        .isInstanceOf(InvalidUsernameException.class);
  }

  @Test
  void refusedUserIsClassified() {
    when(transport.post(eq(USER_URL), anyString()))
        .thenReturn(badRequest("API cannot return this user's information"));

    assertThatThrownBy(() -> client.fetchUserInfo(new UserInfoRequest("private")))
        .isInstanceOf(RefusedUsernameException.class);
  }

  @Test
  void fetchCommentsParsesPage() {
    when(transport.post(eq(COMMENT_URL), anyString()))
        .thenReturn(
            new ApiHttpResponse(
                200,
                "{\"data\":{\"comments\":[{\"id\":9,\"video_id\":1,\"text\":\"hi\"}],"
                    + "\"cursor\":1,\"has_more\":false},"
                    + OK_ERROR
                    + "}"));

    CommentsResponse response = client.fetchComments(CommentsRequest.firstPage(1L));

    assertThat(response.isOk()).isTrue();
    assertThat(response.comments())
        .singleElement()
        .satisfies(c -> assertThat(c).containsEntry("text", "hi"));
    assertThat(response.hasMore()).isFalse();
    assertThat(response.cursor()).isEqualTo(1L);
  }

  @Test
  void requestCounterCanBeResetAndReportsRemainingQuota() {
    when(transport.post(anyString(), anyString())).thenReturn(new ApiHttpResponse(200, VIDEO_PAGE));

    client.fetchVideos(firstPageRequest());
    client.fetchVideos(firstPageRequest());

    assertThat(client.getRequestsSent()).isEqualTo(2);
    assertThat(client.expectedRemainingQuota(1000)).isEqualTo(998);
    client.resetRequestCount();
    assertThat(client.getRequestsSent()).isZero();
  }
}
