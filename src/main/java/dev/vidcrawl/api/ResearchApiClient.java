package dev.vidcrawl.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;

/**
 * Authenticated request/retry client for the research API.
 *
 * <p>Every fetch goes through two retry layers. The inner transport layer retries only {@link
 * ResourceAccessException} with clamped exponential back-off. The outer semantic layer wraps the
 * send-and-decode step and retries according to {@link ApiRetryRules}. Both re-raise the final
 * failure unchanged.
 *
 * <p>Each HTTP send, retries included, increments {@link #getRequestsSent()}.
 */
@Service
public class ResearchApiClient {

  private static final Logger log = LoggerFactory.getLogger(ResearchApiClient.class);

  static final Pattern SEARCH_ID_INVALID_MESSAGE =
      Pattern.compile("Search Id \\d+ is invalid or expired");

  private static final TypeReference<List<Map<String, Object>>> ITEM_LIST =
      new TypeReference<>() {};
  private static final TypeReference<Map<String, Object>> ITEM = new TypeReference<>() {};

  private final ApiTransport transport;
  private final ObjectMapper objectMapper;
  private final ResearchApiProperties properties;
  private final RawResponseArchiver archiver;
  private final RetryTemplate transportRetry;
  private final RetryTemplate semanticRetry;
  private final AtomicLong requestsSent = new AtomicLong();

  public ResearchApiClient(
      ApiTransport transport,
      ObjectMapper objectMapper,
      ResearchApiProperties properties,
      RawResponseArchiver archiver,
      Clock clock,
      Sleeper sleeper) {
    this.transport = transport;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.archiver = archiver;
    this.transportRetry = transportRetryTemplate(properties.transportRetry(), sleeper);
    this.semanticRetry =
        semanticRetryTemplate(
            ApiRetryRules.standard(properties, clock), properties.maxRateLimitRetries(), sleeper);
  }

  public VideoResponse fetchVideos(VideoRequest request) {
    return withSemanticRetry(
        context -> parseVideoResponse(decode(post(properties.videoQueryUrl(), request))));
  }

  public UserInfoResponse fetchUserInfo(UserInfoRequest request) {
    return withSemanticRetry(
        context ->
            parseUserInfoResponse(
                request.username(), decode(post(properties.userInfoUrl(), request))));
  }

  public CommentsResponse fetchComments(CommentsRequest request) {
    return withSemanticRetry(
        context -> parseCommentsResponse(decode(post(properties.commentListUrl(), request))));
  }

  public long getRequestsSent() {
    return requestsSent.get();
  }

  public void resetRequestCount() {
    requestsSent.set(0);
  }

  /** Daily quota minus the requests this client has sent so far. */
  public long expectedRemainingQuota(int dailyQuota) {
    return dailyQuota - requestsSent.get();
  }

  private <T> T withSemanticRetry(RetryCallback<T, RuntimeException> callback) {
    return semanticRetry.execute(callback);
  }

  private ApiHttpResponse post(String url, Object request) {
    String body = toJson(request);
    return transportRetry.execute(
        (RetryCallback<ApiHttpResponse, RuntimeException>) context -> send(url, body));
  }

  private ApiHttpResponse send(String url, String body) {
    log.debug("Sending request with data: {}", body);
    ApiHttpResponse response = transport.post(url, body);
    requestsSent.incrementAndGet();
    log.debug("Response {}: {}", response.statusCode(), response.body());

    int status = response.statusCode();
    if (status == 200) {
      archiver.archive(response.body());
      return response;
    }
    if (status == 429) {
      throw new ApiRateLimitException(
          "Response indicates rate limit exceeded. Requests sent: " + requestsSent.get());
    }
    if (status >= 400 && status < 500) {
      throw classifyInvalidRequest(response);
    }
    if (status == 500) {
      log.info("API responded 500. This happens occasionally");
      throw new ApiServerException(status, response.body());
    }
    log.warn("Request failed, status code {} - body {} - data {}", status, response.body(), body);
    if (status > 500) {
      throw new ApiServerException(status, response.body());
    }
    throw new ResearchApiException("Unexpected response status " + status);
  }

  private InvalidRequestException classifyInvalidRequest(ApiHttpResponse response) {
    int status = response.statusCode();
    ApiError error = readError(response.body());
    String message = error == null || error.message() == null ? "" : error.message();
    if (status == 400) {
      if (SEARCH_ID_INVALID_MESSAGE.matcher(message).lookingAt()) {
        return new InvalidSearchIdException(status, response.body(), error);
      }
      if (message.contains("is invalid: cannot find the user")) {
        return new InvalidUsernameException(status, response.body(), error);
      }
      if (message.contains("API cannot return this user's information")) {
        return new RefusedUsernameException(status, response.body(), error);
      }
      if (message.contains("Invalid count or cursor")) {
        return new InvalidCountOrCursorException(status, response.body(), error);
      }
    }
    return new InvalidRequestException(status, response.body(), error);
  }

  private @Nullable ApiError readError(String body) {
    try {
      JsonNode error = objectMapper.readTree(body).path("error");
      return error.isObject() ? objectMapper.treeToValue(error, ApiError.class) : null;
    } catch (JsonProcessingException e) {
      log.debug("Unable to JSON decode response data:\n{}", body);
      return null;
    }
  }

  private JsonNode decode(ApiHttpResponse response) {
    try {
      return objectMapper.readTree(response.body());
    } catch (JsonProcessingException e) {
      log.info(
          "Error parsing JSON response (status {}):\n{}", response.statusCode(), response.body());
      throw new ResponseDecodingException("Response body is not valid JSON", e);
    }
  }

  private VideoResponse parseVideoResponse(JsonNode root) {
    JsonNode data = root.path("data");
    return new VideoResponse(
        items(data.path("videos")),
        longOrNull(data.path("cursor")),
        data.path("has_more").asBoolean(false),
        data.hasNonNull("search_id") ? data.get("search_id").asText() : null,
        error(root));
  }

  private UserInfoResponse parseUserInfoResponse(String username, JsonNode root) {
    JsonNode data = root.path("data");
    Map<String, Object> userInfo = null;
    if (data.isObject()) {
      userInfo = new LinkedHashMap<>(objectMapper.convertValue(data, ITEM));
      userInfo.put("username", username);
    }
    return new UserInfoResponse(username, userInfo, error(root));
  }

  private CommentsResponse parseCommentsResponse(JsonNode root) {
    JsonNode data = root.path("data");
    return new CommentsResponse(
        items(data.path("comments")),
        longOrNull(data.path("cursor")),
        data.path("has_more").asBoolean(false),
        error(root));
  }

  private List<Map<String, Object>> items(JsonNode node) {
    return node.isArray() ? objectMapper.convertValue(node, ITEM_LIST) : List.of();
  }

  private @Nullable ApiError error(JsonNode root) {
    JsonNode error = root.path("error");
    return error.isObject() ? objectMapper.convertValue(error, ApiError.class) : null;
  }

  private static @Nullable Long longOrNull(JsonNode node) {
    return node.isNumber() || node.isTextual() ? node.asLong() : null;
  }

  private String toJson(Object request) {
    try {
      return objectMapper.writeValueAsString(request);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Unable to serialize request " + request, e);
    }
  }

  private static RetryTemplate transportRetryTemplate(
      ResearchApiProperties.TransportRetry config, Sleeper sleeper) {
    RetryTemplate template = new RetryTemplate();
    template.setRetryPolicy(
        new SimpleRetryPolicy(
            config.maxAttempts(),
            Map.<Class<? extends Throwable>, Boolean>of(ResourceAccessException.class, true)));
    template.setBackOffPolicy(
        new ClampedExponentialBackOffPolicy(
            config.multiplierMs(), config.minWaitMs(), config.maxWaitMs(), sleeper));
    return template;
  }

  private static RetryTemplate semanticRetryTemplate(
      List<ApiRetryRule> rules, @Nullable Integer maxAttempts, Sleeper sleeper) {
    RetryTemplate template = new RetryTemplate();
    template.setRetryPolicy(new CompositeApiRetryPolicy(rules, maxAttempts));
    template.setBackOffPolicy(new CompositeApiBackOffPolicy(rules, sleeper));
    return template;
  }
}
