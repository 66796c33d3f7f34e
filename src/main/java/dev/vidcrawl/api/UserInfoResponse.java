package dev.vidcrawl.api;

import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * User profile lookup result. The API does not echo the username, so it is added to {@code
 * userInfo} under {@code "username"}. A lookup the API refused carries only the error.
 */
public record UserInfoResponse(
    String username, @Nullable Map<String, Object> userInfo, @Nullable ApiError error) {

  public boolean isOk() {
    return userInfo != null && error != null && error.isOk();
  }
}
