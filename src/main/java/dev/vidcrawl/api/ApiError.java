package dev.vidcrawl.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * The {@code error} object the research API attaches to every response, successful or not.
 *
 * @param code {@code "ok"} on success
 * @param message human-readable detail, used to classify 400 responses
 * @param logId server-side correlation id
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ApiError(
    @Nullable String code,
    @Nullable String message,
    @JsonProperty("log_id") @Nullable String logId) {

  public boolean isOk() {
    return "ok".equals(code);
  }
}
