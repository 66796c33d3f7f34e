package dev.vidcrawl.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Client credentials for the research API, read from a YAML file with the keys {@code client_id},
 * {@code client_secret} and {@code client_key}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ApiCredentials(
    @JsonProperty("client_id") String clientId,
    @JsonProperty("client_secret") String clientSecret,
    @JsonProperty("client_key") String clientKey) {

  private static final YAMLMapper YAML = new YAMLMapper();

  public ApiCredentials {
    requireNotBlank(clientId, "client_id");
    requireNotBlank(clientSecret, "client_secret");
    requireNotBlank(clientKey, "client_key");
  }

  /**
   * Reads credentials from a YAML file.
   *
   * @throws AccessTokenException if the file cannot be read or a secret is missing
   */
  public static ApiCredentials load(Path credentialsFile) {
    try {
      return YAML.readValue(credentialsFile.toFile(), ApiCredentials.class);
    } catch (IOException e) {
      throw new AccessTokenException("Unable to read API credentials from " + credentialsFile, e);
    }
  }

  private static void requireNotBlank(String value, String key) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(key + " must not be empty");
    }
  }

  @Override
  public String toString() {
    return "ApiCredentials[clientId=" + clientId + ", clientSecret=***, clientKey=***]";
  }
}
