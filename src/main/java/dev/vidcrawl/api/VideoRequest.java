package dev.vidcrawl.api;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import java.time.LocalDate;
import org.jspecify.annotations.Nullable;

/**
 * One page request against the video query endpoint.
 *
 * <p>{@code query} is already-serialized JSON and is embedded verbatim. The start date is
 * inclusive, the end date is not. {@code cursor} and {@code searchId} are omitted from the body
 * until the API has issued them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VideoRequest(
    @JsonRawValue @JsonProperty("query") String query,
    @JsonProperty("start_date") @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyyMMdd")
        LocalDate startDate,
    @JsonProperty("end_date") @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyyMMdd")
        LocalDate endDate,
    @JsonProperty("max_count") int maxCount,
    @JsonProperty("is_random") boolean isRandom,
    @JsonProperty("cursor") @Nullable Long cursor,
    @JsonProperty("search_id") @Nullable String searchId) {}
