package dev.vidcrawl.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/**
 * Boolean combination of conditions. Serialized as {@code {"and": [...], "or": [...], "not":
 * [...]}} with empty groups left out.
 */
@JsonPropertyOrder({"and", "or", "not"})
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record VideoQuery(
    @JsonProperty("and") List<Condition> and,
    @JsonProperty("or") List<Condition> or,
    @JsonProperty("not") List<Condition> not) {

  public VideoQuery {
    and = and == null ? List.of() : List.copyOf(and);
    or = or == null ? List.of() : List.copyOf(or);
    not = not == null ? List.of() : List.copyOf(not);
    if (and.isEmpty() && or.isEmpty() && not.isEmpty()) {
      throw new IllegalArgumentException("At least one of and, or, not must have a condition");
    }
  }
}
