package dev.vidcrawl.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import java.util.Objects;

/**
 * One query condition. Every value is validated against its field on construction.
 *
 * @param field the queried field
 * @param values one value for {@code EQ}-style operations, any number for {@code IN}
 * @param operation how field and values are compared
 */
@JsonPropertyOrder({"operation", "field_name", "field_values"})
public record Condition(
    @JsonProperty("field_name") Field field,
    @JsonProperty("field_values") List<String> values,
    @JsonProperty("operation") Operation operation) {

  public Condition {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(operation, "operation");
    values = List.copyOf(values);
    if (values.isEmpty()) {
      throw new IllegalArgumentException("Condition on " + field.fieldName() + " has no values");
    }
    values.forEach(field::validate);
  }

  public static Condition of(Field field, String value, Operation operation) {
    return new Condition(field, List.of(value), operation);
  }
}
