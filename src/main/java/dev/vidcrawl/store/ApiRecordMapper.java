package dev.vidcrawl.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Maps the loosely-typed items of API responses to typed records and validates them. A batch is
 * all-or-nothing: one invalid item rejects the whole batch before anything is written.
 */
@Component
public class ApiRecordMapper {

  private final ObjectMapper objectMapper;
  private final Validator validator;

  public ApiRecordMapper(ObjectMapper objectMapper, Validator validator) {
    this.objectMapper = objectMapper;
    this.validator = validator;
  }

  public List<VideoRecord> toVideoRecords(List<Map<String, Object>> videos) {
    return mapAll(videos, VideoRecord.class);
  }

  public List<UserInfoRecord> toUserInfoRecords(List<Map<String, Object>> userInfos) {
    return mapAll(userInfos, UserInfoRecord.class);
  }

  public List<CommentRecord> toCommentRecords(List<Map<String, Object>> comments) {
    return mapAll(comments, CommentRecord.class);
  }

  private <T> List<T> mapAll(List<Map<String, Object>> items, Class<T> type) {
    List<T> records = new ArrayList<>(items.size());
    for (int i = 0; i < items.size(); i++) {
      T record;
      try {
        record = objectMapper.convertValue(items.get(i), type);
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException(
            "Item " + i + " cannot be read as " + type.getSimpleName() + ": " + e.getMessage(), e);
      }
      Set<ConstraintViolation<T>> violations = validator.validate(record);
      if (!violations.isEmpty()) {
        throw new IllegalArgumentException(
            "Item " + i + " is not a valid " + type.getSimpleName() + ": " + describe(violations));
      }
      records.add(record);
    }
    return records;
  }

  private static <T> String describe(Set<ConstraintViolation<T>> violations) {
    return violations.stream()
        .map(v -> v.getPropertyPath() + " " + v.getMessage())
        .sorted()
        .collect(Collectors.joining(", "));
  }
}
