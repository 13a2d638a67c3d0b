package io.intellixity.restquery.spi.exec;

import java.util.List;
import java.util.Map;

public record ValidationResult(List<ValidationError> errors) {
  public ValidationResult {
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  public static ValidationResult ok() {
    return new ValidationResult(List.of());
  }

  public boolean valid() {
    return errors.isEmpty();
  }

  public List<Map<String, Object>> errorMaps() {
    return errors.stream().map(ValidationError::toMap).toList();
  }
}
