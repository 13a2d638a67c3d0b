package io.intellixity.restquery.spi.exec;

import io.intellixity.restquery.query.IntermediateQuery;

/**
 * SPI hook to validate an IR before backend lowering.
 * <p>
 * Adapters call this from {@code validateQuery}; applications may plug in stricter rules.
 */
public interface QueryValidationStrategy {
  ValidationResult validate(IntermediateQuery query, BackendCapabilities capabilities);
}
