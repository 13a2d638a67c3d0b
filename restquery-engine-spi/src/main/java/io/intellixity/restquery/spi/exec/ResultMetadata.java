package io.intellixity.restquery.spi.exec;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.intellixity.restquery.query.IntermediateQuery;

/** Envelope metadata: producing adapter, originating IR, native query and mutation counts. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResultMetadata(String adapter,
                             IntermediateQuery query,
                             Object nativeQuery,
                             Long executionTime,
                             Long insertedCount,
                             Long modifiedCount,
                             Long deletedCount,
                             Long matchedCount) {
}
