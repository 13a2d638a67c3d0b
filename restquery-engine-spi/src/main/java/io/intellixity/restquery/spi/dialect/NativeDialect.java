package io.intellixity.restquery.spi.dialect;

import io.intellixity.restquery.query.IntermediateQuery;

/** Lowers an {@link IntermediateQuery} into a backend's native query form. Implementations are stateless. */
public interface NativeDialect<N> {
  String id();

  N render(IntermediateQuery query);
}
