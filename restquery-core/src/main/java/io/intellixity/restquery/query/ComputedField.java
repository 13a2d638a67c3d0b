package io.intellixity.restquery.query;

/** Output column computed by the backend from an expression in its own syntax. */
public record ComputedField(String alias, String expression) {}
