package com.routergen.core.schema;

/**
 * Semantic (application-level) predicate for one variant.
 *
 * Runs only after structural validation succeeded, so the call is fully bound.
 * Returns null when the call is consistent with the user query, otherwise a
 * human-readable violation.
 */
@FunctionalInterface
public interface DomainRule {

    String check(ToolCall call, String userQuery);
}
