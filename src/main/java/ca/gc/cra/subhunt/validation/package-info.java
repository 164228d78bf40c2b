/**
 * <strong>Purpose:</strong> Validation helpers used during CLI parsing and configuration bootstrap.
 * <p><strong>Pipeline role:</strong> Rejects invalid domains, URLs, paths and ranges before any network or
 * file resources are allocated.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via {@link IllegalArgumentException}.
 * <p><strong>Security:</strong> Enforces printable ASCII constraints to avoid control character injection into
 * HTTP headers.
 *
 * @since 0.1.0
 */
package ca.gc.cra.subhunt.validation;
