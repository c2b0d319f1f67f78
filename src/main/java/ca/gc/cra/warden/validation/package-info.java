/**
 * <strong>Purpose:</strong> Validation helpers used during CLI parsing and configuration bootstrap.
 * <p><strong>Pipeline role:</strong> Domain support for capture, detection and batch analysis; rejects invalid
 * inputs before adapters open interfaces, files or model stores.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via
 * {@link IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.validation;
