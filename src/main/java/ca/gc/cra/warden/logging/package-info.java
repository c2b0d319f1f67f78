/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and bound packet-derived text before emission.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 * <p><strong>Observability:</strong> Works with SLF4J/Logback; no metrics of its own.
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.logging;
