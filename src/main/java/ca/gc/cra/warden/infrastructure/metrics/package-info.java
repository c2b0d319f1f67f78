/**
 * Metrics adapters bridging {@link ca.gc.cra.warden.application.port.MetricsPort} to OpenTelemetry.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe.</p>
 * <p><strong>Metrics:</strong> Publishes under {@code warden.live.*}, {@code warden.detect.*},
 * {@code warden.dedup.*} and {@code warden.capture.*}.</p>
 * <p><strong>Security:</strong> Never exports payload contents; only metric keys are attached.</p>
 */
package ca.gc.cra.warden.infrastructure.metrics;
