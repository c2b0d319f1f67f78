/**
 * <strong>Purpose:</strong> Command-line entry points for WARDEN: the {@code live} detection loop and the
 * {@code analyze} capture-file report.
 * <p><strong>Pipeline role:</strong> Parses {@code key=value} arguments, merges them over the YAML file and
 * defaults, then hands a validated {@code EngineConfig} to the composition root.
 * <p><strong>Concurrency:</strong> Commands run on the caller thread; the live engine owns its workers.
 * <p><strong>Observability:</strong> Telemetry keys resolve to {@code TelemetrySettings} before the metrics adapter starts; failures
 * print their structured kind, detail and suggestion.
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.api;
