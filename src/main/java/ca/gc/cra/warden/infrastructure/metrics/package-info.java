/**
 * Metrics adapters that bridge WARDEN ports to OpenTelemetry or no-op implementations.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe and support concurrent metric updates.</p>
 * <p><strong>Metrics:</strong> Publishes under {@code events.*}, {@code invite.*}, {@code audit.*},
 * {@code enforcement.*}, {@code webhook.*} and {@code sweep.*}.</p>
 * <p><strong>Security:</strong> Never exports message content; only counts and latencies.</p>
 */
package ca.gc.cra.warden.infrastructure.metrics;
