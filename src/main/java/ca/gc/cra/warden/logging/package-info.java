/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and sanitize content before emission.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 * <p><strong>Security:</strong> Redaction helpers keep bot tokens out of logs.
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.logging;
