/**
 * <strong>Purpose:</strong> Ports between the moderation engine and the platform, audit log, clock and metrics.
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe; event workers call them
 * concurrently.</p>
 * <p><strong>Error handling:</strong> Platform failures surface as checked
 * {@link ca.gc.cra.warden.application.port.GatewayException}s.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.application.port;
