/**
 * <strong>Purpose:</strong> Moderation decision engine: invite-spam detection, audit attribution, escalation and
 * enforcement.
 * <p><strong>Concurrency:</strong> Per-key state lives in concurrent maps updated atomically; there is no global
 * lock.</p>
 * <p><strong>Observability:</strong> Services log decisions through SLF4J and count outcomes through
 * {@link ca.gc.cra.warden.application.port.MetricsPort}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.application.moderation;
