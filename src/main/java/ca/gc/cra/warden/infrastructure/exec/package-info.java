/**
 * Executor factories for event workers and housekeeping.
 * <p><strong>Concurrency:</strong> Event pools are bounded and reject instead of blocking the gateway thread.</p>
 */
package ca.gc.cra.warden.infrastructure.exec;
