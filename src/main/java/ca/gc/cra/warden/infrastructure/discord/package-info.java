/**
 * Discord adapter built on JDA: gateway session, event translation and REST-backed ports.
 * <p><strong>Concurrency:</strong> The event bridge runs on JDA's event thread and only enqueues work; port
 * calls block on event worker threads.</p>
 */
package ca.gc.cra.warden.infrastructure.discord;
