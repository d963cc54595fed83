/**
 * <strong>Purpose:</strong> Configuration loading (defaults, YAML, CLI) and composition of the moderation graph.
 * <p><strong>Concurrency:</strong> Loaders and records are immutable; the runtime owns the executors.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.config;
