/**
 * CLI entry points that configure and start the WARDEN moderation agent.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging and telemetry,
 * and hands a validated configuration to the composition root.</p>
 * <p><strong>Security:</strong> The bot token is only read from the environment and never logged.</p>
 */
package ca.gc.cra.warden.api;
