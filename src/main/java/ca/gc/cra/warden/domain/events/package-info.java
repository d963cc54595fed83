/**
 * Immutable platform events delivered to the moderation engine.
 */
package ca.gc.cra.warden.domain.events;
