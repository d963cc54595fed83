package ca.gc.cra.warden.application.port;

import ca.gc.cra.warden.domain.events.PlatformEvent;

/**
 * Receives platform events from the gateway adapter.
 *
 * <p>Implementations must return quickly: the caller is the platform's event dispatch thread.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface PlatformEventListener {

  /**
   * Accepts an inbound event.
   *
   * @param event event to process; never {@code null}
   */
  void onEvent(PlatformEvent event);
}
