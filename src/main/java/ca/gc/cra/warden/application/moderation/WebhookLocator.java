package ca.gc.cra.warden.application.moderation;

import ca.gc.cra.warden.application.port.GatewayException;
import ca.gc.cra.warden.application.port.MetricsPort;
import ca.gc.cra.warden.application.port.PlatformGatewayPort;
import ca.gc.cra.warden.validation.Numbers;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds a webhook by id and deletes it.
 *
 * <p>The channel that reported the webhook change is checked first. When the webhook is not there, the
 * community's text channels are scanned in gateway order, up to a fixed number of channels. Channels the agent
 * may not inspect are skipped. Every failure is logged and reported as {@code false}.</p>
 *
 * @since 0.1.0
 */
public final class WebhookLocator {
  private static final Logger log = LoggerFactory.getLogger(WebhookLocator.class);

  private final PlatformGatewayPort gateway;
  private final MetricsPort metrics;
  private final int searchChannelLimit;

  /**
   * Creates a locator.
   *
   * @param gateway platform gateway
   * @param metrics metrics sink; {@code null} disables metrics
   * @param searchChannelLimit maximum channels inspected by the fallback scan (0 disables the scan)
   */
  public WebhookLocator(PlatformGatewayPort gateway, MetricsPort metrics, int searchChannelLimit) {
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.searchChannelLimit = (int) Numbers.requireRange("searchChannelLimit", searchChannelLimit, 0, 10_000);
  }

  /**
   * Locates the webhook and deletes it.
   *
   * @param communityId community identifier
   * @param channelId channel whose webhooks changed
   * @param webhookId webhook to remove
   * @param reason audit reason
   * @return {@code true} when the webhook was found and deleted
   */
  public boolean locateAndDelete(long communityId, long channelId, long webhookId, String reason) {
    boolean found = channelHasWebhook(communityId, channelId, webhookId) || scan(communityId, channelId, webhookId);
    if (!found) {
      metrics.increment("webhook.notFound");
      log.info("Webhook {} not found in community {}", webhookId, communityId);
      return false;
    }
    try {
      gateway.deleteWebhook(communityId, webhookId, reason);
      metrics.increment("webhook.deleted");
      log.info("Deleted webhook {} in community {}: {}", webhookId, communityId, reason);
      return true;
    } catch (GatewayException ex) {
      metrics.increment("webhook.delete.failed");
      if (ex.isNotFound()) {
        log.info("Webhook {} already deleted in community {}", webhookId, communityId);
      } else if (ex.isPermissionDenied()) {
        log.warn("Missing permission to delete webhook {} in community {}", webhookId, communityId);
      } else {
        log.warn("Deleting webhook {} in community {} failed: {}", webhookId, communityId, ex.getMessage());
      }
      return false;
    }
  }

  private boolean scan(long communityId, long triggeringChannelId, long webhookId) {
    List<Long> channels = gateway.textChannels(communityId);
    int scanned = 0;
    for (Long candidate : channels) {
      if (candidate == null || candidate == triggeringChannelId) {
        continue;
      }
      if (scanned >= searchChannelLimit) {
        log.warn("Stopped webhook search in community {} after {} channels", communityId, scanned);
        return false;
      }
      scanned++;
      if (channelHasWebhook(communityId, candidate, webhookId)) {
        log.debug("Webhook {} found in channel {} after scanning {} channels", webhookId, candidate, scanned);
        return true;
      }
    }
    return false;
  }

  private boolean channelHasWebhook(long communityId, long channelId, long webhookId) {
    try {
      return gateway.listWebhooks(communityId, channelId).contains(webhookId);
    } catch (GatewayException ex) {
      if (ex.isPermissionDenied()) {
        log.debug("Skipping channel {}: webhooks not visible", channelId);
      } else if (!ex.isNotFound()) {
        log.warn("Listing webhooks of channel {} failed: {}", channelId, ex.getMessage());
      }
      return false;
    }
  }
}
