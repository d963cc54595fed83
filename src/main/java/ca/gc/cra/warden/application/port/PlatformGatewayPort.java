package ca.gc.cra.warden.application.port;

import java.time.Instant;
import java.util.List;

/**
 * <strong>What:</strong> Port for the platform mutations and lookups moderation flows perform.
 * <p><strong>Why:</strong> Keeps enforcement policy independent from the chat platform SDK.</p>
 * <p><strong>Role:</strong> Domain port implemented by the Discord adapter and by in-memory fakes in tests.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent calls from event workers.</p>
 * <p><strong>Error handling:</strong> Every call may block on the network and fails with a
 * {@link GatewayException} whose {@link GatewayErrorKind} drives the caller's fallback decision.</p>
 *
 * @since 0.1.0
 */
public interface PlatformGatewayPort {

  /**
   * Returns the account the agent itself runs as.
   *
   * @return own account identifier
   */
  long selfAccountId();

  /**
   * Checks whether the account is currently a member of the community.
   *
   * @param communityId community identifier
   * @param accountId account identifier
   * @return {@code true} when the account is a current member
   */
  boolean isMember(long communityId, long accountId);

  /**
   * Deletes a message.
   *
   * @param communityId community identifier
   * @param channelId channel holding the message
   * @param messageId message identifier
   * @throws GatewayException when the deletion fails
   */
  void deleteMessage(long communityId, long channelId, long messageId) throws GatewayException;

  /**
   * Restricts a member from communicating until the given instant.
   *
   * @param communityId community identifier
   * @param accountId member to restrict
   * @param until end of the timeout
   * @param reason audit reason attached to the action
   * @throws GatewayException when the timeout fails
   */
  void timeoutUntil(long communityId, long accountId, Instant until, String reason) throws GatewayException;

  /**
   * Removes a member from the community.
   *
   * @param communityId community identifier
   * @param accountId member to remove
   * @param reason audit reason attached to the action
   * @throws GatewayException when the kick fails
   */
  void kick(long communityId, long accountId, String reason) throws GatewayException;

  /**
   * Lists the webhook identifiers configured on a channel.
   *
   * @param communityId community identifier
   * @param channelId channel identifier
   * @return webhook identifiers; empty when none
   * @throws GatewayException when the listing fails
   */
  List<Long> listWebhooks(long communityId, long channelId) throws GatewayException;

  /**
   * Lists the text channels of a community in display order.
   *
   * @param communityId community identifier
   * @return text channel identifiers
   */
  List<Long> textChannels(long communityId);

  /**
   * Deletes a webhook.
   *
   * @param communityId community identifier
   * @param webhookId webhook identifier
   * @param reason audit reason attached to the action
   * @throws GatewayException when the deletion fails
   */
  void deleteWebhook(long communityId, long webhookId, String reason) throws GatewayException;
}
