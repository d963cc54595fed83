package ca.gc.cra.warden.domain.events;

import java.util.Objects;

/**
 * <strong>What:</strong> Inbound platform events the moderation engine reacts to.
 * <p><strong>Why:</strong> Decouples routing policy from the platform SDK; the Discord adapter translates gateway
 * payloads into these records.</p>
 * <p><strong>Thread-safety:</strong> All implementations are immutable records.</p>
 *
 * @since 0.1.0
 */
public interface PlatformEvent {

  /**
   * Returns the community the event belongs to.
   *
   * @return community identifier
   */
  long communityId();

  /**
   * Returns a short, stable name used for metric keys and logs.
   *
   * @return event name such as {@code message} or {@code member.joined}
   */
  String name();

  /**
   * A message was posted in a community channel.
   *
   * @param communityId community identifier
   * @param channelId channel the message was posted in
   * @param messageId message identifier
   * @param authorId author account
   * @param authorBot {@code true} when the author is a bot or webhook
   * @param content raw message content; never {@code null}
   */
  record MessageReceived(
      long communityId, long channelId, long messageId, long authorId, boolean authorBot, String content)
      implements PlatformEvent {
    public MessageReceived {
      content = Objects.requireNonNullElse(content, "");
    }

    @Override
    public String name() {
      return "message";
    }
  }

  /**
   * An account joined the community.
   *
   * @param communityId community identifier
   * @param accountId joining account
   * @param bot {@code true} when the account is a bot
   */
  record MemberJoined(long communityId, long accountId, boolean bot) implements PlatformEvent {
    @Override
    public String name() {
      return "member.joined";
    }
  }

  /**
   * An account left the community, voluntarily or by being kicked.
   *
   * @param communityId community identifier
   * @param accountId departed account
   */
  record MemberRemoved(long communityId, long accountId) implements PlatformEvent {
    @Override
    public String name() {
      return "member.removed";
    }
  }

  /**
   * An account was banned.
   *
   * @param communityId community identifier
   * @param accountId banned account
   */
  record MemberBanned(long communityId, long accountId) implements PlatformEvent {
    @Override
    public String name() {
      return "member.banned";
    }
  }

  /**
   * A channel was deleted.
   *
   * @param communityId community identifier
   * @param channelId deleted channel
   */
  record ChannelDeleted(long communityId, long channelId) implements PlatformEvent {
    @Override
    public String name() {
      return "channel.deleted";
    }
  }

  /**
   * A role was deleted.
   *
   * @param communityId community identifier
   * @param roleId deleted role
   */
  record RoleDeleted(long communityId, long roleId) implements PlatformEvent {
    @Override
    public String name() {
      return "role.deleted";
    }
  }

  /**
   * The webhook set of a channel changed.
   *
   * @param communityId community identifier
   * @param channelId channel whose webhooks changed
   */
  record WebhooksUpdated(long communityId, long channelId) implements PlatformEvent {
    @Override
    public String name() {
      return "webhooks.updated";
    }
  }
}
