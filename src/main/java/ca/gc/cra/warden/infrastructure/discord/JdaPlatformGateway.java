package ca.gc.cra.warden.infrastructure.discord;

import ca.gc.cra.warden.application.port.AuditDirectoryPort;
import ca.gc.cra.warden.application.port.GatewayErrorKind;
import ca.gc.cra.warden.application.port.GatewayException;
import ca.gc.cra.warden.application.port.PlatformGatewayPort;
import ca.gc.cra.warden.domain.audit.AuditActionKind;
import ca.gc.cra.warden.domain.audit.AuditRecord;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.audit.AuditLogEntry;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.UserSnowflake;
import net.dv8tion.jda.api.entities.Webhook;
import net.dv8tion.jda.api.entities.channel.attribute.IWebhookContainer;
import net.dv8tion.jda.api.entities.channel.concrete.TextChannel;
import net.dv8tion.jda.api.entities.channel.middleman.GuildMessageChannel;

/**
 * <strong>What:</strong> JDA-backed implementation of the platform gateway and audit directory ports.
 * <p><strong>Why:</strong> Keeps every Discord REST call and its error translation in one adapter.</p>
 * <p><strong>Role:</strong> Infrastructure adapter created once the JDA session is ready.</p>
 * <p><strong>Thread-safety:</strong> Calls block with {@code complete()} and are made from event worker
 * threads, never from JDA callback threads. JDA handles rate limits internally.</p>
 * <p><strong>Observability:</strong> None of its own; callers log translated failures.</p>
 *
 * @implNote Membership checks read the member cache, which is fully populated by the connector's cache policy.
 * @since 0.1.0
 */
public final class JdaPlatformGateway implements PlatformGatewayPort, AuditDirectoryPort {
  private final JDA jda;

  /**
   * Creates the adapter.
   *
   * @param jda ready JDA session
   */
  public JdaPlatformGateway(JDA jda) {
    this.jda = Objects.requireNonNull(jda, "jda");
  }

  @Override
  public long selfAccountId() {
    return jda.getSelfUser().getIdLong();
  }

  @Override
  public boolean isMember(long communityId, long accountId) {
    Guild guild = jda.getGuildById(communityId);
    return guild != null && guild.getMemberById(accountId) != null;
  }

  @Override
  public void deleteMessage(long communityId, long channelId, long messageId) throws GatewayException {
    GuildMessageChannel channel = guild(communityId).getChannelById(GuildMessageChannel.class, channelId);
    if (channel == null) {
      throw new GatewayException(GatewayErrorKind.NOT_FOUND, "channel " + channelId + " not found");
    }
    try {
      channel.deleteMessageById(messageId).complete();
    } catch (RuntimeException ex) {
      throw JdaErrors.translate("delete message " + messageId, ex);
    }
  }

  @Override
  public void timeoutUntil(long communityId, long accountId, Instant until, String reason) throws GatewayException {
    Guild guild = guild(communityId);
    try {
      guild.timeoutUntil(UserSnowflake.fromId(accountId), until).reason(reason).complete();
    } catch (RuntimeException ex) {
      throw JdaErrors.translate("timeout " + accountId, ex);
    }
  }

  @Override
  public void kick(long communityId, long accountId, String reason) throws GatewayException {
    Guild guild = guild(communityId);
    try {
      guild.kick(UserSnowflake.fromId(accountId)).reason(reason).complete();
    } catch (RuntimeException ex) {
      throw JdaErrors.translate("kick " + accountId, ex);
    }
  }

  @Override
  public List<Long> listWebhooks(long communityId, long channelId) throws GatewayException {
    IWebhookContainer channel = guild(communityId).getChannelById(IWebhookContainer.class, channelId);
    if (channel == null) {
      throw new GatewayException(GatewayErrorKind.NOT_FOUND, "channel " + channelId + " has no webhooks");
    }
    try {
      List<Long> ids = new ArrayList<>();
      for (Webhook webhook : channel.retrieveWebhooks().complete()) {
        ids.add(webhook.getIdLong());
      }
      return ids;
    } catch (RuntimeException ex) {
      throw JdaErrors.translate("list webhooks of " + channelId, ex);
    }
  }

  @Override
  public List<Long> textChannels(long communityId) {
    Guild guild = jda.getGuildById(communityId);
    if (guild == null) {
      return List.of();
    }
    List<Long> ids = new ArrayList<>();
    for (TextChannel channel : guild.getTextChannels()) {
      ids.add(channel.getIdLong());
    }
    return ids;
  }

  @Override
  public void deleteWebhook(long communityId, long webhookId, String reason) throws GatewayException {
    try {
      Webhook webhook = jda.retrieveWebhookById(webhookId).complete();
      webhook.delete().reason(reason).complete();
    } catch (RuntimeException ex) {
      throw JdaErrors.translate("delete webhook " + webhookId, ex);
    }
  }

  @Override
  public List<AuditRecord> recent(long communityId, AuditActionKind kind, int limit) throws GatewayException {
    Guild guild = guild(communityId);
    List<AuditLogEntry> entries;
    try {
      entries = guild.retrieveAuditLogs().type(JdaErrors.actionType(kind)).limit(limit).complete();
    } catch (RuntimeException ex) {
      throw JdaErrors.translate("audit log " + kind, ex);
    }
    List<AuditRecord> records = new ArrayList<>(entries.size());
    for (AuditLogEntry entry : entries) {
      records.add(new AuditRecord(
          entry.getIdLong(),
          kind,
          snowflake(entry.getUserIdLong()),
          snowflake(entry.getTargetIdLong()),
          entry.getTimeCreated().toInstant()));
    }
    return records;
  }

  private Guild guild(long communityId) throws GatewayException {
    Guild guild = jda.getGuildById(communityId);
    if (guild == null) {
      throw new GatewayException(GatewayErrorKind.NOT_FOUND, "community " + communityId + " not available");
    }
    return guild;
  }

  private static OptionalLong snowflake(long id) {
    return id == 0L ? OptionalLong.empty() : OptionalLong.of(id);
  }
}
