package ca.gc.cra.warden.infrastructure.discord;

import ca.gc.cra.warden.application.port.PlatformEventListener;
import ca.gc.cra.warden.domain.events.PlatformEvent;
import java.util.Objects;
import java.util.Optional;
import net.dv8tion.jda.api.events.RawGatewayEvent;
import net.dv8tion.jda.api.events.channel.ChannelDeleteEvent;
import net.dv8tion.jda.api.events.guild.GuildBanEvent;
import net.dv8tion.jda.api.events.guild.member.GuildMemberJoinEvent;
import net.dv8tion.jda.api.events.guild.member.GuildMemberRemoveEvent;
import net.dv8tion.jda.api.events.message.MessageReceivedEvent;
import net.dv8tion.jda.api.events.role.RoleDeleteEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import net.dv8tion.jda.api.utils.data.DataObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JDA listener translating gateway events into {@link PlatformEvent}s.
 *
 * <p>Runs on JDA's event thread, so it only copies ids and hands the event to the listener, which schedules the
 * actual work elsewhere. Direct messages are ignored. Webhook changes are read from raw {@code WEBHOOKS_UPDATE}
 * dispatches because JDA has no typed event for them.</p>
 *
 * @since 0.1.0
 */
public final class JdaEventBridge extends ListenerAdapter {
  private static final Logger log = LoggerFactory.getLogger(JdaEventBridge.class);
  static final String WEBHOOKS_UPDATE = "WEBHOOKS_UPDATE";

  private final PlatformEventListener listener;

  public JdaEventBridge(PlatformEventListener listener) {
    this.listener = Objects.requireNonNull(listener, "listener");
  }

  @Override
  public void onMessageReceived(MessageReceivedEvent event) {
    if (!event.isFromGuild()) {
      return;
    }
    boolean bot = event.getAuthor().isBot() || event.isWebhookMessage();
    listener.onEvent(new PlatformEvent.MessageReceived(
        event.getGuild().getIdLong(),
        event.getChannel().getIdLong(),
        event.getMessageIdLong(),
        event.getAuthor().getIdLong(),
        bot,
        event.getMessage().getContentRaw()));
  }

  @Override
  public void onGuildMemberJoin(GuildMemberJoinEvent event) {
    listener.onEvent(new PlatformEvent.MemberJoined(
        event.getGuild().getIdLong(), event.getUser().getIdLong(), event.getUser().isBot()));
  }

  @Override
  public void onGuildMemberRemove(GuildMemberRemoveEvent event) {
    listener.onEvent(new PlatformEvent.MemberRemoved(event.getGuild().getIdLong(), event.getUser().getIdLong()));
  }

  @Override
  public void onGuildBan(GuildBanEvent event) {
    listener.onEvent(new PlatformEvent.MemberBanned(event.getGuild().getIdLong(), event.getUser().getIdLong()));
  }

  @Override
  public void onChannelDelete(ChannelDeleteEvent event) {
    if (!event.isFromGuild()) {
      return;
    }
    listener.onEvent(new PlatformEvent.ChannelDeleted(event.getGuild().getIdLong(), event.getChannel().getIdLong()));
  }

  @Override
  public void onRoleDelete(RoleDeleteEvent event) {
    listener.onEvent(new PlatformEvent.RoleDeleted(event.getGuild().getIdLong(), event.getRole().getIdLong()));
  }

  @Override
  public void onRawGateway(RawGatewayEvent event) {
    if (!WEBHOOKS_UPDATE.equals(event.getType())) {
      return;
    }
    webhooksUpdated(event.getPayload()).ifPresent(listener::onEvent);
  }

  static Optional<PlatformEvent> webhooksUpdated(DataObject payload) {
    if (payload == null || !payload.hasKey("guild_id") || !payload.hasKey("channel_id")) {
      log.debug("Ignoring {} dispatch without guild or channel", WEBHOOKS_UPDATE);
      return Optional.empty();
    }
    try {
      return Optional.of(new PlatformEvent.WebhooksUpdated(
          payload.getUnsignedLong("guild_id"), payload.getUnsignedLong("channel_id")));
    } catch (RuntimeException ex) {
      log.warn("Malformed {} dispatch: {}", WEBHOOKS_UPDATE, ex.getMessage());
      return Optional.empty();
    }
  }
}
