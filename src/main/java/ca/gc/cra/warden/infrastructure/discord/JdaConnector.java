package ca.gc.cra.warden.infrastructure.discord;

import java.util.EnumSet;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import net.dv8tion.jda.api.exceptions.InvalidTokenException;
import net.dv8tion.jda.api.requests.GatewayIntent;
import net.dv8tion.jda.api.utils.ChunkingFilter;
import net.dv8tion.jda.api.utils.MemberCachePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens and closes the Discord gateway session.
 *
 * <p>The session subscribes to the intents the moderation flows need and caches every member, so membership
 * checks never hit the REST API. Other caches stay disabled. Raw events are enabled for webhook updates.</p>
 *
 * @since 0.1.0
 */
public final class JdaConnector implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(JdaConnector.class);
  static final EnumSet<GatewayIntent> INTENTS = EnumSet.of(
      GatewayIntent.GUILD_MESSAGES,
      GatewayIntent.MESSAGE_CONTENT,
      GatewayIntent.GUILD_MEMBERS,
      GatewayIntent.GUILD_MODERATION,
      GatewayIntent.GUILD_WEBHOOKS);

  private final JDA jda;

  private JdaConnector(JDA jda) {
    this.jda = jda;
  }

  /**
   * Logs in and waits until the member caches are ready.
   *
   * @param token bot token
   * @return connected session
   * @throws IllegalArgumentException if the token is malformed or rejected
   * @throws InterruptedException if interrupted while waiting for the session
   */
  public static JdaConnector connect(String token) throws InterruptedException {
    Objects.requireNonNull(token, "token");
    JDA jda;
    try {
      jda = JDABuilder.createLight(token, INTENTS)
          .setMemberCachePolicy(MemberCachePolicy.ALL)
          .setChunkingFilter(ChunkingFilter.ALL)
          .setRawEventsEnabled(true)
          .build();
    } catch (InvalidTokenException ex) {
      throw new IllegalArgumentException("Bot token was rejected by the gateway", ex);
    }
    jda.awaitReady();
    log.info("Connected as {} to {} communities", jda.getSelfUser().getName(), jda.getGuilds().size());
    return new JdaConnector(jda);
  }

  /**
   * Returns the port adapter for this session.
   *
   * @return gateway and audit directory adapter
   */
  public JdaPlatformGateway gateway() {
    return new JdaPlatformGateway(jda);
  }

  /**
   * Starts delivering events to the bridge.
   *
   * @param bridge event bridge
   */
  public void register(JdaEventBridge bridge) {
    jda.addEventListener(bridge);
  }

  @Override
  public void close() {
    jda.shutdown();
    try {
      if (!jda.awaitShutdown(10, TimeUnit.SECONDS)) {
        log.warn("Gateway session did not close within 10s; forcing shutdown");
        jda.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      jda.shutdownNow();
    }
  }
}
