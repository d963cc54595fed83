package ca.gc.cra.warden.application.moderation;

import java.util.regex.Pattern;

/**
 * Recognises community invite links in raw message content.
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class InviteLinkMatcher {
  private static final Pattern INVITE_PATTERN = Pattern.compile(
      "(?:https?://)?(?:www\\.)?(?:discord\\.gg|discord\\.com/invite)/[A-Za-z0-9\\-]+",
      Pattern.CASE_INSENSITIVE);

  private InviteLinkMatcher() {}

  /**
   * Checks whether the content contains at least one invite link.
   *
   * @param content raw message content; {@code null} never matches
   * @return {@code true} when an invite link is present
   */
  public static boolean containsInvite(String content) {
    if (content == null || content.isBlank()) {
      return false;
    }
    return INVITE_PATTERN.matcher(content).find();
  }
}
