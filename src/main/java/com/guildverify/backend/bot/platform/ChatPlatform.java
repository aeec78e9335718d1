package com.guildverify.backend.bot.platform;

import java.util.List;

/**
 * What the bot side needs from the chat platform. Every call may block on
 * network I/O and may fail with a runtime exception; callers isolate failures
 * per guild or per member.
 */
public interface ChatPlatform {

    /** {@code true} once the gateway session is established. */
    boolean isReady();

    /** Guilds the bot is in, with their roles. */
    List<PlatformGuild> guilds();

    void grantRole(long guildId, long userId, long roleId, String reason);
}
