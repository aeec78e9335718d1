package com.guildverify.backend.bot.service;

/**
 * A verify command as typed by a member.
 *
 * @param fromGuild {@code false} for direct messages, where {@code guildId} is meaningless
 */
public record VerifyCommand(long userId, long guildId, String displayName, String channelName, boolean fromGuild) {
}
