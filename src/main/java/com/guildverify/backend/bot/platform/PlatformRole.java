package com.guildverify.backend.bot.platform;

public record PlatformRole(long id, String name) {
}
