package com.guildverify.backend.bot.platform;

import java.util.List;

public record PlatformGuild(long id, String name, List<PlatformRole> roles) {
}
