package com.guildverify.backend.bot.worker;

public record RoleSyncReport(int granted, int skipped, int failed, int expired) {
}
