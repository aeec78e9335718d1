package com.guildverify.backend.bot.service;

import com.guildverify.backend.bot.platform.PlatformGuild;
import com.guildverify.backend.bot.platform.PlatformRole;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Guild id to verified-role id, matched by exact role name. Built once when the
 * platform becomes ready; guilds without the role are skipped on every sweep.
 */
@Slf4j
public class VerifiedRoleCache {

    private final String roleName;
    private volatile Map<Long, Long> roleByGuild = Map.of();
    private volatile boolean loaded;

    public VerifiedRoleCache(String roleName) {
        this.roleName = roleName;
    }

    /** @return number of guilds that have the role */
    public int rebuild(List<PlatformGuild> guilds) {
        log.info("assembling role cache for '{}'", roleName);
        Map<Long, Long> next = new HashMap<>();
        for (PlatformGuild guild : guilds) {
            Optional<PlatformRole> role = guild.roles().stream()
                    .filter(r -> roleName.equals(r.name()))
                    .findFirst();
            if (role.isPresent()) {
                next.put(guild.id(), role.get().id());
            } else {
                log.warn("{} role not found in guild {} ({})", roleName, guild.name(), guild.id());
            }
        }
        roleByGuild = Map.copyOf(next);
        loaded = true;
        return next.size();
    }

    public Optional<Long> roleFor(long guildId) {
        return Optional.ofNullable(roleByGuild.get(guildId));
    }

    public boolean isLoaded() {
        return loaded;
    }

    public String roleName() {
        return roleName;
    }
}
