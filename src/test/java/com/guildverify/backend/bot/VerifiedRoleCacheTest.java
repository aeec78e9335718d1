package com.guildverify.backend.bot;

import com.guildverify.backend.bot.platform.PlatformGuild;
import com.guildverify.backend.bot.platform.PlatformRole;
import com.guildverify.backend.bot.service.VerifiedRoleCache;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class VerifiedRoleCacheTest {

    @Test
    void maps_each_guild_to_its_role_by_exact_name() {
        VerifiedRoleCache cache = new VerifiedRoleCache("Verified");

        int found = cache.rebuild(List.of(
                new PlatformGuild(1L, "a", List.of(new PlatformRole(10L, "Member"), new PlatformRole(11L, "Verified"))),
                new PlatformGuild(2L, "b", List.of(new PlatformRole(20L, "verified"))),
                new PlatformGuild(3L, "c", List.of())
        ));

        assertThat(found).isEqualTo(1);
        assertThat(cache.isLoaded()).isTrue();
        assertThat(cache.roleFor(1L)).contains(11L);
        assertThat(cache.roleFor(2L)).isEmpty();
        assertThat(cache.roleFor(3L)).isEmpty();
    }

    @Test
    void not_loaded_until_first_rebuild() {
        VerifiedRoleCache cache = new VerifiedRoleCache("Verified");

        assertThat(cache.isLoaded()).isFalse();
        assertThat(cache.roleFor(1L)).isEmpty();
    }

    @Test
    void rebuild_replaces_previous_contents() {
        VerifiedRoleCache cache = new VerifiedRoleCache("Verified");
        cache.rebuild(List.of(new PlatformGuild(1L, "a", List.of(new PlatformRole(11L, "Verified")))));

        cache.rebuild(List.of(new PlatformGuild(2L, "b", List.of(new PlatformRole(22L, "Verified")))));

        assertThat(cache.roleFor(1L)).isEmpty();
        assertThat(cache.roleFor(2L)).contains(22L);
    }
}
