package com.guildverify.backend.bot;

import com.guildverify.backend.bot.platform.ChatPlatform;
import com.guildverify.backend.bot.service.VerifiedRoleCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Builds the role cache once the gateway is up. A role that exists in no guild
 * at all is a configuration error and stops the process.
 */
@Slf4j
@RequiredArgsConstructor
@Component
@ConditionalOnProperty(prefix = "app.discord", name = "enabled", havingValue = "true")
public class BotStartupRunner implements ApplicationRunner {

    private final ChatPlatform platform;
    private final VerifiedRoleCache roleCache;

    @Override
    public void run(ApplicationArguments args) {
        int guildsWithRole = roleCache.rebuild(platform.guilds());
        if (guildsWithRole == 0) {
            throw new IllegalStateException("role '" + roleCache.roleName() + "' was not found in any guild");
        }
        log.info("bot is ready, role found in {} guild(s)", guildsWithRole);
    }
}
