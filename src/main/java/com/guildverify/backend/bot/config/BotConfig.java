package com.guildverify.backend.bot.config;

import com.guildverify.backend.bot.service.VerifiedRoleCache;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({DiscordProperties.class, RoleSyncProperties.class})
public class BotConfig {

    @Bean
    public VerifiedRoleCache verifiedRoleCache(DiscordProperties props) {
        return new VerifiedRoleCache(props.getRoleName());
    }
}
