package com.guildverify.backend.bot.config;

import com.guildverify.backend.bot.discord.DiscordChatPlatform;
import com.guildverify.backend.bot.discord.DiscordCommandListener;
import com.guildverify.backend.bot.service.VerifyCommandService;
import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import net.dv8tion.jda.api.requests.GatewayIntent;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Gateway connection for the bot process. Login happens while the context
 * starts, so a bad token aborts start-up.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "app.discord", name = "enabled", havingValue = "true")
public class DiscordConfig {

    @Bean
    public DiscordCommandListener discordCommandListener(VerifyCommandService commands, DiscordProperties props) {
        return new DiscordCommandListener(commands, props);
    }

    @Bean(destroyMethod = "shutdown")
    public JDA jda(DiscordProperties props, DiscordCommandListener listener) throws InterruptedException {
        log.info("connecting to discord with prefix '{}'", props.getPrefix());
        JDA jda = JDABuilder.createDefault(props.getToken())
                .enableIntents(GatewayIntent.MESSAGE_CONTENT)
                .addEventListeners(listener)
                .build();
        jda.awaitReady();
        return jda;
    }

    @Bean
    public DiscordChatPlatform discordChatPlatform(JDA jda) {
        return new DiscordChatPlatform(jda);
    }
}
