package com.guildverify.backend.bot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.discord")
public class DiscordProperties {

    /** Connect to Discord. Only the bot process turns this on. */
    private boolean enabled = false;

    private String token;

    /** Command prefix, e.g. {@code !verify}. */
    private String prefix = "!";

    /** Base URL of the web front-end that links are built from. */
    private String url = "http://localhost:8080";

    /** Exact name of the role granted to verified members. */
    private String roleName = "Verified";

    /** The verify command is only answered in channels whose name contains this. */
    private String channelKeyword = "verification";
}
