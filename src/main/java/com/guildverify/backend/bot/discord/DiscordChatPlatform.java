package com.guildverify.backend.bot.discord;

import com.guildverify.backend.bot.platform.ChatPlatform;
import com.guildverify.backend.bot.platform.PlatformGuild;
import com.guildverify.backend.bot.platform.PlatformRole;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.Role;

import java.util.List;

public class DiscordChatPlatform implements ChatPlatform {

    private final JDA jda;

    public DiscordChatPlatform(JDA jda) {
        this.jda = jda;
    }

    @Override
    public boolean isReady() {
        return jda.getStatus() == JDA.Status.CONNECTED;
    }

    @Override
    public List<PlatformGuild> guilds() {
        return jda.getGuilds().stream()
                .map(g -> new PlatformGuild(g.getIdLong(), g.getName(), g.getRoles().stream()
                        .map(r -> new PlatformRole(r.getIdLong(), r.getName()))
                        .toList()))
                .toList();
    }

    /** Blocks until Discord acknowledges; REST failures surface as {@code ErrorResponseException}. */
    @Override
    public void grantRole(long guildId, long userId, long roleId, String reason) {
        Guild guild = jda.getGuildById(guildId);
        if (guild == null) {
            throw new IllegalStateException("guild " + guildId + " is not available");
        }
        Role role = guild.getRoleById(roleId);
        if (role == null) {
            throw new IllegalStateException("role " + roleId + " no longer exists in guild " + guildId);
        }
        Member member = guild.retrieveMemberById(userId).complete();
        guild.addRoleToMember(member, role).reason(reason).complete();
    }
}
