package com.guildverify.backend.bot.discord;

import com.guildverify.backend.bot.config.DiscordProperties;
import com.guildverify.backend.bot.service.VerifyCommand;
import com.guildverify.backend.bot.service.VerifyCommandService;
import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.EmbedBuilder;
import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.MessageEmbed;
import net.dv8tion.jda.api.entities.User;
import net.dv8tion.jda.api.events.message.MessageReceivedEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;

import java.util.List;
import java.util.Optional;

/**
 * Turns prefixed chat messages into {@code verify} and {@code reset_session} calls.
 */
@Slf4j
public class DiscordCommandListener extends ListenerAdapter {

    static final String VERIFY = "verify";
    static final String RESET_SESSION = "reset_session";

    private final VerifyCommandService commands;
    private final DiscordProperties props;

    public DiscordCommandListener(VerifyCommandService commands, DiscordProperties props) {
        this.commands = commands;
        this.props = props;
    }

    @Override
    public void onMessageReceived(MessageReceivedEvent event) {
        if (event.getAuthor().isBot()) return;

        String content = event.getMessage().getContentRaw().trim();
        if (!content.startsWith(props.getPrefix())) return;

        String command = content.substring(props.getPrefix().length()).trim().split("\\s+", 2)[0];
        try {
            switch (command) {
                case VERIFY -> onVerify(event);
                case RESET_SESSION -> onResetSession(event);
                default -> { }
            }
        } catch (RuntimeException e) {
            log.warn("command '{}' from userId={} failed", command, event.getAuthor().getIdLong(), e);
        }
    }

    private void onVerify(MessageReceivedEvent event) {
        User author = event.getAuthor();
        boolean fromGuild = event.isFromGuild();
        VerifyCommand cmd = new VerifyCommand(
                author.getIdLong(),
                fromGuild ? event.getGuild().getIdLong() : 0L,
                author.getName(),
                event.getChannel().getName(),
                fromGuild
        );

        Optional<String> link = commands.startVerification(cmd);
        link.ifPresent(url -> author.openPrivateChannel()
                .flatMap(dm -> dm.sendMessageEmbeds(verificationEmbed(url)))
                .queue(
                        sent -> log.debug("sent verification link to userId={}", author.getIdLong()),
                        err -> event.getMessage()
                                .reply("Unable to send DM. Are you sure you have DMs enabled on this server?")
                                .queue()
                ));
    }

    private void onResetSession(MessageReceivedEvent event) {
        if (!event.isFromGuild()) return;

        Member sender = event.getMember();
        if (sender == null || !sender.hasPermission(Permission.MANAGE_ROLES)) {
            log.info("reset_session refused for userId={}: missing Manage Roles", event.getAuthor().getIdLong());
            return;
        }
        List<Member> targets = event.getMessage().getMentions().getMembers();
        if (targets.isEmpty()) {
            event.getMessage().reply("Usage: " + props.getPrefix() + RESET_SESSION + " @member").queue();
            return;
        }
        for (Member target : targets) {
            commands.resetSession(target.getIdLong(), sender.getUser().getName());
            event.getMessage().reply("Removed session for " + target.getEffectiveName()).queue();
        }
    }

    static MessageEmbed verificationEmbed(String url) {
        return new EmbedBuilder()
                .setTitle("Verification!", url)
                .setDescription("Please use this page to enter your email for verification. "
                        + "Your email will not be shared with Discord.")
                .setColor(0xffc0cb)
                .addField("Verification Link", url, true)
                .build();
    }
}
