package com.guildverify.backend.bot.service;

import com.guildverify.backend.bot.config.DiscordProperties;
import com.guildverify.backend.session.service.VerificationSessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class VerifyCommandService {

    private final VerificationSessionService sessions;
    private final DiscordProperties props;

    /**
     * Returns the personal start link, or empty when the command should be
     * ignored (direct message, or a channel that is not a verification channel).
     * Repeating the command hands back the same link.
     */
    public Optional<String> startVerification(VerifyCommand cmd) {
        if (!cmd.fromGuild()) {
            return Optional.empty();
        }
        String channel = cmd.channelName() == null ? "" : cmd.channelName().toLowerCase(Locale.ROOT);
        if (!channel.contains(props.getChannelKeyword().toLowerCase(Locale.ROOT))) {
            return Optional.empty();
        }
        String secondaryId = sessions.createOrGet(cmd.userId(), cmd.guildId(), cmd.displayName());
        return Optional.of(startLink(cmd.userId(), secondaryId));
    }

    /** Moderator reset; afterwards the member can run verify again and gets a new code. */
    public boolean resetSession(long userId, String requestedBy) {
        log.info("session reset for userId={} requested by {}", userId, requestedBy);
        return sessions.deleteSession(userId);
    }

    String startLink(long userId, String secondaryId) {
        String base = props.getUrl().endsWith("/")
                ? props.getUrl().substring(0, props.getUrl().length() - 1)
                : props.getUrl();
        return base + "/start/" + userId + "/" + secondaryId;
    }
}
