package com.guildverify.backend.mail;

import lombok.extern.slf4j.Slf4j;

/**
 * Development mailer. Nothing leaves the process; the message is written to the log.
 */
@Slf4j
public class LoggingMailer implements Mailer {

    static final String FAKE_FROM = "test@example.com";

    @Override
    public void send(String toAddress, String code, String displayName) {
        var msg = VerificationMessages.codeMessage(FAKE_FROM, toAddress, code);
        log.info("sending fake email for {}: {}", displayName, msg);
    }
}
