package com.guildverify.backend.mail;

import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;

@Slf4j
public class SmtpMailer implements Mailer {

    private final JavaMailSender sender;
    private final String fromAddress;

    public SmtpMailer(JavaMailSender sender, String fromAddress) {
        this.sender = sender;
        this.fromAddress = fromAddress;
    }

    @Override
    public void send(String toAddress, String code, String displayName) {
        log.info("sending verification email for {}", displayName);
        try {
            sender.send(VerificationMessages.codeMessage(fromAddress, toAddress, code));
        } catch (MailException e) {
            throw new MailDispatchException("SMTP delivery failed for " + displayName, e);
        }
    }
}
