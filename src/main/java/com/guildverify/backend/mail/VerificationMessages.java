package com.guildverify.backend.mail;

import org.springframework.mail.SimpleMailMessage;

final class VerificationMessages {

    static final String SUBJECT = "Email Verification Code";

    private VerificationMessages() {}

    static SimpleMailMessage codeMessage(String from, String to, String code) {
        var msg = new SimpleMailMessage();
        msg.setFrom(from);
        msg.setTo(to);
        msg.setSubject(SUBJECT);
        msg.setText("Your verification code is " + code + ".");
        return msg;
    }
}
