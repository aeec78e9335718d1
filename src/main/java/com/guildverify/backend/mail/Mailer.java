package com.guildverify.backend.mail;

/**
 * Sends a verification code to an email address.
 * <p>
 * Implementations block until the message is handed off and throw
 * {@link MailDispatchException} when that fails.
 */
public interface Mailer {

    void send(String toAddress, String code, String displayName);
}
