package com.guildverify.backend.mail;

public class MailDispatchException extends RuntimeException {

    public MailDispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
