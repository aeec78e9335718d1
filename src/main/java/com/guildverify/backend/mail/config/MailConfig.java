package com.guildverify.backend.mail.config;

import com.guildverify.backend.mail.LoggingMailer;
import com.guildverify.backend.mail.Mailer;
import com.guildverify.backend.mail.SmtpMailer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.mail.MailProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;
import org.springframework.util.StringUtils;

/**
 * Picks the mailer once at start-up: SMTP when {@code spring.mail.host} is set,
 * the logging stub otherwise.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({MailProperties.class, MailSenderProperties.class})
public class MailConfig {

    @Bean
    public JavaMailSender javaMailSender(MailProperties p) {
        var s = new JavaMailSenderImpl();
        s.setHost(p.getHost());
        if (p.getPort() != null) s.setPort(p.getPort());
        s.setUsername(p.getUsername());
        s.setPassword(p.getPassword());
        if (p.getDefaultEncoding() != null) s.setDefaultEncoding(p.getDefaultEncoding().name());
        s.getJavaMailProperties().putAll(p.getProperties());
        return s;
    }

    @Bean
    public Mailer mailer(MailProperties mail, MailSenderProperties props, JavaMailSender sender) {
        Mailer mailer = StringUtils.hasText(mail.getHost())
                ? new SmtpMailer(sender, props.getFrom())
                : new LoggingMailer();
        log.info("using {} for mail", mailer.getClass().getSimpleName());
        return mailer;
    }
}
