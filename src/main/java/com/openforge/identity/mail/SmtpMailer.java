package com.openforge.identity.mail;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * {@link Mailer} over Spring's {@link JavaMailSender}.
 *
 * The sender bean only exists when spring.mail.host is set, so it is looked up
 * lazily; without it every send fails with MAIL_UNAVAILABLE.
 */
@Slf4j
@Component
public class SmtpMailer implements Mailer {

    private final ObjectProvider<JavaMailSender> senderProvider;
    private final MailSenderProperties           props;

    public SmtpMailer(ObjectProvider<JavaMailSender> senderProvider, MailSenderProperties props) {
        this.senderProvider = senderProvider;
        this.props          = props;
    }

    @Override
    public boolean isConfigured() {
        return props.enabled() && senderProvider.getIfAvailable() != null;
    }

    @Override
    public void send(String to, String subject, String html, String text) {
        JavaMailSender sender = props.enabled() ? senderProvider.getIfAvailable() : null;
        if (sender == null) {
            log.warn("[Mail] Send skipped, no SMTP transport configured");
            throw MailException.unavailable();
        }

        try {
            MimeMessage message = sender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, true, StandardCharsets.UTF_8.name());
            helper.setFrom(props.from());
            helper.setTo(to);
            helper.setSubject(subject);
            if (text != null) {
                helper.setText(text, html);
            } else {
                helper.setText(html, true);
            }
            sender.send(message);
            log.info("[Mail] Sent \"{}\" to {}", subject, mask(to));
        } catch (MessagingException | org.springframework.mail.MailException e) {
            log.error("[Mail] Send to {} failed: {}", mask(to), e.getMessage());
            throw MailException.sendFailed(e);
        }
    }

    /** a***@example.com */
    static String mask(String email) {
        if (email == null) return "(none)";
        int at = email.indexOf('@');
        if (at <= 1) return "***" + (at >= 0 ? email.substring(at) : "");
        return email.charAt(0) + "***" + email.substring(at);
    }
}
