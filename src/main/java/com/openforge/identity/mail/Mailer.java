package com.openforge.identity.mail;

/**
 * Outgoing mail seam. One synchronous attempt per call.
 */
public interface Mailer {

    /** False when no SMTP transport is configured or mail is switched off. */
    boolean isConfigured();

    /**
     * Sends a multipart/alternative message.
     *
     * @param text plain-text fallback, may be null
     * @throws MailException MAIL_UNAVAILABLE when not configured, MAIL_SEND_FAILED otherwise
     */
    void send(String to, String subject, String html, String text);
}
