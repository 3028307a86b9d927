package com.openforge.identity.mail;

import com.openforge.identity.common.IdentityException;
import org.springframework.http.HttpStatus;

/** Outgoing mail could not be handed to the SMTP server. Never retried. */
public class MailException extends IdentityException {

    public static final String MAIL_UNAVAILABLE = "MAIL_UNAVAILABLE";
    public static final String MAIL_SEND_FAILED = "MAIL_SEND_FAILED";

    private final HttpStatus status;

    private MailException(String reason, String message, HttpStatus status, Throwable cause) {
        super(reason, message, cause);
        this.status = status;
    }

    public static MailException unavailable() {
        return new MailException(MAIL_UNAVAILABLE, "Email service is not configured",
                HttpStatus.SERVICE_UNAVAILABLE, null);
    }

    public static MailException sendFailed(Throwable cause) {
        return new MailException(MAIL_SEND_FAILED, "Failed to send email, please try again later",
                HttpStatus.INTERNAL_SERVER_ERROR, cause);
    }

    @Override
    public HttpStatus status() {
        return status;
    }
}
