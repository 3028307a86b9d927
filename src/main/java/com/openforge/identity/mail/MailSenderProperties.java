package com.openforge.identity.mail;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * app.mail.*: sender identity and a kill switch. SMTP host and credentials live
 * under the standard spring.mail.* keys.
 */
@ConfigurationProperties(prefix = "app.mail")
public record MailSenderProperties(
        @DefaultValue("true")                                  boolean enabled,
        @DefaultValue("Identity Service <no-reply@localhost>") String from,
        @DefaultValue("Identity Service")                      String productName
) {}
