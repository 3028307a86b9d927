package com.openforge.identity.mail;

import com.openforge.identity.domain.VerificationPurpose;
import org.springframework.stereotype.Component;

/**
 * Renders the verification-code email for each purpose.
 */
@Component
public class VerificationMailComposer {

    public record ComposedMail(String subject, String html, String text) {}

    private final MailSenderProperties props;

    public VerificationMailComposer(MailSenderProperties props) {
        this.props = props;
    }

    public ComposedMail compose(VerificationPurpose purpose, String code, long expiresMinutes) {
        String product = props.productName();
        String subject;
        String title;
        String description;
        switch (purpose) {
            case REGISTER -> {
                subject     = "[%s] Registration code".formatted(product);
                title       = "Welcome to " + product;
                description = "You are creating a %s account. Use this code to finish signing up:".formatted(product);
            }
            case RESET_PASSWORD -> {
                subject     = "[%s] Password reset code".formatted(product);
                title       = "Reset your password";
                description = "You asked to reset your %s password. Use this code:".formatted(product);
            }
            default -> throw new IllegalArgumentException("Unhandled purpose " + purpose);
        }

        String text = """
                %s

                Verification code: %s

                The code is valid for %d minutes. Do not share it with anyone.

                If this wasn't you, ignore this email.
                """.formatted(description, code, expiresMinutes);

        return new ComposedMail(subject, html(title, description, code, expiresMinutes, product), text);
    }

    private static String html(String title, String description, String code, long minutes, String product) {
        return """
                <!DOCTYPE html>
                <html lang="en">
                <head><meta charset="UTF-8"><title>%s</title></head>
                <body style="margin:0;padding:0;background:#f8f9fa;font-family:-apple-system,'Segoe UI',Roboto,Arial,sans-serif;">
                  <table role="presentation" style="width:100%%;border-collapse:collapse;">
                    <tr><td align="center" style="padding:40px 20px;">
                      <table role="presentation" style="width:100%%;max-width:480px;background:#ffffff;border-radius:16px;padding:40px 32px;">
                        <tr><td>
                          <h1 style="margin:0 0 16px;font-size:24px;color:#111827;text-align:center;">%s</h1>
                          <p style="margin:0 0 24px;font-size:15px;color:#6b7280;text-align:center;">%s</p>
                          <div style="background:#FEF3C7;border-radius:12px;padding:24px;text-align:center;margin-bottom:24px;">
                            <span style="font-size:36px;font-weight:700;letter-spacing:8px;color:#92400E;font-family:'Courier New',monospace;">%s</span>
                          </div>
                          <p style="margin:0 0 24px;font-size:13px;color:#6B7280;text-align:center;">
                            The code is valid for <strong>%d minutes</strong>. Do not share it with anyone.
                          </p>
                          <p style="margin:0;font-size:13px;color:#9CA3AF;text-align:center;">
                            If this wasn't you, ignore this email. Your account is safe.
                          </p>
                        </td></tr>
                      </table>
                      <p style="padding-top:24px;font-size:12px;color:#9CA3AF;">Sent automatically by %s. Please do not reply.</p>
                    </td></tr>
                  </table>
                </body>
                </html>
                """.formatted(title, title, description, code, minutes, product);
    }
}
