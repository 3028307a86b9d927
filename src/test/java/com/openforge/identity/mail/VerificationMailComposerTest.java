package com.openforge.identity.mail;

import com.openforge.identity.domain.VerificationPurpose;
import com.openforge.identity.mail.VerificationMailComposer.ComposedMail;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class VerificationMailComposerTest {

    private final VerificationMailComposer composer =
            new VerificationMailComposer(new MailSenderProperties(true, "a@b.c", "Acme"));

    @Test
    void register_mail_carries_code_and_validity() {
        ComposedMail mail = composer.compose(VerificationPurpose.REGISTER, "042917", 5);

        assertThat(mail.subject()).isEqualTo("[Acme] Registration code");
        assertThat(mail.html()).contains("042917").contains("<strong>5 minutes</strong>").contains("width:100%;");
        assertThat(mail.text()).contains("Verification code: 042917").contains("valid for 5 minutes");
    }

    @Test
    void reset_mail_has_its_own_subject() {
        ComposedMail mail = composer.compose(VerificationPurpose.RESET_PASSWORD, "111111", 5);

        assertThat(mail.subject()).isEqualTo("[Acme] Password reset code");
        assertThat(mail.html()).contains("Reset your password");
    }
}
