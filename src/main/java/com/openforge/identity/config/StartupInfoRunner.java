package com.openforge.identity.config;

import com.openforge.identity.crypto.SecretCipher;
import com.openforge.identity.mail.Mailer;
import com.openforge.identity.oauth.OAuthProviderClient;
import com.openforge.identity.settings.SystemSettingsProperties;
import com.openforge.identity.verification.VerificationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Prints a structured startup summary after the application context is fully ready.
 *
 * Checks performed:
 *   - Database: opens a real JDBC connection and reads the server version
 *   - Cipher: configured key or per-process ephemeral key
 *   - Mail: SMTP host and user, password masked
 *   - OAuth: which providers have credentials
 *   - System defaults: secrets masked
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final DataSource                dataSource;
    private final SecretCipher              cipher;
    private final Mailer                    mailer;
    private final List<OAuthProviderClient> oauthClients;
    private final SystemSettingsProperties  defaults;
    private final VerificationProperties    verification;
    private final Environment               env;

    @Override
    public void run(ApplicationArguments args) {
        String oauth = oauthClients.stream()
                .map(c -> c.name() + (c.isEnabled() ? " ✔" : " ✘"))
                .collect(Collectors.joining("  "));

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║            Identity Service  -  Startup Summary          ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Database                                                ║
                ║    {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Secrets                                                 ║
                ║    Cipher key     : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Mail                                                    ║
                ║    Configured     : {}
                ║    SMTP           : {}:{}  user={}  password={}
                ║    Codes          : ttl={}  cooldown={}  max-attempts={}
                ╠══════════════════════════════════════════════════════════╣
                ║  OAuth            : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  System defaults                                         ║
                ║    Google         : key={}  base={}
                ║    MinerU         : token={}  base={}
                ║    Caption model  : {}
                ║    Workers        : description={}  image={}
                ╚══════════════════════════════════════════════════════════╝
                """,
                env.getProperty("server.port", "8080"),
                System.getProperty("java.version"),

                checkDatabase(),

                cipher.isEphemeral() ? "✘ EPHEMERAL (stored secrets will not survive restart)" : "✔ configured",

                mailer.isConfigured() ? "✔ yes" : "✘ no",
                env.getProperty("spring.mail.host", "(none)"),
                env.getProperty("spring.mail.port", "-"),
                env.getProperty("spring.mail.username", "(none)"),
                maskKey(env.getProperty("spring.mail.password")),
                verification.ttl(), verification.cooldown(), verification.maxAttempts(),

                oauth.isEmpty() ? "(none)" : oauth,

                maskKey(defaults.googleApiKey()), defaults.googleApiBase(),
                maskKey(defaults.mineruToken()), defaults.mineruApiBase(),
                defaults.imageCaptionModel(),
                defaults.maxDescriptionWorkers(), defaults.maxImageWorkers()
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String checkDatabase() {
        try (Connection conn = dataSource.getConnection()) {
            String url     = conn.getMetaData().getURL();
            String version = conn.getMetaData().getDatabaseProductVersion();
            // Strip credentials from the JDBC URL for safe logging
            String safeUrl = url.replaceAll("password=[^&;]*", "password=***");
            return "✔ Connected  version=" + version + "  url=" + safeUrl;
        } catch (Exception e) {
            return "✘ FAILED: " + e.getMessage();
        }
    }

    /** First 4 + "..." + last 4, or "(not set)". */
    static String maskKey(String key) {
        if (key == null || key.isBlank()) return "(not set)";
        if (key.length() <= 10) return "***";
        return key.substring(0, 4) + "..." + key.substring(key.length() - 4);
    }
}
