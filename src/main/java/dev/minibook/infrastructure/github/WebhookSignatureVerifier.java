package dev.minibook.infrastructure.github;

import dev.minibook.config.GitHubProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * Checks {@code X-Hub-Signature-256} against the raw request body.
 * Without a configured secret every delivery is rejected.
 */
@Component
public class WebhookSignatureVerifier {

    private static final Logger log = LoggerFactory.getLogger(WebhookSignatureVerifier.class);
    private static final String PREFIX = "sha256=";
    private static final String ALGORITHM = "HmacSHA256";

    private final GitHubProperties properties;

    public WebhookSignatureVerifier(GitHubProperties properties) {
        this.properties = properties;
    }

    public boolean isValid(byte[] body, String signature) {
        if (signature == null || !signature.startsWith(PREFIX)) {
            return false;
        }
        String secret = properties.webhookSecret();
        if (secret == null || secret.isBlank()) {
            log.warn("GitHub webhook secret not configured; rejecting delivery");
            return false;
        }
        try {
            String expected = PREFIX + sign(secret, body);
            // constant-time
            return MessageDigest.isEqual(
                    expected.getBytes(StandardCharsets.UTF_8),
                    signature.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            log.error("HMAC computation failed", e);
            return false;
        }
    }

    static String sign(String secret, byte[] body) throws GeneralSecurityException {
        Mac mac = Mac.getInstance(ALGORITHM);
        mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
        return HexFormat.of().formatHex(mac.doFinal(body));
    }
}
