package com.williamcallahan.ratchet.web;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies Slack request signatures: {@code v0=} + hex HMAC-SHA256 of {@code v0:<timestamp>:<body>}
 * keyed by the app's signing secret, with the timestamp no more than five minutes from now.
 */
public class SlackRequestVerifier {
    private static final Logger log = LoggerFactory.getLogger(SlackRequestVerifier.class);

    static final Duration MAX_CLOCK_SKEW = Duration.ofMinutes(5);
    private static final String VERSION = "v0";
    private static final String HMAC_SHA256 = "HmacSHA256";

    private final byte[] signingSecret;
    private final Clock clock;

    /**
     * @param signingSecret app signing secret; blank disables verification
     * @param clock time source for the replay window
     */
    public SlackRequestVerifier(String signingSecret, Clock clock) {
        this.signingSecret = signingSecret == null || signingSecret.isBlank()
                ? null
                : signingSecret.trim().getBytes(StandardCharsets.UTF_8);
        this.clock = clock;
        if (this.signingSecret == null) {
            log.warn("[SLACK] No signing secret configured; event signatures are NOT verified");
        }
    }

    public boolean isEnabled() {
        return signingSecret != null;
    }

    /**
     * @throws InvalidSlackSignatureException when verification is enabled and the request does not verify
     */
    public void verify(String timestampHeader, String signatureHeader, String body) {
        if (signingSecret == null) {
            return;
        }
        if (timestampHeader == null || signatureHeader == null) {
            throw new InvalidSlackSignatureException("Missing Slack signature headers");
        }
        long epochSeconds;
        try {
            epochSeconds = Long.parseLong(timestampHeader.trim());
        } catch (NumberFormatException malformed) {
            throw new InvalidSlackSignatureException("Malformed Slack request timestamp");
        }
        Duration skew = Duration.between(Instant.ofEpochSecond(epochSeconds), clock.instant()).abs();
        if (skew.compareTo(MAX_CLOCK_SKEW) > 0) {
            throw new InvalidSlackSignatureException("Slack request timestamp outside the replay window");
        }
        String expected = sign(timestampHeader.trim(), body == null ? "" : body);
        if (!MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), signatureHeader.trim().getBytes(StandardCharsets.UTF_8))) {
            throw new InvalidSlackSignatureException("Slack signature mismatch");
        }
    }

    String sign(String timestamp, String body) {
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(signingSecret, HMAC_SHA256));
            byte[] digest = mac.doFinal((VERSION + ":" + timestamp + ":" + body).getBytes(StandardCharsets.UTF_8));
            return VERSION + "=" + HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException | InvalidKeyException cryptoFailure) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", cryptoFailure);
        }
    }
}
