package com.scholary.video.composer.webhook;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.stereotype.Component;

/**
 * Verifies HMAC-SHA256 signatures of webhook bodies.
 *
 * <p>The header value is {@code sha256=<lowercase hex>} computed over the raw request bytes.
 * Comparison is constant time. Without a configured secret nothing verifies.
 */
@Component
public class WebhookSignatureVerifier {

  static final String ALGORITHM = "HmacSHA256";
  static final String PREFIX = "sha256=";

  private final WebhookProperties properties;

  public WebhookSignatureVerifier(WebhookProperties properties) {
    this.properties = properties;
  }

  /**
   * Check {@code signatureHeader} against {@code body}.
   *
   * @throws SignatureVerificationException if the signature is missing, malformed or wrong, or no
   *     secret is configured
   */
  public void verify(byte[] body, String signatureHeader) {
    if (!properties.hasSecret()) {
      throw new SignatureVerificationException("Webhook secret is not configured");
    }
    if (signatureHeader == null || signatureHeader.isBlank()) {
      throw new SignatureVerificationException("Missing webhook signature");
    }
    String value = signatureHeader.trim();
    if (!value.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
      throw new SignatureVerificationException("Unsupported webhook signature scheme");
    }

    byte[] provided;
    try {
      provided = HexFormat.of().parseHex(value.substring(PREFIX.length()));
    } catch (IllegalArgumentException e) {
      throw new SignatureVerificationException("Malformed webhook signature", e);
    }

    if (!MessageDigest.isEqual(sign(body), provided)) {
      throw new SignatureVerificationException("Webhook signature mismatch");
    }
  }

  /** Compute the header value for {@code body}. */
  public String signatureFor(byte[] body) {
    return PREFIX + HexFormat.of().formatHex(sign(body));
  }

  private byte[] sign(byte[] body) {
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(
          new SecretKeySpec(properties.secret().getBytes(StandardCharsets.UTF_8), ALGORITHM));
      return mac.doFinal(body);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("HMAC-SHA256 unavailable", e);
    }
  }
}
