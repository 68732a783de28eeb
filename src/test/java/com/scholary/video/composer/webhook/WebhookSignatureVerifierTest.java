package com.scholary.video.composer.webhook;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class WebhookSignatureVerifierTest {

  private static final byte[] BODY =
      "{\"id\":\"pred-1\",\"status\":\"succeeded\"}".getBytes(StandardCharsets.UTF_8);

  private final WebhookSignatureVerifier verifier =
      new WebhookSignatureVerifier(new WebhookProperties("test-secret", "X-Webhook-Signature"));

  @Test
  void verify_shouldAcceptOwnSignature() {
    String signature = verifier.signatureFor(BODY);

    assertThat(signature).startsWith("sha256=").hasSize("sha256=".length() + 64);
    assertThatCode(() -> verifier.verify(BODY, signature)).doesNotThrowAnyException();
    assertThatCode(() -> verifier.verify(BODY, "SHA256=" + signature.substring(7)))
        .doesNotThrowAnyException();
  }

  @Test
  void verify_shouldMatchKnownHmacVector() {
    // RFC 4231 test case 2
    WebhookSignatureVerifier jefe =
        new WebhookSignatureVerifier(new WebhookProperties("Jefe", "X-Webhook-Signature"));
    byte[] body = "what do ya want for nothing?".getBytes(StandardCharsets.US_ASCII);

    assertThat(jefe.signatureFor(body))
        .isEqualTo("sha256=5bdcc146bf60754e6a042426089575c75a003f089d2739839dec58b964ec3843");
  }

  @Test
  void verify_shouldRejectTamperedBody() {
    String signature = verifier.signatureFor(BODY);
    byte[] tampered =
        "{\"id\":\"pred-1\",\"status\":\"failed\"}".getBytes(StandardCharsets.UTF_8);

    assertThatThrownBy(() -> verifier.verify(tampered, signature))
        .isInstanceOf(SignatureVerificationException.class)
        .hasMessage("Webhook signature mismatch");
  }

  @Test
  void verify_shouldRejectMissingOrMalformedSignature() {
    assertThatThrownBy(() -> verifier.verify(BODY, null))
        .isInstanceOf(SignatureVerificationException.class)
        .hasMessage("Missing webhook signature");
    assertThatThrownBy(() -> verifier.verify(BODY, "md5=abcd"))
        .isInstanceOf(SignatureVerificationException.class);
    assertThatThrownBy(() -> verifier.verify(BODY, "sha256=not-hex"))
        .isInstanceOf(SignatureVerificationException.class)
        .hasMessage("Malformed webhook signature");
  }

  @Test
  void verify_shouldFailClosedWithoutSecret() {
    WebhookSignatureVerifier unconfigured =
        new WebhookSignatureVerifier(new WebhookProperties("", "X-Webhook-Signature"));

    assertThatThrownBy(() -> unconfigured.verify(BODY, "sha256=00"))
        .isInstanceOf(SignatureVerificationException.class)
        .hasMessage("Webhook secret is not configured");
  }
}
