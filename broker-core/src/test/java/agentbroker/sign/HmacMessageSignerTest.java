package agentbroker.sign;

import agentbroker.util.JsonCodec;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HmacMessageSignerTest {
  private final HmacMessageSigner signer = HmacMessageSigner.INSTANCE;

  @Test
  void sharedInstanceIsFullyInitialized() {
    HmacMessageSigner fresh = new HmacMessageSigner(JsonCodec.getDefault());

    assertNotNull(HmacMessageSigner.INSTANCE);
    assertEquals(fresh.sign("m-1", "hello", "secret"),
        HmacMessageSigner.INSTANCE.sign("m-1", "hello", "secret"));
  }

  @Test
  void tokenIsCompactJwsWithHs256Header() {
    String token = signer.sign("m-1", "hello", "secret");
    String[] parts = token.split("\\.");

    assertEquals(3, parts.length);
    String header = new String(Base64.getUrlDecoder().decode(parts[0]), StandardCharsets.UTF_8);
    assertEquals("{\"alg\":\"HS256\",\"typ\":\"JWT\"}", header);
    String claims = new String(Base64.getUrlDecoder().decode(parts[1]), StandardCharsets.UTF_8);
    assertEquals("{\"message_id\":\"m-1\",\"payload\":\"hello\"}", claims);
    assertFalse(token.contains("="));
  }

  @Test
  void signingIsDeterministic() {
    assertEquals(signer.sign("m-1", "hello", "secret"), signer.sign("m-1", "hello", "secret"));
  }

  @Test
  void verifyAcceptsOwnToken() {
    String token = signer.sign("m-1", "hello", "secret");

    assertTrue(signer.verify(token, "m-1", "hello", "secret"));
  }

  @Test
  void verifyRejectsWrongKeyIdOrPayload() {
    String token = signer.sign("m-1", "hello", "secret");

    assertFalse(signer.verify(token, "m-1", "hello", "other"));
    assertFalse(signer.verify(token, "m-2", "hello", "secret"));
    assertFalse(signer.verify(token, "m-1", "hello!", "secret"));
  }

  @Test
  void verifyRejectsForgedClaimsWithReusedMac() {
    String token = signer.sign("m-1", "hello", "secret");
    String[] parts = token.split("\\.");
    String forgedClaims = Base64.getUrlEncoder().withoutPadding().encodeToString(
        "{\"message_id\":\"m-1\",\"payload\":\"evil\"}".getBytes(StandardCharsets.UTF_8));

    assertFalse(signer.verify(parts[0] + "." + forgedClaims + "." + parts[2], "m-1", "evil", "secret"));
  }

  @Test
  void verifyRejectsMalformedTokens() {
    assertFalse(signer.verify(null, "m-1", "hello", "secret"));
    assertFalse(signer.verify("", "m-1", "hello", "secret"));
    assertFalse(signer.verify("a.b", "m-1", "hello", "secret"));
    assertFalse(signer.verify("a.b.c.d", "m-1", "hello", "secret"));
    assertFalse(signer.verify("!!!.@@@.###", "m-1", "hello", "secret"));
  }

  @Test
  void verifyRejectsOtherAlgorithms() {
    String token = signer.sign("m-1", "hello", "secret");
    String[] parts = token.split("\\.");
    String noneHeader = Base64.getUrlEncoder().withoutPadding().encodeToString(
        "{\"alg\":\"none\",\"typ\":\"JWT\"}".getBytes(StandardCharsets.UTF_8));

    assertFalse(signer.verify(noneHeader + "." + parts[1] + "." + parts[2], "m-1", "hello", "secret"));
  }

  @Test
  void emptyKeyRejectedOnSignAndVerify() {
    assertThrows(IllegalArgumentException.class, () -> signer.sign("m-1", "hello", ""));
    assertFalse(signer.verify(signer.sign("m-1", "hello", "secret"), "m-1", "hello", ""));
  }
}
