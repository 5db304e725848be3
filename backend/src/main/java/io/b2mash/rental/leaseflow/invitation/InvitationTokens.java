package io.b2mash.rental.leaseflow.invitation;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;
import org.springframework.stereotype.Component;

/** Generates invitation tokens and the SHA-256 hashes they are stored and looked up by. */
@Component
public class InvitationTokens {

  private final SecureRandom secureRandom = new SecureRandom();
  private final int tokenBytes;

  public InvitationTokens(InvitationProperties properties) {
    this.tokenBytes = properties.tokenBytes();
  }

  /** Returns a new URL-safe Base64 token. */
  public String generate() {
    byte[] bytes = new byte[tokenBytes];
    secureRandom.nextBytes(bytes);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
  }

  /** Hashes a raw token string using SHA-256, returning the hex-encoded hash. */
  public String hash(String rawToken) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hashBytes = digest.digest(rawToken.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hashBytes);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
