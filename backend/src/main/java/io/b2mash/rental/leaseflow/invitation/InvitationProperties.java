package io.b2mash.rental.leaseflow.invitation;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration for tenant invitations.
 *
 * @param expiryDays days an invitation stays usable after it is issued
 * @param tokenBytes random bytes per token before base64url encoding
 */
@ConfigurationProperties(prefix = "leaseflow.invitation")
public record InvitationProperties(int expiryDays, int tokenBytes) {

  public InvitationProperties {
    if (expiryDays <= 0) {
      expiryDays = 7;
    }
    if (tokenBytes < 16) {
      tokenBytes = 32;
    }
  }
}
