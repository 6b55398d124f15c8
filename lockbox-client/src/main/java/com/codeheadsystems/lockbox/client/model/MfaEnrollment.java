package com.codeheadsystems.lockbox.client.model;

import java.util.List;

/**
 * A pending second-factor enrollment. It becomes active once a code is confirmed.
 *
 * @param sharedSecret    base32 TOTP secret
 * @param provisioningUri the {@code otpauth://} URI
 * @param qrCode          payload for a QR code
 * @param recoveryCodes   single-use backup codes
 */
public record MfaEnrollment(String sharedSecret, String provisioningUri, String qrCode, List<String> recoveryCodes) {

  /**
   * Copies the codes.
   */
  public MfaEnrollment {
    recoveryCodes = recoveryCodes == null ? List.of() : List.copyOf(recoveryCodes);
  }

  @Override
  public String toString() {
    return "MfaEnrollment[REDACTED]";
  }
}
