package com.codeheadsystems.lockbox.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Wire model for second-factor enrollment. The secret only becomes active once a code generated
 * from it is confirmed through {@code POST /mfa/verify}.
 * <p>
 * Used by: {@code POST /mfa/setup} response
 *
 * @param secret          base32 TOTP shared secret
 * @param qrCode          payload to render as a QR code
 * @param provisioningUri the {@code otpauth://} URI
 * @param backupCodes     single-use recovery codes
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MfaSetupResponse(
    @JsonProperty("secret") String secret,
    @JsonProperty("qr_code") String qrCode,
    @JsonProperty("provisioning_uri") String provisioningUri,
    @JsonProperty("backup_codes") List<String> backupCodes) {

  public MfaSetupResponse {
    backupCodes = backupCodes == null ? List.of() : List.copyOf(backupCodes);
  }

  @Override
  public String toString() {
    return "MfaSetupResponse[REDACTED]";
  }
}
