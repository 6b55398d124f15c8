package com.codeheadsystems.lockbox.server.mfa;

import com.codeheadsystems.lockbox.crypto.common.RandomProvider;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.Locale;
import org.bouncycastle.crypto.digests.SHA1Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.util.encoders.Base32;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Time-based one-time passwords (RFC 6238): HMAC-SHA1, 6 digits, 30 second step.
 * <p>
 * Codes from the previous and the next step are accepted as well, to allow for clock drift
 * between the authority and the authenticator app.
 */
public class TotpManager {

  public static final int DIGITS = 6;
  public static final long STEP_SECONDS = 30;
  public static final int SECRET_LENGTH = 20;
  public static final int ALLOWED_DRIFT_STEPS = 1;

  private static final Logger log = LoggerFactory.getLogger(TotpManager.class);
  private static final int MODULUS = 1_000_000;

  private final RandomProvider randomProvider;
  private final Clock clock;
  private final String issuer;

  /**
   * Instantiates a new Totp manager.
   *
   * @param randomProvider source for new secrets
   * @param clock          the clock
   * @param issuer         issuer shown by authenticator apps
   */
  public TotpManager(final RandomProvider randomProvider, final Clock clock, final String issuer) {
    log.info("TotpManager(issuer={})", issuer);
    this.randomProvider = randomProvider;
    this.clock = clock;
    this.issuer = issuer;
  }

  /**
   * A new 160-bit secret, Base32 without padding.
   *
   * @return the secret
   */
  public String generateSecret() {
    return Base32.toBase32String(randomProvider.randomBytes(SECRET_LENGTH)).replace("=", "");
  }

  /**
   * The {@code otpauth://} URI authenticator apps import.
   *
   * @param username the account
   * @param secret   the Base32 secret
   * @return the uri
   */
  public String provisioningUri(final String username, final String secret) {
    return "otpauth://totp/" + encode(issuer + ":" + username)
        + "?secret=" + secret
        + "&issuer=" + encode(issuer)
        + "&algorithm=SHA1&digits=" + DIGITS + "&period=" + STEP_SECONDS;
  }

  /**
   * Checks a code against the current step and its neighbours.
   *
   * @param secret Base32 secret
   * @param code   the submitted code
   * @return true if valid
   */
  public boolean verify(final String secret, final String code) {
    if (secret == null || code == null) {
      return false;
    }
    String trimmed = code.trim();
    if (trimmed.length() != DIGITS || !trimmed.chars().allMatch(Character::isDigit)) {
      return false;
    }
    byte[] key = decodeSecret(secret);
    long step = clock.instant().getEpochSecond() / STEP_SECONDS;
    boolean matched = false;
    for (long offset = -ALLOWED_DRIFT_STEPS; offset <= ALLOWED_DRIFT_STEPS; offset++) {
      byte[] expected = generate(key, step + offset).getBytes(StandardCharsets.US_ASCII);
      matched |= MessageDigest.isEqual(expected, trimmed.getBytes(StandardCharsets.US_ASCII));
    }
    return matched;
  }

  /**
   * The code for the current step.
   *
   * @param secret Base32 secret
   * @return the code
   */
  public String currentCode(final String secret) {
    return generate(decodeSecret(secret), clock.instant().getEpochSecond() / STEP_SECONDS);
  }

  /**
   * HOTP (RFC 4226) over the given counter, truncated to {@link #DIGITS} digits.
   *
   * @param key     raw key
   * @param counter the time step
   * @return zero-padded code
   */
  public static String generate(final byte[] key, final long counter) {
    HMac hmac = new HMac(new SHA1Digest());
    hmac.init(new KeyParameter(key));
    byte[] message = new byte[8];
    for (int i = 7; i >= 0; i--) {
      message[i] = (byte) (counter >>> (8 * (7 - i)));
    }
    hmac.update(message, 0, message.length);
    byte[] mac = new byte[hmac.getMacSize()];
    hmac.doFinal(mac, 0);

    int offset = mac[mac.length - 1] & 0x0f;
    int binary = ((mac[offset] & 0x7f) << 24)
        | ((mac[offset + 1] & 0xff) << 16)
        | ((mac[offset + 2] & 0xff) << 8)
        | (mac[offset + 3] & 0xff);
    return String.format(Locale.ROOT, "%0" + DIGITS + "d", binary % MODULUS);
  }

  private static byte[] decodeSecret(final String secret) {
    String normalized = secret.trim().toUpperCase(Locale.ROOT);
    int pad = (8 - normalized.length() % 8) % 8;
    return Base32.decode(normalized + "=".repeat(pad));
  }

  private static String encode(final String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
  }
}
