package com.codeheadsystems.lockbox.crypto.common;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * Utility methods for byte array handling and the lowercase hex encoding used on the wire.
 */
public class ByteUtils {

  private static final HexFormat HEX = HexFormat.of();

  private ByteUtils() {
  }

  /**
   * Concatenates multiple byte arrays into a single array.
   *
   * @param arrays the arrays
   * @return the byte [ ]
   */
  public static byte[] concat(byte[]... arrays) {
    int totalLength = 0;
    for (byte[] arr : arrays) {
      totalLength += arr.length;
    }
    byte[] result = new byte[totalLength];
    int offset = 0;
    for (byte[] arr : arrays) {
      System.arraycopy(arr, 0, result, offset, arr.length);
      offset += arr.length;
    }
    return result;
  }

  /**
   * Overwrites every given array with zeros. Null arrays are skipped.
   *
   * @param arrays the arrays to scrub
   */
  public static void wipe(byte[]... arrays) {
    for (byte[] arr : arrays) {
      if (arr != null) {
        Arrays.fill(arr, (byte) 0);
      }
    }
  }

  /**
   * Lowercase hex encoding.
   *
   * @param bytes the bytes
   * @return the hex string
   */
  public static String toHex(byte[] bytes) {
    return HEX.formatHex(bytes);
  }

  /**
   * Decodes a hex string, accepting either case.
   *
   * @param hex the hex string
   * @return the decoded bytes
   * @throws IllegalArgumentException if the string is not valid hex
   */
  public static byte[] fromHex(String hex) {
    return HEX.parseHex(hex);
  }

  /**
   * Decodes a required hex field, rejecting null, blank and malformed values with a message
   * naming the field.
   *
   * @param hex       the hex string
   * @param fieldName the field name used in the error message
   * @return the decoded bytes
   * @throws IllegalArgumentException if the field is missing or not valid hex
   */
  public static byte[] requireHex(String hex, String fieldName) {
    if (hex == null || hex.isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + fieldName);
    }
    try {
      return HEX.parseHex(hex);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid hex in field: " + fieldName, e);
    }
  }
}
