package ca.gc.cra.secretscan.infrastructure.aws;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/** Text helpers shared by the AWS scanners. */
final class AwsText {
  private AwsText() {}

  /**
   * Decodes base64 user data; returns the input unchanged when it is not valid base64.
   */
  static String decodeBase64(String encoded) {
    if (encoded == null || encoded.isBlank()) {
      return "";
    }
    try {
      return new String(Base64.getMimeDecoder().decode(encoded.trim()), StandardCharsets.UTF_8);
    } catch (IllegalArgumentException ex) {
      return encoded;
    }
  }

  static <T> Map<String, String> toMap(
      List<T> items, Function<T, String> key, Function<T, String> value) {
    Map<String, String> map = new LinkedHashMap<>();
    if (items != null) {
      for (T item : items) {
        String k = key.apply(item);
        if (k != null) {
          map.put(k, value.apply(item));
        }
      }
    }
    return map;
  }

  static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
