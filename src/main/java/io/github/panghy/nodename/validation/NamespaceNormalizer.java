package io.github.panghy.nodename.validation;

import io.github.panghy.nodename.error.NameValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw namespace strings into their canonical absolute form.
 *
 * <p>A canonical namespace is either the root {@code "/"} or a separator followed by one or
 * more {@link TokenValidator tokens} joined by separators, with no trailing separator.
 * Normalization follows these rules:</p>
 * <ol>
 *   <li>An empty (or null) namespace is the root namespace {@code "/"}.</li>
 *   <li>A relative namespace is made absolute, so {@code "ns"} and {@code "/ns"} are the same.</li>
 *   <li>A trailing separator is an error. It is never stripped.</li>
 *   <li>Doubled separators (empty segments) are an error.</li>
 *   <li>Every segment must be a valid token.</li>
 * </ol>
 *
 * <p>All failures are reported as {@link NameValidationException.ErrorCode#INVALID_NAMESPACE}
 * with the index of the offending character in the string the caller supplied.</p>
 *
 * <p>Normalization is idempotent: {@code normalize(normalize(ns)).equals(normalize(ns))}.</p>
 */
public final class NamespaceNormalizer {

  /**
   * Separator between namespace segments.
   */
  public static final char SEPARATOR = '/';

  /**
   * The root namespace.
   */
  public static final String ROOT = "/";

  /**
   * Prefix that marks a private (node-relative) name. Not allowed at the start of a
   * sub-namespace segment.
   */
  public static final char PRIVATE_PREFIX = '~';

  private NamespaceNormalizer() {
    // Utility class should not be instantiated
  }

  /**
   * Normalizes and validates a namespace.
   *
   * @param rawNamespace The namespace as supplied by the caller, may be null or empty
   * @return The canonical namespace
   * @throws NameValidationException with {@code INVALID_NAMESPACE} if the namespace is malformed
   */
  public static String normalize(String rawNamespace) {
    if (rawNamespace == null || rawNamespace.isEmpty()) {
      return ROOT;
    }
    boolean prefixed = rawNamespace.charAt(0) != SEPARATOR;
    String absolute = prefixed ? SEPARATOR + rawNamespace : rawNamespace;
    // Indices are computed on the absolute form and mapped back onto the caller's string.
    int adjust = prefixed ? -1 : 0;
    if (absolute.length() == 1) {
      return ROOT;
    }
    if (absolute.charAt(absolute.length() - 1) == SEPARATOR) {
      throw NameValidationException.invalidNamespace(rawNamespace,
          "must not end with a forward slash", absolute.length() - 1 + adjust);
    }
    List<String> segments = new ArrayList<>();
    ValidationResult result = splitAndValidate(absolute, 1, segments, false);
    if (!result.valid()) {
      throw NameValidationException.invalidNamespace(rawNamespace, result.reason(),
          result.invalidIndex() + adjust);
    }
    return ROOT + String.join(ROOT, segments);
  }

  /**
   * Returns whether the given string is already a canonical namespace.
   *
   * @param namespace The namespace to check
   * @return true if {@link #normalize(String)} would return the same string
   */
  public static boolean isCanonical(String namespace) {
    if (namespace == null || namespace.isEmpty() || namespace.charAt(0) != SEPARATOR) {
      return false;
    }
    try {
      return normalize(namespace).equals(namespace);
    } catch (NameValidationException e) {
      return false;
    }
  }

  /**
   * Validates a relative namespace path, the form used for sub-namespaces.
   *
   * <p>The path must be non-empty, must not start or end with a separator, must not contain
   * doubled separators, and every segment must be a valid token that does not start with the
   * {@link #PRIVATE_PREFIX private prefix}.</p>
   *
   * @param relativePath The relative path
   * @return The validation outcome, with indices relative to {@code relativePath}
   */
  public static ValidationResult validateRelative(String relativePath) {
    if (relativePath == null || relativePath.isEmpty()) {
      return ValidationResult.invalid("must not be empty", 0);
    }
    if (relativePath.charAt(0) == SEPARATOR) {
      return ValidationResult.invalid("must not start with a forward slash", 0);
    }
    if (relativePath.charAt(relativePath.length() - 1) == SEPARATOR) {
      return ValidationResult.invalid("must not end with a forward slash", relativePath.length() - 1);
    }
    return splitAndValidate(relativePath, 0, new ArrayList<>(), true);
  }

  private static ValidationResult splitAndValidate(String path, int start, List<String> segments,
                                                   boolean rejectPrivatePrefix) {
    int segmentStart = start;
    while (segmentStart <= path.length()) {
      int end = path.indexOf(SEPARATOR, segmentStart);
      if (end < 0) {
        end = path.length();
      }
      String segment = path.substring(segmentStart, end);
      if (segment.isEmpty()) {
        return ValidationResult.invalid("must not contain repeated forward slashes", segmentStart);
      }
      if (rejectPrivatePrefix && segment.charAt(0) == PRIVATE_PREFIX) {
        return ValidationResult.invalid(
            "segment '" + segment + "' must not start with '" + PRIVATE_PREFIX + "'", segmentStart);
      }
      ValidationResult result = TokenValidator.validate(segment);
      if (!result.valid()) {
        return ValidationResult.invalid("segment '" + segment + "' " + result.reason(),
            result.invalidIndex() + segmentStart);
      }
      segments.add(segment);
      segmentStart = end + 1;
    }
    return ValidationResult.ok();
  }
}
