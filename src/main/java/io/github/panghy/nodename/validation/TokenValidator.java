package io.github.panghy.nodename.validation;

import java.util.Objects;

/**
 * Checks identifier tokens against the node naming grammar.
 *
 * <p>A token is the smallest unit of a node name: the node's own local name and every segment
 * of a namespace are tokens. The grammar is:</p>
 * <pre>
 * token := [A-Za-z_] [A-Za-z0-9_]*
 * </pre>
 *
 * <p>Only ASCII letters are accepted. Separators, wildcards, the private-namespace prefix
 * {@code ~}, whitespace and any other punctuation are rejected.</p>
 *
 * <p>Usage example:</p>
 * <pre>{@code
 * ValidationResult result = TokenValidator.validate("my_node");
 * if (!result.valid()) {
 *   // result.reason() and result.invalidIndex() describe the failure
 * }
 * }</pre>
 */
public final class TokenValidator {

  private TokenValidator() {
    // Utility class should not be instantiated
  }

  /**
   * Validates a single token.
   *
   * @param token The candidate token
   * @return The validation outcome
   * @throws NullPointerException if token is null
   */
  public static ValidationResult validate(String token) {
    Objects.requireNonNull(token, "token cannot be null");
    if (token.isEmpty()) {
      return ValidationResult.invalid("must not be empty", 0);
    }
    char first = token.charAt(0);
    if (isDigit(first)) {
      return ValidationResult.invalid("must not start with a number", 0);
    }
    if (!isLetter(first) && first != '_') {
      return ValidationResult.invalid(
          "must start with a letter or underscore, found '" + first + "'", 0);
    }
    for (int i = 1; i < token.length(); i++) {
      char c = token.charAt(i);
      if (!isTokenChar(c)) {
        return ValidationResult.invalid(
            "must contain only alphanumeric characters and underscores, found '" + c + "'", i);
      }
    }
    return ValidationResult.ok();
  }

  /**
   * Returns whether the given string is a valid token.
   *
   * @param token The candidate token
   * @return true if the token satisfies the grammar
   */
  public static boolean isValid(String token) {
    return validate(token).valid();
  }

  static boolean isTokenChar(char c) {
    return isLetter(c) || isDigit(c) || c == '_';
  }

  private static boolean isLetter(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
