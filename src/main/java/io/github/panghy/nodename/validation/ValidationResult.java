package io.github.panghy.nodename.validation;

/**
 * Outcome of checking a single string against a naming grammar.
 *
 * <p>A result is either valid, in which case {@code reason} is {@code null} and
 * {@code invalidIndex} is {@code -1}, or invalid, in which case {@code reason} describes the
 * violated rule and {@code invalidIndex} points at the first offending character.</p>
 *
 * <p>ValidationResult is immutable and can be safely shared between threads.</p>
 *
 * @param valid        Whether the input satisfied the grammar
 * @param reason       The violated rule, or {@code null} when valid
 * @param invalidIndex The index of the first offending character, or {@code -1} when valid
 */
public record ValidationResult(boolean valid, String reason, int invalidIndex) {

  private static final ValidationResult VALID = new ValidationResult(true, null, -1);

  /**
   * Returns the shared successful result.
   *
   * @return A valid result
   */
  public static ValidationResult ok() {
    return VALID;
  }

  /**
   * Creates a failed result.
   *
   * @param reason       The violated rule
   * @param invalidIndex The index of the first offending character
   * @return An invalid result
   */
  public static ValidationResult invalid(String reason, int invalidIndex) {
    return new ValidationResult(false, reason, invalidIndex);
  }
}
