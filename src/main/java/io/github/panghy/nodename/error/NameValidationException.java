package io.github.panghy.nodename.error;

import java.util.Objects;

/**
 * Exception thrown when a node name, namespace or sub-namespace is rejected.
 *
 * <p>All naming failures are reported through this single exception type. The
 * {@link ErrorCode} tells callers which kind of input was wrong:</p>
 * <ul>
 *   <li>{@link ErrorCode#INVALID_NODE_NAME} - the local node name breaks the token grammar</li>
 *   <li>{@link ErrorCode#INVALID_NAMESPACE} - a namespace or relative sub-namespace is malformed</li>
 *   <li>{@link ErrorCode#NAME_VALIDATION_ERROR} - the input has the wrong shape altogether, such as
 *       an absolute path passed where a relative sub-namespace is expected</li>
 * </ul>
 *
 * <p>Every instance carries the offending value, the rule it violated and, where it applies,
 * the index of the first offending character. Naming input is deterministic, so none of these
 * failures is retryable.</p>
 */
public class NameValidationException extends RuntimeException {

  /**
   * Enumeration of error codes for naming failures.
   */
  public enum ErrorCode {
    /**
     * The node name does not satisfy the token grammar.
     */
    INVALID_NODE_NAME(2001),

    /**
     * A namespace or sub-namespace segment does not satisfy its grammar.
     */
    INVALID_NAMESPACE(2002),

    /**
     * The input is categorically the wrong kind of name (e.g. absolute where relative is required).
     */
    NAME_VALIDATION_ERROR(2003);

    private final int code;

    ErrorCode(int code) {
      this.code = code;
    }

    /**
     * Gets the numeric code for this error.
     *
     * @return The error code
     */
    public int getCode() {
      return code;
    }

    /**
     * Gets an ErrorCode from its numeric value.
     *
     * @param code The numeric error code
     * @return The corresponding ErrorCode, or NAME_VALIDATION_ERROR if not found
     */
    public static ErrorCode fromCode(int code) {
      for (ErrorCode errorCode : values()) {
        if (errorCode.code == code) {
          return errorCode;
        }
      }
      return NAME_VALIDATION_ERROR;
    }
  }

  /**
   * Marker for failures that do not point at a single character.
   */
  public static final int NO_INDEX = -1;

  private final ErrorCode errorCode;
  private final String invalidValue;
  private final String reason;
  private final int invalidIndex;

  /**
   * Creates a new naming exception.
   *
   * @param errorCode    The kind of failure
   * @param invalidValue The value that was rejected
   * @param reason       The rule the value violated
   * @param invalidIndex The index of the first offending character, or {@link #NO_INDEX}
   * @throws NullPointerException if errorCode is null
   */
  public NameValidationException(ErrorCode errorCode, String invalidValue, String reason, int invalidIndex) {
    super(formatMessage(Objects.requireNonNull(errorCode, "errorCode cannot be null"),
        invalidValue, reason, invalidIndex));
    this.errorCode = errorCode;
    this.invalidValue = invalidValue;
    this.reason = reason;
    this.invalidIndex = invalidIndex;
  }

  /**
   * Creates a new naming exception that does not point at a specific character.
   *
   * @param errorCode    The kind of failure
   * @param invalidValue The value that was rejected
   * @param reason       The rule the value violated
   */
  public NameValidationException(ErrorCode errorCode, String invalidValue, String reason) {
    this(errorCode, invalidValue, reason, NO_INDEX);
  }

  /**
   * Creates an {@link ErrorCode#INVALID_NODE_NAME} exception.
   *
   * @param nodeName     The rejected node name
   * @param reason       The rule it violated
   * @param invalidIndex The index of the first offending character
   * @return The exception
   */
  public static NameValidationException invalidNodeName(String nodeName, String reason, int invalidIndex) {
    return new NameValidationException(ErrorCode.INVALID_NODE_NAME, nodeName, reason, invalidIndex);
  }

  /**
   * Creates an {@link ErrorCode#INVALID_NAMESPACE} exception.
   *
   * @param namespace    The rejected namespace or sub-namespace
   * @param reason       The rule it violated
   * @param invalidIndex The index of the first offending character, or {@link #NO_INDEX}
   * @return The exception
   */
  public static NameValidationException invalidNamespace(String namespace, String reason, int invalidIndex) {
    return new NameValidationException(ErrorCode.INVALID_NAMESPACE, namespace, reason, invalidIndex);
  }

  private static String formatMessage(ErrorCode errorCode, String invalidValue, String reason,
                                      int invalidIndex) {
    String kind = switch (errorCode) {
      case INVALID_NODE_NAME -> "Invalid node name";
      case INVALID_NAMESPACE -> "Invalid namespace";
      case NAME_VALIDATION_ERROR -> "Invalid name";
    };
    StringBuilder sb = new StringBuilder(kind)
        .append(" '").append(invalidValue).append("': ").append(reason);
    if (invalidIndex != NO_INDEX) {
      sb.append(" (at index ").append(invalidIndex).append(')');
    }
    return sb.toString();
  }

  /**
   * Gets the error code for this exception.
   *
   * @return The error code
   */
  public ErrorCode getErrorCode() {
    return errorCode;
  }

  /**
   * Gets the numeric value of the error code.
   *
   * @return The numeric error code
   */
  public int getErrorCodeValue() {
    return errorCode.getCode();
  }

  /**
   * Gets the value that was rejected.
   *
   * @return The offending value
   */
  public String getInvalidValue() {
    return invalidValue;
  }

  /**
   * Gets the rule the value violated.
   *
   * @return A human-readable description of the violated rule
   */
  public String getReason() {
    return reason;
  }

  /**
   * Gets the index of the first offending character.
   *
   * @return The index, or {@link #NO_INDEX} when the failure is not tied to a character
   */
  public int getInvalidIndex() {
    return invalidIndex;
  }

  @Override
  public String toString() {
    return "NameValidationException{" +
        "errorCode=" + errorCode +
        ", message='" + getMessage() + '\'' +
        '}';
  }
}
