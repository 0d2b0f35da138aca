package io.github.panghy.nodename.node;

import io.github.panghy.nodename.error.NameValidationException;
import io.github.panghy.nodename.util.LoggingUtil;
import io.github.panghy.nodename.validation.NamespaceNormalizer;
import io.github.panghy.nodename.validation.ValidationResult;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Builds {@link SubIdentity sub-identities} by appending a relative path to an existing scope.
 *
 * <p>Two failure classes exist for the appended path:</p>
 * <ul>
 *   <li>A path starting with a separator is absolute, which is the wrong kind of argument for a
 *       relative extension. It is rejected on shape alone with
 *       {@link NameValidationException.ErrorCode#NAME_VALIDATION_ERROR}.</li>
 *   <li>Any other malformed path (bad characters, a segment starting with {@code ~}, a trailing
 *       or doubled separator, an empty path) is rejected with
 *       {@link NameValidationException.ErrorCode#INVALID_NAMESPACE}.</li>
 * </ul>
 *
 * <p>When the base is already a sub-identity, the new path is appended to the base's
 * sub-namespace with a single separator. The base's part was validated when it was created and
 * is not checked again.</p>
 */
public final class SubNamespaceComposer {

  private static final Logger LOGGER = Logger.getLogger(SubNamespaceComposer.class.getName());

  private SubNamespaceComposer() {
    // Utility class should not be instantiated
  }

  /**
   * Creates a sub-identity of {@code base} extended by {@code subNamespace}.
   *
   * @param base         The scope to extend, a node identity or another sub-identity
   * @param subNamespace The relative path to append
   * @return The new sub-identity
   * @throws NameValidationException with {@code NAME_VALIDATION_ERROR} if the path is absolute,
   *                                 or {@code INVALID_NAMESPACE} if it is otherwise malformed
   * @throws NullPointerException    if base or subNamespace is null
   */
  public static SubIdentity compose(NodeScope base, String subNamespace) {
    Objects.requireNonNull(base, "base cannot be null");
    Objects.requireNonNull(subNamespace, "subNamespace cannot be null");

    if (!subNamespace.isEmpty() && subNamespace.charAt(0) == NamespaceNormalizer.SEPARATOR) {
      throw new NameValidationException(NameValidationException.ErrorCode.NAME_VALIDATION_ERROR,
          subNamespace, "sub-namespace must be relative, it must not start with a forward slash", 0);
    }
    ValidationResult result = NamespaceNormalizer.validateRelative(subNamespace);
    if (!result.valid()) {
      throw NameValidationException.invalidNamespace(subNamespace, result.reason(), result.invalidIndex());
    }

    String parentSubNamespace = base.getSubNamespace();
    String combined = parentSubNamespace.isEmpty()
        ? subNamespace
        : parentSubNamespace + NamespaceNormalizer.SEPARATOR + subNamespace;
    SubIdentity sub = new SubIdentity(base.getRoot(), combined);
    LoggingUtil.debug(LOGGER, "Created sub-namespace '" + combined + "' for node " +
        sub.getFullyQualifiedName() + " (effective namespace " + sub.getEffectiveNamespace() + ")");
    return sub;
  }
}
