package io.github.yok.prismlink.util;

import lombok.Getter;

/**
 * Unchecked exception raised by mutating Prism operations.
 *
 * <p>
 * Carries the {@link ErrorKind} and, when known, the identifier of the resource the operation was
 * resolved against so that terminal messages can name it.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class PrismException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    // Failure classification
    private final ErrorKind kind;

    // Resolved resource identifier (table ID, bucket ID, ...), may be null
    private final String resourceId;

    /**
     * Creates an exception without a resource identifier.
     *
     * @param kind failure classification
     * @param message human readable message
     */
    public PrismException(ErrorKind kind, String message) {
        this(kind, null, message, null);
    }

    /**
     * Creates an exception for a resolved resource.
     *
     * @param kind failure classification
     * @param resourceId identifier of the resource involved
     * @param message human readable message
     */
    public PrismException(ErrorKind kind, String resourceId, String message) {
        this(kind, resourceId, message, null);
    }

    /**
     * Creates an exception wrapping a root cause.
     *
     * @param kind failure classification
     * @param resourceId identifier of the resource involved, may be null
     * @param message human readable message
     * @param cause root cause, may be null
     */
    public PrismException(ErrorKind kind, String resourceId, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.resourceId = resourceId;
    }
}
