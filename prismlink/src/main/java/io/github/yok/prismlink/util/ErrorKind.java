package io.github.yok.prismlink.util;

/**
 * Classification of failures raised by the Prism client.
 *
 * <p>
 * Lookup and search operations never raise these; they signal problems through empty results
 * instead. Mutating operations raise a {@link PrismException} carrying one of these kinds.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public enum ErrorKind {

    // Schema absent, not a JSON object, unreadable file or missing required attributes.
    INVALID_SCHEMA,

    // No target table ID, name or schema identifier could be resolved.
    MISSING_TARGET,

    // The target table named by the caller does not exist.
    TABLE_NOT_FOUND,

    // The bucket POST did not answer 201.
    BUCKET_CREATE_FAILED,

    // The bucket complete POST answered neither 201 nor 400.
    BUCKET_COMPLETE_FAILED,

    // A file container could not be created for a staging batch.
    CONTAINER_CREATE_FAILED,

    // Any other non-success status returned by the HTTP collaborator.
    TRANSPORT_ERROR,

    // A resource addressed by ID does not exist.
    NOT_FOUND
}
