package uk.gegc.revisionhelper.shared.exception;

/**
 * Thrown when a revision, run or question cannot be found for the calling identity.
 * Rows owned by someone else are reported through this exception as well.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
