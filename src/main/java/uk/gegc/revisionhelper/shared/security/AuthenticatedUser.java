package uk.gegc.revisionhelper.shared.security;

/**
 * An identity already verified by the surrounding layer. Email and name are optional.
 */
public record AuthenticatedUser(String userId, String email, String name) {

    public AuthenticatedUser {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User id must not be blank");
        }
    }

    public static AuthenticatedUser of(String userId) {
        return new AuthenticatedUser(userId, null, null);
    }
}
