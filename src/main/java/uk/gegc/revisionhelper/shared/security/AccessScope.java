package uk.gegc.revisionhelper.shared.security;

import java.util.Objects;

/**
 * Identity key used to filter every read and stamp every write.
 * Authenticated callers are keyed by user id, anonymous callers by session id;
 * a row stamped with one kind never matches a lookup keyed by the other.
 */
public record AccessScope(OwnerType type, String ownerId) {

    public AccessScope {
        Objects.requireNonNull(type, "Owner type must not be null");
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("Owner id must not be blank");
        }
    }

    public static AccessScope user(String userId) {
        return new AccessScope(OwnerType.USER, userId);
    }

    public static AccessScope session(String sessionId) {
        return new AccessScope(OwnerType.SESSION, sessionId);
    }

    public boolean isAuthenticated() {
        return type == OwnerType.USER;
    }

    /**
     * @return the user id to stamp on new rows, or {@code null} for anonymous callers
     */
    public String userId() {
        return isAuthenticated() ? ownerId : null;
    }

    /**
     * @return the session id to stamp on new rows, or {@code null} for authenticated callers
     */
    public String sessionId() {
        return isAuthenticated() ? null : ownerId;
    }

    public boolean owns(String rowUserId, String rowSessionId) {
        String stamped = isAuthenticated() ? rowUserId : rowSessionId;
        return ownerId.equals(stamped);
    }

    @Override
    public String toString() {
        return (isAuthenticated() ? "user " : "session ") + ownerId;
    }
}
