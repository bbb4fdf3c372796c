package uk.gegc.revisionhelper.shared.security;

import java.util.Optional;
import java.util.UUID;

/**
 * Who is calling: either an authenticated user or an anonymous session, never both.
 */
public final class CallerIdentity {

    private final AuthenticatedUser user;
    private final String sessionId;

    private CallerIdentity(AuthenticatedUser user, String sessionId) {
        this.user = user;
        this.sessionId = sessionId;
    }

    public static CallerIdentity authenticated(AuthenticatedUser user) {
        if (user == null) {
            throw new IllegalArgumentException("Authenticated caller requires a user");
        }
        return new CallerIdentity(user, null);
    }

    /**
     * Anonymous caller. A blank session id gets a freshly generated one, so the
     * caller's data is reachable only for as long as it keeps that id.
     */
    public static CallerIdentity anonymous(String sessionId) {
        String effective = sessionId == null || sessionId.isBlank()
                ? UUID.randomUUID().toString()
                : sessionId.trim();
        return new CallerIdentity(null, effective);
    }

    public boolean isAuthenticated() {
        return user != null;
    }

    public Optional<AuthenticatedUser> user() {
        return Optional.ofNullable(user);
    }

    public String sessionId() {
        return sessionId;
    }

    public AccessScope scope() {
        return user != null ? AccessScope.user(user.userId()) : AccessScope.session(sessionId);
    }

    @Override
    public String toString() {
        return scope().toString();
    }
}
