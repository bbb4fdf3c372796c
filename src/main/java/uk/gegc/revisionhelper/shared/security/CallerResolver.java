package uk.gegc.revisionhelper.shared.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

/**
 * Builds the {@link CallerIdentity} for the current call from the Spring Security context.
 * Credentials are never checked here; whatever authentication the surrounding layer put
 * into the context is trusted as-is.
 */
@Component
@Slf4j
public class CallerResolver {

    public CallerIdentity resolve(String sessionId) {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null
                || !authentication.isAuthenticated()
                || authentication instanceof AnonymousAuthenticationToken
                || authentication.getName() == null
                || authentication.getName().isBlank()) {
            CallerIdentity anonymous = CallerIdentity.anonymous(sessionId);
            log.debug("Resolved anonymous caller for {}", anonymous);
            return anonymous;
        }
        log.debug("Resolved authenticated caller {}", authentication.getName());
        return CallerIdentity.authenticated(AuthenticatedUser.of(authentication.getName()));
    }
}
