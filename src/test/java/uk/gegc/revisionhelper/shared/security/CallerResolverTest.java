package uk.gegc.revisionhelper.shared.security;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.test.context.support.WithAnonymousUser;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(SpringExtension.class)
@ContextConfiguration(classes = CallerResolver.class)
@DisplayName("CallerResolver")
class CallerResolverTest {

    @Autowired
    private CallerResolver resolver;

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    @WithMockUser(username = "alice")
    @DisplayName("uses the authenticated principal name as user id")
    void resolvesAuthenticatedUser() {
        CallerIdentity caller = resolver.resolve("ignored-session");

        assertThat(caller.isAuthenticated()).isTrue();
        assertThat(caller.user()).hasValueSatisfying(user -> assertThat(user.userId()).isEqualTo("alice"));
        assertThat(caller.sessionId()).isNull();
    }

    @Test
    @WithAnonymousUser
    @DisplayName("treats an anonymous token as an anonymous caller")
    void anonymousTokenIsAnonymous() {
        CallerIdentity caller = resolver.resolve("s-42");

        assertThat(caller.isAuthenticated()).isFalse();
        assertThat(caller.sessionId()).isEqualTo("s-42");
    }

    @Test
    @DisplayName("uses the supplied session id when nothing is authenticated")
    void noAuthenticationUsesSession() {
        SecurityContextHolder.clearContext();

        CallerIdentity caller = resolver.resolve("s-7");

        assertThat(caller.scope()).isEqualTo(AccessScope.session("s-7"));
    }

    @Test
    @DisplayName("generates a session id when none is supplied")
    void generatesSessionWhenMissing() {
        SecurityContextHolder.getContext().setAuthentication(new AnonymousAuthenticationToken(
                "key", "anonymousUser", AuthorityUtils.createAuthorityList("ROLE_ANONYMOUS")));

        CallerIdentity caller = resolver.resolve(null);

        assertThat(caller.isAuthenticated()).isFalse();
        assertThat(caller.sessionId()).isNotBlank();
    }
}
