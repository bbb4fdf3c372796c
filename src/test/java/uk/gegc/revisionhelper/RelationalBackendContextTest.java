package uk.gegc.revisionhelper;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import uk.gegc.revisionhelper.features.revision.application.RevisionRunService;
import uk.gegc.revisionhelper.features.revision.application.StorageAdapterFactory;
import uk.gegc.revisionhelper.features.revision.domain.model.NewRevision;
import uk.gegc.revisionhelper.features.revision.domain.model.QuestionStyle;
import uk.gegc.revisionhelper.features.revision.domain.model.Revision;
import uk.gegc.revisionhelper.shared.security.AuthenticatedUser;
import uk.gegc.revisionhelper.shared.security.CallerIdentity;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "spring.datasource.url=jdbc:h2:mem:revision-context;DB_CLOSE_DELAY=-1")
@DisplayName("Application context with a datasource url")
class RelationalBackendContextTest {

    @Autowired
    private StorageAdapterFactory storageAdapterFactory;

    @Autowired
    private RevisionRunService revisionRunService;

    @Test
    @DisplayName("uses the relational backend")
    void usesRelationalBackend() {
        assertThat(storageAdapterFactory.backendName()).isEqualTo("database");
    }

    @Test
    @DisplayName("persists revisions per user")
    void persistsPerUser() {
        CallerIdentity caller = CallerIdentity.authenticated(AuthenticatedUser.of("context-user"));
        Revision revision = revisionRunService.createRevision(caller,
                NewRevision.of("Atoms", "Chemistry", null, 1, 80, QuestionStyle.FREE_TEXT));

        assertThat(revisionRunService.listRevisions(caller)).extracting(Revision::id).contains(revision.id());
        assertThat(revisionRunService.listRevisions(CallerIdentity.anonymous("someone"))).isEmpty();
    }
}
