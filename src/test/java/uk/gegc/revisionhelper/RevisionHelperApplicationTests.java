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
import uk.gegc.revisionhelper.features.revision.domain.model.Run;
import uk.gegc.revisionhelper.shared.config.RevisionProperties;
import uk.gegc.revisionhelper.shared.security.CallerIdentity;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@DisplayName("Application context without a datasource url")
class RevisionHelperApplicationTests {

    @Autowired
    private StorageAdapterFactory storageAdapterFactory;

    @Autowired
    private RevisionProperties properties;

    @Autowired
    private RevisionRunService revisionRunService;

    @Test
    @DisplayName("falls back to the in-process backend and binds revision properties")
    void usesInMemoryBackend() {
        assertThat(storageAdapterFactory.backendName()).isEqualTo("in-memory");
        assertThat(properties.getDefaultQuestionCount()).isEqualTo(2);
        assertThat(properties.getDefaultAccuracyThreshold()).isEqualTo(80);
    }

    @Test
    @DisplayName("runs a revision end to end")
    void endToEnd() {
        CallerIdentity caller = CallerIdentity.anonymous("context-session");
        Revision revision = revisionRunService.createRevision(caller,
                NewRevision.of("Sums", "Maths", null, 2, 50, QuestionStyle.FREE_TEXT));

        Run run = revisionRunService.startRun(caller, revision.id(), "- What is 1 + 1?\n- What is 2 + 2?");
        revisionRunService.submitAnswer(caller, run.id(), run.id() + "-q1", "2",
                "{\"score\": \"Full Marks\", \"correct_answer\": \"2\"}");

        assertThat(revisionRunService.nextQuestion(caller, run.id()))
                .hasValueSatisfying(question -> assertThat(question.text()).isEqualTo("What is 2 + 2?"));
        assertThat(revisionRunService.summary(caller, run.id()).thresholdMet()).isTrue();
    }
}
