package uk.gegc.revisionhelper.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.revisionhelper.features.revision.infra.mapping.RevisionEntityMapper;
import uk.gegc.revisionhelper.features.revision.infra.persistence.AnswerJpaRepository;
import uk.gegc.revisionhelper.features.revision.infra.persistence.QuestionJpaRepository;
import uk.gegc.revisionhelper.features.revision.infra.persistence.RevisionJpaRepository;
import uk.gegc.revisionhelper.features.revision.infra.persistence.RunJpaRepository;
import uk.gegc.revisionhelper.features.revision.infra.persistence.UserAccountJpaRepository;
import uk.gegc.revisionhelper.features.revision.infra.storage.InMemoryStorageBackend;
import uk.gegc.revisionhelper.features.revision.infra.storage.JpaStorageBackend;
import uk.gegc.revisionhelper.features.revision.infra.storage.StorageBackend;

/**
 * Chooses the storage backend. A configured {@code spring.datasource.url} selects the
 * relational backend; without one the in-process backend is used and nothing fails.
 */
@Configuration
@Slf4j
public class StorageBackendConfig {

    @Bean
    @ConditionalOnProperty(prefix = "spring.datasource", name = "url")
    public StorageBackend jpaStorageBackend(UserAccountJpaRepository userAccountRepository,
                                            RevisionJpaRepository revisionRepository,
                                            RunJpaRepository runRepository,
                                            QuestionJpaRepository questionRepository,
                                            AnswerJpaRepository answerRepository,
                                            RevisionEntityMapper mapper) {
        log.info("Using relational storage backend");
        return new JpaStorageBackend(userAccountRepository, revisionRepository, runRepository,
                questionRepository, answerRepository, mapper);
    }

    @Bean
    @ConditionalOnMissingBean(StorageBackend.class)
    public StorageBackend inMemoryStorageBackend() {
        log.info("No datasource configured, using in-process storage backend");
        return new InMemoryStorageBackend();
    }
}
