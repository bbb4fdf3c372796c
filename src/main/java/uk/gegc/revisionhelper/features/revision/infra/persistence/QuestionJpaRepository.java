package uk.gegc.revisionhelper.features.revision.infra.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface QuestionJpaRepository extends JpaRepository<QuestionEntity, String> {

    List<QuestionEntity> findAllByRunIdOrderByQuestionIndexAsc(String runId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM QuestionEntity q WHERE q.runId = :runId")
    int deleteAllByRunId(@Param("runId") String runId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            DELETE FROM QuestionEntity q
            WHERE q.runId IN (SELECT r.id FROM RunEntity r WHERE r.revisionId = :revisionId)
            """)
    int deleteAllByRevisionId(@Param("revisionId") String revisionId);
}
