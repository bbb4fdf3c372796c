package uk.gegc.revisionhelper.features.revision.infra.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AnswerJpaRepository extends JpaRepository<AnswerEntity, String> {

    List<AnswerEntity> findAllByRunIdOrderByAnswerIndexAscAnsweredAtAscIdAsc(String runId);

    long countByRunId(String runId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            DELETE FROM AnswerEntity a
            WHERE a.runId IN (SELECT r.id FROM RunEntity r WHERE r.revisionId = :revisionId)
            """)
    int deleteAllByRevisionId(@Param("revisionId") String revisionId);
}
