package uk.gegc.revisionhelper.features.revision.infra.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RunJpaRepository extends JpaRepository<RunEntity, String> {

    Optional<RunEntity> findByIdAndUserId(String id, String userId);

    Optional<RunEntity> findByIdAndSessionId(String id, String sessionId);

    /**
     * Locks the run row so concurrent answer submissions number their answers one at a time.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM RunEntity r WHERE r.id = :id")
    Optional<RunEntity> findByIdForUpdate(@Param("id") String id);

    List<RunEntity> findAllByUserIdOrderByCreatedAtDesc(String userId);

    List<RunEntity> findAllBySessionIdOrderByCreatedAtDesc(String sessionId);

    List<RunEntity> findAllByRevisionIdAndUserIdOrderByCreatedAtDesc(String revisionId, String userId);

    List<RunEntity> findAllByRevisionIdAndSessionIdOrderByCreatedAtDesc(String revisionId, String sessionId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM RunEntity r WHERE r.revisionId = :revisionId")
    int deleteAllByRevisionId(@Param("revisionId") String revisionId);
}
