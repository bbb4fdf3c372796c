package uk.gegc.revisionhelper.features.revision.infra.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RevisionJpaRepository extends JpaRepository<RevisionEntity, String> {

    List<RevisionEntity> findAllByUserIdOrderByCreatedAtAsc(String userId);

    List<RevisionEntity> findAllBySessionIdOrderByCreatedAtAsc(String sessionId);

    Optional<RevisionEntity> findByIdAndUserId(String id, String userId);

    Optional<RevisionEntity> findByIdAndSessionId(String id, String sessionId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM RevisionEntity r WHERE r.id = :id")
    int deleteRevisionById(@Param("id") String id);
}
