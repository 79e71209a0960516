package com.example.backup.infrastructure.persistence.jpa;

import com.example.backup.domain.entity.BackupArtifact;
import com.example.backup.domain.model.ArtifactType;
import com.example.backup.domain.model.TrustState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface BackupArtifactJpaRepository extends JpaRepository<BackupArtifact, String> {

    /**
     * 스토어별 아티팩트 (최신 marker 순)
     */
    List<BackupArtifact> findByStoreNameOrderByConsistencyMarkerDescCompletedAtDescArtifactIdDesc(String storeName);

    /**
     * 복구 베이스 후보 (타입 + 신뢰 상태)
     */
    List<BackupArtifact> findByStoreNameAndArtifactTypeAndTrustStateIn(
            String storeName, ArtifactType artifactType, Collection<TrustState> trustStates);

    /**
     * 검증 대기 아티팩트 (오래된 순)
     */
    List<BackupArtifact> findByTrustStateOrderByStartedAtAsc(TrustState trustState);

    List<BackupArtifact> findByParentArtifactId(String parentArtifactId);

    /**
     * 보존 기간이 지난 아티팩트 (정리용)
     */
    @Query("SELECT a FROM BackupArtifact a WHERE a.artifactType = :type AND a.startedAt < :before ORDER BY a.startedAt ASC")
    List<BackupArtifact> findExpired(@Param("type") ArtifactType type, @Param("before") Instant before);

    long countByTrustState(TrustState trustState);
}
