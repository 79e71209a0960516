package com.example.backup.infrastructure.persistence.jpa;

import com.example.backup.domain.entity.RestoreRun;
import com.example.backup.domain.model.RestoreState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RestoreRunJpaRepository extends JpaRepository<RestoreRun, String> {

    Optional<RestoreRun> findFirstByStoreNameAndStateOrderByFinishedAtDesc(String storeName, RestoreState state);

    List<RestoreRun> findByStoreNameOrderByStartedAtDesc(String storeName);
}
