package com.example.backup.infrastructure.persistence.jpa;

import com.example.backup.domain.entity.ValidationReport;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface ValidationReportJpaRepository extends JpaRepository<ValidationReport, String> {

    List<ValidationReport> findByArtifactIdOrderByCreatedAtDesc(String artifactId);

    List<ValidationReport> findByCreatedAtBefore(Instant before);

    List<ValidationReport> findByArtifactId(String artifactId);
}
