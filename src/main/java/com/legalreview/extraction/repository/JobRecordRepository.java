package com.legalreview.extraction.repository;

import com.legalreview.extraction.entity.JobRecord;
import com.legalreview.extraction.model.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface JobRecordRepository extends JpaRepository<JobRecord, String> {

    Optional<JobRecord> findFirstByStatusOrderByFinishedAtDesc(JobStatus status);
}
