package com.legalreview.extraction.repository;

import com.legalreview.extraction.entity.CellRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface CellRecordRepository extends JpaRepository<CellRecord, String> {

    List<CellRecord> findByJobIdOrderByPositionAsc(String jobId);

    long countByJobId(String jobId);
}
