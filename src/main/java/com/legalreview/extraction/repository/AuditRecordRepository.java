package com.legalreview.extraction.repository;

import com.legalreview.extraction.entity.AuditRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface AuditRecordRepository extends JpaRepository<AuditRecord, Long> {

    List<AuditRecord> findByCellIdOrderBySequenceAsc(String cellId);

    Optional<AuditRecord> findFirstByCellIdOrderBySequenceDesc(String cellId);
}
