package com.mike.siteleadfinder.repository;

import com.mike.siteleadfinder.entity.AnalysisRecord;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AnalysisRecordRepository extends JpaRepository<AnalysisRecord, Long> {
}
