package com.mike.siteleadfinder.repository;

import com.mike.siteleadfinder.entity.AuditRequest;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AuditRequestRepository extends JpaRepository<AuditRequest, Long> {
}
