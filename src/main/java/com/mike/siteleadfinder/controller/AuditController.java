package com.mike.siteleadfinder.controller;

import com.mike.siteleadfinder.dto.AuditRequestDto;
import com.mike.siteleadfinder.entity.AuditRequest;
import com.mike.siteleadfinder.repository.AuditRequestRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/audit")
public class AuditController {

    private final AuditRequestRepository auditRequestRepository;

    @PostMapping
    public ResponseEntity<Map<String, String>> submitAudit(@RequestBody AuditRequestDto request) {
        if (request == null || isBlank(request.website()) && isBlank(request.email()) && isBlank(request.phone())) {
            throw new IllegalArgumentException("An audit request needs a website, email or phone");
        }

        AuditRequest entity = AuditRequest.builder()
                .business(request.business())
                .website(request.website())
                .email(request.email())
                .phone(request.phone())
                .industry(request.industry())
                .status(AuditRequest.STATUS_NEW)
                .createdAt(LocalDateTime.now())
                .build();

        auditRequestRepository.save(entity);
        log.info("AuditController: new audit request from business='{}'",
                isBlank(request.business()) ? "unknown" : request.business());

        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
