package com.mike.siteleadfinder.dto;

public record AuditRequestDto(
        String business,
        String website,
        String email,
        String phone,
        String industry
) {
}
