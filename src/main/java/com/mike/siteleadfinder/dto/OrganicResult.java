package com.mike.siteleadfinder.dto;

public record OrganicResult(
        Integer position,
        String title,
        String link,
        String snippet
) {
}
