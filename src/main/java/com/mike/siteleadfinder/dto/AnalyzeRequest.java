package com.mike.siteleadfinder.dto;

public record AnalyzeRequest(String url) {
}
