package com.mike.siteleadfinder.entity;

public enum AnalysisMode {
    SITE, LEAD
}
