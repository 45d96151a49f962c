package com.emtech.scan.model;

public enum MatchMode {
    EXACT,
    CASE_INSENSITIVE,
    FUZZY,
    REGEX
}
