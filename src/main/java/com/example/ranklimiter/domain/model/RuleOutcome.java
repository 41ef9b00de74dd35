package com.example.ranklimiter.domain.model;

public enum RuleOutcome {
    PASS,
    BREACH
}
