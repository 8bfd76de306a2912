package com.khaounen.health.risk;

public enum SeverityLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
