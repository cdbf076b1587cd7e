package com.hydrokb.health;

public enum HealthStatus {
    EXCELLENT,
    HEALTHY,
    DEGRADED,
    CRITICAL
}
