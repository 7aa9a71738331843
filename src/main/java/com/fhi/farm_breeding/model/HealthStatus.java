package com.fhi.farm_breeding.model;

public enum HealthStatus
{
    EXCELLENT,
    GOOD,
    FAIR,
    POOR,
    CRITICAL
}
