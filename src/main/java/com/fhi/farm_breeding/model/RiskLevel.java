package com.fhi.farm_breeding.model;

public enum RiskLevel
{
    LOW,
    MEDIUM,
    HIGH
}
