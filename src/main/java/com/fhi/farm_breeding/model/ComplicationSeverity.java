package com.fhi.farm_breeding.model;

public enum ComplicationSeverity
{
    MILD,
    MODERATE,
    SEVERE
}
