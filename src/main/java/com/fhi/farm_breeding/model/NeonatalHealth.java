package com.fhi.farm_breeding.model;

public enum NeonatalHealth
{
    HEALTHY,
    WEAK,
    SICK,
    CRITICAL
}
