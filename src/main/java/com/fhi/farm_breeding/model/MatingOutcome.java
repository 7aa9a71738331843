package com.fhi.farm_breeding.model;

public enum MatingOutcome
{
    SUCCESSFUL,
    UNSUCCESSFUL,
    UNKNOWN
}
