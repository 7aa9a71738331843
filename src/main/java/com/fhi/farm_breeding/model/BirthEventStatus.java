package com.fhi.farm_breeding.model;

public enum BirthEventStatus
{
    IN_PROGRESS,
    COMPLETED,
    PARTIAL_SUCCESS,
    FAILED
}
