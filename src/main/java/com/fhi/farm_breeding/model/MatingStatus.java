package com.fhi.farm_breeding.model;

public enum MatingStatus
{
    PLANNED,
    COMPLETED,
    FAILED,
    CANCELLED;

    /**
     * Statuses an outcome can be recorded with.
     */
    public boolean isOutcomeStatus()
    {   return this == COMPLETED || this == FAILED;
    }
}
