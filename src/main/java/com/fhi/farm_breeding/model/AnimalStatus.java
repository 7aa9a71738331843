package com.fhi.farm_breeding.model;

/**
 * Lifecycle status of an animal in the registry.
 */
public enum AnimalStatus
{
    ALIVE,
    DECEASED,
    SOLD,
    TRANSFERRED,
    CULLED,
    ARCHIVED
}
