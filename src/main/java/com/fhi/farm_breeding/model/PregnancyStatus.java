package com.fhi.farm_breeding.model;

import java.util.EnumSet;
import java.util.Set;

public enum PregnancyStatus
{
    CONFIRMED,
    PROGRESSING,
    DELIVERED,
    ABORTED,
    FAILED;

    public static final Set<PregnancyStatus> ACTIVE = EnumSet.of(CONFIRMED, PROGRESSING);

    public boolean isActive()
    {   return ACTIVE.contains(this);
    }
}
