package com.fhi.farm_breeding.model;

public enum DeathCause
{
    DISEASE,
    ACCIDENT,
    PREDATION,
    CONGENITAL,
    OTHER
}
