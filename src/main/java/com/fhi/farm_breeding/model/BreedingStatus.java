package com.fhi.farm_breeding.model;

public enum BreedingStatus
{
    ACTIVE,
    RETIRED,
    INFERTILE
}
