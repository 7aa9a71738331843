package com.fhi.farm_breeding.model;

public enum BreedingEligibility
{
    ELIGIBLE,
    RESTRICTED,
    INELIGIBLE
}
