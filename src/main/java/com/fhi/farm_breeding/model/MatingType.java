package com.fhi.farm_breeding.model;

public enum MatingType
{
    NATURAL,
    ARTIFICIAL_INSEMINATION,
    HAND_MATING,
    PASTURE_MATING
}
