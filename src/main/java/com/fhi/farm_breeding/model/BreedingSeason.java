package com.fhi.farm_breeding.model;

public enum BreedingSeason
{
    YEAR_ROUND,
    SEASONAL,
    SPRING,
    SUMMER,
    AUTUMN,
    WINTER,
    UNKNOWN
}
