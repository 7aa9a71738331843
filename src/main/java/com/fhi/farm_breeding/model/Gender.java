package com.fhi.farm_breeding.model;

public enum Gender
{
    MALE,
    FEMALE,
    UNKNOWN
}
