package com.fhi.farm_breeding.model;

public enum ConfirmationMethod
{
    VISUAL,
    PALPATION,
    ULTRASOUND,
    BLOOD_TEST,
    BEHAVIORAL,
    OTHER
}
