package com.fhi.farm_breeding.model;

/**
 * Why a pregnancy ended without a delivery.
 */
public enum TerminationReason
{
    NATURAL,
    MEDICAL,
    ACCIDENT,
    UNKNOWN
}
