package com.fhi.farm_breeding.model;

/**
 * Female reproductive state. Null on males and on animals never assessed.
 */
public enum ReproductiveStatus
{
    IMMATURE,
    OPEN,
    PREGNANT,
    LACTATING,
    DRY,
    INFERTILE
}
