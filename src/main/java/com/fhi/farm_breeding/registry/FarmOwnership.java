package com.fhi.farm_breeding.registry;

/**
 * Farm ownership check, answered by the farm management side.
 */
public interface FarmOwnership
{
    boolean isOwnedBy(Long farmId, Long userId);
}
