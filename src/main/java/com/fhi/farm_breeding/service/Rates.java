package com.fhi.farm_breeding.service;

/**
 * Rounding shared by the farm statistics: rates in percent and averages, one decimal.
 */
final class Rates
{
    private Rates()
    {
    }

    /**
     * {@code part / whole} in percent, 0 when {@code whole} is 0.
     */
    static double percent(long part, long whole)
    {   return whole == 0 ? 0.0 : Math.round(part * 1000.0 / whole) / 10.0;
    }

    static double average(double total, long count)
    {   return count == 0 ? 0.0 : Math.round(total * 10.0 / count) / 10.0;
    }
}
