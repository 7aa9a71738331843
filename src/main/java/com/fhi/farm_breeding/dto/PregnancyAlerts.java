package com.fhi.farm_breeding.dto;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class PregnancyAlerts
{
    private final Long farmId;
    private final List<PregnancyView> dueSoon;
    private final List<PregnancyView> overdue;
    private final List<PregnancyView> withComplications;

    public int getTotal()
    {   return dueSoon.size() + overdue.size() + withComplications.size();
    }
}
