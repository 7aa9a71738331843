package com.fhi.farm_breeding.dto;

import java.time.LocalDate;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.fhi.farm_breeding.model.OffspringTracking;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class OffspringTrackingView
{
    @JsonUnwrapped
    private final OffspringTracking tracking;

    private final Double currentWeightKg;
    private final long ageInDays;

    public static OffspringTrackingView of(OffspringTracking tracking, LocalDate today)
    {   return new OffspringTrackingView(tracking,
                                         tracking.getCurrentWeightKg().orElse(null),
                                         tracking.ageInDays(today));
    }
}
