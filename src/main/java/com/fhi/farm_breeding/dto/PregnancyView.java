package com.fhi.farm_breeding.dto;

import java.time.LocalDate;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.fhi.farm_breeding.model.Pregnancy;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A pregnancy plus its gestation clock as of a given day.
 */
@Getter
@AllArgsConstructor
public class PregnancyView
{
    @JsonUnwrapped
    private final Pregnancy pregnancy;

    private final long daysPregnant;
    private final long daysRemaining;
    private final int gestationProgress;
    private final boolean overdue;

    public static PregnancyView of(Pregnancy pregnancy, LocalDate today, int progressingAfterDays)
    {   return new PregnancyView(pregnancy,
                                 pregnancy.daysPregnant(today),
                                 pregnancy.daysRemaining(today),
                                 pregnancy.gestationProgress(today),
                                 pregnancy.isOverdue(today, progressingAfterDays));
    }
}
