package com.fhi.farm_breeding.dto;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of recomputing every alive animal's profile on a farm.
 * Only the first few failures are listed; {@code failed} counts all of them.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchComputeResult
{
    private Long farmId;
    private int totalAnimals;
    private int processed;
    private int failed;
    private List<AnimalError> errors;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AnimalError
    {
        private Long animalId;
        private String error;
    }
}
