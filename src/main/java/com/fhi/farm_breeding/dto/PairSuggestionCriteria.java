package com.fhi.farm_breeding.dto;

import com.fhi.farm_breeding.model.Gender;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Filters for farm pair suggestions. Null fields fall back to the configured defaults
 * or do not filter.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PairSuggestionCriteria
{
    private Long animalTypeId;

    /**
     * When set, each breeder of this sex appears in at most one suggestion, with its best partner.
     */
    private Gender gender;

    /**
     * 0 to 100.
     */
    private Integer minCompatibility;

    private Integer limit;


    public static PairSuggestionCriteria defaults()
    {   return new PairSuggestionCriteria();
    }

    public static PairSuggestionCriteria forAnimalType(Long animalTypeId)
    {   return new PairSuggestionCriteria(animalTypeId, null, null, null);
    }
}
