package com.fhi.farm_breeding.dto;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PairSuggestion
{
    private Long sireId;
    private Long damId;
    private int compatibilityScore;
    private List<String> expectedBenefits;
    private List<String> warnings;
}
