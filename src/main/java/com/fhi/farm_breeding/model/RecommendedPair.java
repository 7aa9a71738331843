package com.fhi.farm_breeding.model;

import java.util.ArrayList;
import java.util.List;

import com.fhi.farm_breeding.model.converter.StringListConverter;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Embeddable
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
public class RecommendedPair
{
    private Long partnerId;

    private int compatibilityScore;

    @Convert(converter = StringListConverter.class)
    @Column(length = 1000)
    private List<String> expectedBenefits = new ArrayList<>();

    @Convert(converter = StringListConverter.class)
    @Column(length = 1000)
    private List<String> warnings = new ArrayList<>();
}
