package com.fhi.farm_breeding.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Embeddable
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
public class AvoidPair
{
    private Long partnerId;

    @Column(length = 500)
    private String reason;

    @Enumerated(EnumType.STRING)
    private RiskLevel severity;
}
