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
public class KnownRelative
{
    private Long relativeId;

    @Enumerated(EnumType.STRING)
    private Relationship relationship;

    @Column(name = "relatedness")
    private double coefficient;

    public static KnownRelative of(Long relativeId, Relationship relationship)
    {   return new KnownRelative(relativeId, relationship, relationship.getCoefficient());
    }
}
