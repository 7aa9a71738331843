package com.fhi.farm_breeding.model;

import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One ancestor in a pedigree trace.
 * {@code lineage} is the path from the animal, e.g. "sire", "dam", "sire.dam", "dam.sire.sire".
 */
@Embeddable
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
public class PedigreeAncestor
{
    private Long ancestorId;

    private String lineage;

    private int generation;
}
