package com.fhi.farm_breeding.dto;

import java.time.LocalDate;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fhi.farm_breeding.model.Gender;

import lombok.Data;

/**
 * One animal in a pedigree tree, with its parents nested up to the requested depth.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PedigreeNode
{
    private Long animalId;
    private String tagNumber;
    private String name;
    private Gender gender;
    private String breed;
    private LocalDate dateOfBirth;
    private int generation;

    private PedigreeNode sire;
    private PedigreeNode dam;

    /**
     * Set when the parent link points back into this branch; the branch is cut there.
     */
    private Boolean cyclic;
}
