package com.fhi.farm_breeding.model;

import org.hibernate.annotations.NaturalId;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;


@Entity
@Table(name = "animal_type")
@Getter
@Setter
public class AnimalType
{
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Species name, e.g. "Rabbit", "Cow". Used for offspring tag codes and names.
     */
    @NotNull
    @NaturalId
    @Column(nullable = false, unique = true)
    private String name;

    /**
     * Feature flag: mating, pregnancy and birth records are accepted for animals of this type.
     */
    private boolean reproductionEnabled = false;

    /**
     * Feature flag: genetic profiles are computed for animals of this type.
     */
    private boolean geneticsEnabled = false;

    @Embedded  // inlined into the animal_type table
    private GeneticsSettings geneticsSettings = new GeneticsSettings();

    @Override
    public String toString()
    {   return name;
    }
}
