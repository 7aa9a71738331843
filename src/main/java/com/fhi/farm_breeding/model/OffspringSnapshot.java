package com.fhi.farm_breeding.model;

import java.time.LocalDate;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.Getter;
import lombok.Setter;

/**
 * Copy of the offspring's registry identity, kept on the tracking record for listings.
 */
@Embeddable
@Getter @Setter
public class OffspringSnapshot
{
    @Column(name = "offspring_tag_number")
    private String tagNumber;

    @Column(name = "offspring_name")
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "offspring_gender")
    private Gender gender;

    @Column(name = "offspring_breed")
    private String breed;

    @Column(name = "offspring_date_of_birth")
    private LocalDate dateOfBirth;

    public static OffspringSnapshot of(Animal animal)
    {
        OffspringSnapshot snapshot = new OffspringSnapshot();
        snapshot.tagNumber = animal.getTagNumber();
        snapshot.name = animal.getName();
        snapshot.gender = animal.getGender();
        snapshot.breed = animal.getBreed();
        snapshot.dateOfBirth = animal.getDateOfBirth();
        return snapshot;
    }
}
