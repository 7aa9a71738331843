package com.fhi.farm_breeding.dto;

import java.util.List;

import com.fhi.farm_breeding.model.BirthEvent;
import com.fhi.farm_breeding.model.BreedingStatus;
import com.fhi.farm_breeding.model.Gender;
import com.fhi.farm_breeding.model.MatingEvent;
import com.fhi.farm_breeding.model.ReproductiveStatus;

import jakarta.annotation.Nullable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reproduction history of one animal. Females carry {@code femaleRecord}, males {@code maleRecord};
 * an animal of unknown sex has neither. Listings hold the latest ten entries, most recent first,
 * while the totals count everything.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnimalReproductionSummary
{
    private Long animalId;
    private String tagNumber;
    private String name;
    private Gender gender;
    private String breed;
    private ReproductiveStatus reproductiveStatus;
    private BreedingStatus breedingStatus;

    @Nullable
    private FemaleRecord femaleRecord;

    @Nullable
    private MaleRecord maleRecord;


    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FemaleRecord
    {
        private List<PregnancyView> pregnancies;
        private List<BirthEvent> births;
        private List<OffspringTrackingView> offspring;
        private int totalPregnancies;
        private int totalBirths;
        private int totalOffspring;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MaleRecord
    {
        private List<MatingEvent> matings;
        private List<OffspringTrackingView> offspring;
        private int totalMatings;
        private int totalOffspring;

        /**
         * Successful outcomes over completed matings as sire, in percent.
         */
        private double successRate;
    }
}
