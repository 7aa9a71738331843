package com.fhi.farm_breeding.controller;

import static com.fhi.farm_breeding.support.TestHerd.GREEN_MEADOW;
import static com.fhi.farm_breeding.support.TestHerd.GREEN_MEADOW_OWNER;
import static com.fhi.farm_breeding.support.TestHerd.STONY_RIDGE_OWNER;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import java.time.LocalDate;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.web.servlet.MockMvc;

import com.fhi.farm_breeding.fixtures_fmwk.annotation.Fixtures;
import com.fhi.farm_breeding.fixtures_fmwk.springfixtureloader.annotation.SpringIntegrationTest;
import com.fhi.farm_breeding.model.Animal;
import com.fhi.farm_breeding.model.AnimalType;
import com.fhi.farm_breeding.model.Farm;
import com.fhi.farm_breeding.model.Gender;
import com.fhi.farm_breeding.support.TestHerd;

import lombok.extern.slf4j.Slf4j;


/**
 * Run with:
 * $ mvn clean test -Dtest=GeneticsControllerTest
 */
@SpringIntegrationTest
@Fixtures({ AnimalType.class, Farm.class })
@Slf4j
class GeneticsControllerTest
{
    private static final String USER = ApiHeaders.USER_ID;
    private static final LocalDate ADULT = LocalDate.of(2023, 3, 1);

    @Autowired
    MockMvc mockMvc;

    @Autowired
    TestHerd herd;

    private Farm farm;
    private Animal buck;
    private Animal doe;
    private Animal son;
    private Animal daughter;

    @BeforeEach
    void setUp()
    {
        farm = herd.farm(GREEN_MEADOW);
        AnimalType rabbit = herd.type("Rabbit");
        buck = herd.male(farm, rabbit, "BUCK-1", ADULT);
        doe = herd.female(farm, rabbit, "DOE-1", ADULT);
        son = herd.offspringOf(buck, doe, Gender.MALE, "SON-1", LocalDate.of(2024, 6, 1));
        daughter = herd.offspringOf(buck, doe, Gender.FEMALE, "DAUGHTER-1", LocalDate.of(2024, 6, 1));
    }


    @DisplayName("Profile of an adult founder")
    @Test
    void getProfile_shouldComputeOnDemand() throws Exception
    {
        String json = mockMvc.perform(get("/api/genetics/animal/{id}", buck.getId()).header(USER, GREEN_MEADOW_OWNER))
                             .andExpect(status().isOk())
                             .andExpect(jsonPath("$.animalId").value(buck.getId()))
                             .andExpect(jsonPath("$.gender").value("MALE"))
                             .andExpect(jsonPath("$.breedingProfile.eligibility").value("ELIGIBLE"))
                             .andExpect(jsonPath("$.inbreedingCoefficient").value(0.0))
                             .andReturn().getResponse().getContentAsString();
        log.info("Genetic profile:\n{}", json);

        mockMvc.perform(get("/api/genetics/animal/{id}", buck.getId()).header(USER, STONY_RIDGE_OWNER))
               .andExpect(status().isForbidden());
        mockMvc.perform(get("/api/genetics/animal/{id}", -1L).header(USER, GREEN_MEADOW_OWNER))
               .andExpect(status().isNotFound())
               .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void pedigree_shouldNestParents() throws Exception
    {
        mockMvc.perform(get("/api/genetics/animal/{id}/pedigree", son.getId())
                   .param("depth", "2")
                   .header(USER, GREEN_MEADOW_OWNER))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.animalId").value(son.getId()))
               .andExpect(jsonPath("$.sire.animalId").value(buck.getId()))
               .andExpect(jsonPath("$.dam.tagNumber").value("DOE-1"))
               .andExpect(jsonPath("$.sire.generation").value(1));
    }

    @Test
    void compatibility_ofSiblings_shouldAdviseAgainst() throws Exception
    {
        mockMvc.perform(get("/api/genetics/compatibility/{id1}/{id2}", son.getId(), daughter.getId())
                   .header(USER, GREEN_MEADOW_OWNER))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.canBreed").value(false))
               .andExpect(jsonPath("$.riskLevel").value("HIGH"))
               .andExpect(jsonPath("$.relationship").value("FULL_SIBLING"));

        mockMvc.perform(get("/api/genetics/compatibility/{id1}/{id2}", son.getId(), son.getId())
                   .header(USER, GREEN_MEADOW_OWNER))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void batchCompute_thenRankings() throws Exception
    {
        mockMvc.perform(post("/api/genetics/farm/{farmId}/batch-compute", farm.getId()).header(USER, GREEN_MEADOW_OWNER))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.totalAnimals").value(4))
               .andExpect(jsonPath("$.processed").value(4))
               .andExpect(jsonPath("$.failed").value(0));

        mockMvc.perform(get("/api/genetics/farm/{farmId}/top-breeders", farm.getId())
                   .param("limit", "2")
                   .header(USER, GREEN_MEADOW_OWNER))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.length()").value(2));

        mockMvc.perform(get("/api/genetics/farm/{farmId}/top-breeders", farm.getId())
                   .param("limit", "0")
                   .header(USER, GREEN_MEADOW_OWNER))
               .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/genetics/farm/{farmId}/pair-suggestions", farm.getId()).header(USER, GREEN_MEADOW_OWNER))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$[0].compatibilityScore").isNumber());
    }

    @Test
    void inbreedingRisk_ofSiblings_shouldDescribeTheKinship() throws Exception
    {
        mockMvc.perform(get("/api/genetics/inbreeding-risk/{id1}/{id2}", son.getId(), daughter.getId())
                   .header(USER, GREEN_MEADOW_OWNER))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.canBreed").value(false))
               .andExpect(jsonPath("$.riskLevel").value("HIGH"))
               .andExpect(jsonPath("$.risks[0].relationship").value("FULL_SIBLING"))
               .andExpect(jsonPath("$.risks[0].description").value("Full siblings (high risk)"))
               .andExpect(jsonPath("$.combinedInbreedingCoefficient").value(0.0))
               .andExpect(jsonPath("$.recommendations[0]").value("Avoid breeding - close relatives"));
    }

    @Test
    void pairSuggestions_shouldTakeCriteriaFromTheQuery() throws Exception
    {
        mockMvc.perform(post("/api/genetics/farm/{farmId}/batch-compute", farm.getId()).header(USER, GREEN_MEADOW_OWNER))
               .andExpect(status().isOk());

        mockMvc.perform(get("/api/genetics/farm/{farmId}/pair-suggestions", farm.getId())
                   .param("gender", "MALE")
                   .param("minCompatibility", "60")
                   .param("limit", "1")
                   .header(USER, GREEN_MEADOW_OWNER))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.length()").value(1))
               .andExpect(jsonPath("$[0].compatibilityScore").value(70));

        mockMvc.perform(get("/api/genetics/farm/{farmId}/pair-suggestions", farm.getId())
                   .param("minCompatibility", "71")
                   .header(USER, GREEN_MEADOW_OWNER))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.length()").value(0));

        mockMvc.perform(get("/api/genetics/farm/{farmId}/pair-suggestions", farm.getId())
                   .param("minCompatibility", "150")
                   .header(USER, GREEN_MEADOW_OWNER))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void dashboard_shouldCountStoredProfiles() throws Exception
    {
        mockMvc.perform(post("/api/genetics/farm/{farmId}/batch-compute", farm.getId()).header(USER, GREEN_MEADOW_OWNER))
               .andExpect(status().isOk());

        mockMvc.perform(get("/api/genetics/farm/{farmId}/dashboard", farm.getId()).header(USER, GREEN_MEADOW_OWNER))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.farmId").value(farm.getId()))
               .andExpect(jsonPath("$.totalProfiles").value(4))
               .andExpect(jsonPath("$.activeBreeders").value(4))
               .andExpect(jsonPath("$.inbreedingDistribution.lowRisk").value(4))
               .andExpect(jsonPath("$.geneticDiversityScore").value(100))
               .andExpect(jsonPath("$.recentRecommendations.length()").value(4));

        mockMvc.perform(get("/api/genetics/farm/{farmId}/dashboard", farm.getId()).header(USER, STONY_RIDGE_OWNER))
               .andExpect(status().isForbidden());
    }
}
