package com.fhi.farm_breeding.controller;

import static com.fhi.farm_breeding.support.TestHerd.GREEN_MEADOW;
import static com.fhi.farm_breeding.support.TestHerd.GREEN_MEADOW_OWNER;
import static com.fhi.farm_breeding.support.TestHerd.STONY_RIDGE_OWNER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fhi.farm_breeding.dto.MatingOutcomeRequest;
import com.fhi.farm_breeding.dto.MatingRequest;
import com.fhi.farm_breeding.fixtures_fmwk.annotation.Fixtures;
import com.fhi.farm_breeding.fixtures_fmwk.springfixtureloader.annotation.SpringIntegrationTest;
import com.fhi.farm_breeding.model.Animal;
import com.fhi.farm_breeding.model.AnimalType;
import com.fhi.farm_breeding.model.Farm;
import com.fhi.farm_breeding.model.MatingOutcome;
import com.fhi.farm_breeding.model.MatingStatus;
import com.fhi.farm_breeding.model.MatingType;
import com.fhi.farm_breeding.support.TestHerd;

import lombok.extern.slf4j.Slf4j;


/**
 * Run with:
 * $ mvn clean test -Dtest=MatingControllerTest
 */
@SpringIntegrationTest
@Fixtures({ AnimalType.class, Farm.class })
@Slf4j
class MatingControllerTest
{
    private static final String USER = ApiHeaders.USER_ID;
    private static final LocalDate ADULT = LocalDate.of(2023, 3, 1);

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @Autowired
    TestHerd herd;

    private Farm farm;
    private Animal buck;
    private Animal doe;

    @BeforeEach
    void setUp()
    {
        farm = herd.farm(GREEN_MEADOW);
        AnimalType rabbit = herd.type("Rabbit");
        buck = herd.male(farm, rabbit, "BUCK-1", ADULT);
        doe = herd.female(farm, rabbit, "DOE-1", ADULT);
    }

    private String matingJson(Animal sire, Animal dam) throws Exception
    {
        MatingRequest request = new MatingRequest();
        request.setSireId(sire.getId());
        request.setDamIds(List.of(dam.getId()));
        request.setMatingType(MatingType.NATURAL);
        request.setMatingDate(LocalDate.of(2025, 5, 1));
        return objectMapper.writeValueAsString(request);
    }

    private long createMating() throws Exception
    {
        String json = mockMvc.perform(post("/api/reproduction/mating")
                                 .header(USER, GREEN_MEADOW_OWNER)
                                 .contentType(MediaType.APPLICATION_JSON)
                                 .content(matingJson(buck, doe)))
                             .andExpect(status().isCreated())
                             .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(json).get("id").asLong();
    }


    @DisplayName("Record a mating via POST and read it back")
    @Test
    void recordMating_shouldReturnCreated() throws Exception
    {
        long id = createMating();

        mockMvc.perform(get("/api/reproduction/mating/{id}", id).header(USER, GREEN_MEADOW_OWNER))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.status").value("PLANNED"))
               .andExpect(jsonPath("$.sireId").value(buck.getId()))
               .andExpect(jsonPath("$.damIds[0]").value(doe.getId()))
               .andExpect(jsonPath("$.matingDate").value("2025-05-01"));
    }

    @Test
    void recordMating_withoutCaller_shouldBeUnauthorized() throws Exception
    {
        mockMvc.perform(post("/api/reproduction/mating")
                   .contentType(MediaType.APPLICATION_JSON)
                   .content(matingJson(buck, doe)))
               .andExpect(status().isUnauthorized())
               .andExpect(jsonPath("$.code").value("UNAUTHENTICATED"));
    }

    @Test
    void recordMating_onSomeoneElsesFarm_shouldBeForbidden() throws Exception
    {
        mockMvc.perform(post("/api/reproduction/mating")
                   .header(USER, STONY_RIDGE_OWNER)
                   .contentType(MediaType.APPLICATION_JSON)
                   .content(matingJson(buck, doe)))
               .andExpect(status().isForbidden())
               .andExpect(jsonPath("$.code").value("PERMISSION_DENIED"));
    }

    @Test
    void recordMating_withSwappedRoles_shouldBeUnprocessable() throws Exception
    {
        mockMvc.perform(post("/api/reproduction/mating")
                   .header(USER, GREEN_MEADOW_OWNER)
                   .contentType(MediaType.APPLICATION_JSON)
                   .content(matingJson(doe, buck)))
               .andExpect(status().isUnprocessableEntity())
               .andExpect(jsonPath("$.code").value("INVALID_SEX"));
    }

    @Test
    void recordMating_withoutDams_shouldBeBadRequest() throws Exception
    {
        String json = "{ \"sireId\": " + buck.getId() + ", \"damIds\": [], \"matingType\": \"natural\", \"matingDate\": \"2025-05-01\" }";

        mockMvc.perform(post("/api/reproduction/mating")
                   .header(USER, GREEN_MEADOW_OWNER)
                   .contentType(MediaType.APPLICATION_JSON)
                   .content(json))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void recordMating_forPregnantDam_shouldConflict() throws Exception
    {
        long id = createMating();
        MatingOutcomeRequest outcome = new MatingOutcomeRequest();
        outcome.setStatus(MatingStatus.COMPLETED);
        outcome.setOutcome(MatingOutcome.SUCCESSFUL);

        mockMvc.perform(patch("/api/reproduction/mating/{id}/outcome", id)
                   .header(USER, GREEN_MEADOW_OWNER)
                   .contentType(MediaType.APPLICATION_JSON)
                   .content(objectMapper.writeValueAsString(outcome)))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.status").value("COMPLETED"));

        mockMvc.perform(post("/api/reproduction/mating")
                   .header(USER, GREEN_MEADOW_OWNER)
                   .contentType(MediaType.APPLICATION_JSON)
                   .content(matingJson(buck, doe)))
               .andExpect(status().isConflict())
               .andExpect(jsonPath("$.code").value("ALREADY_PREGNANT"));

        mockMvc.perform(delete("/api/reproduction/mating/{id}", id).header(USER, GREEN_MEADOW_OWNER))
               .andExpect(status().isConflict());
    }

    @Test
    void cancelAndDelete_shouldFollowTheLifecycle() throws Exception
    {
        long id = createMating();

        mockMvc.perform(patch("/api/reproduction/mating/{id}/cancel", id).header(USER, GREEN_MEADOW_OWNER))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.status").value("CANCELLED"));
        mockMvc.perform(patch("/api/reproduction/mating/{id}/cancel", id).header(USER, GREEN_MEADOW_OWNER))
               .andExpect(status().isConflict())
               .andExpect(jsonPath("$.code").value("INVALID_TRANSITION"));

        mockMvc.perform(delete("/api/reproduction/mating/{id}", id).header(USER, GREEN_MEADOW_OWNER))
               .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/reproduction/mating/{id}", id).header(USER, GREEN_MEADOW_OWNER))
               .andExpect(status().isNotFound());
    }

    @Test
    void listAndStatistics_shouldReflectTheFarm() throws Exception
    {
        createMating();

        mockMvc.perform(get("/api/reproduction/mating/farm/{farmId}", farm.getId())
                   .param("status", "PLANNED")
                   .header(USER, GREEN_MEADOW_OWNER))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.length()").value(1));

        mockMvc.perform(get("/api/reproduction/mating/animal/{animalId}", doe.getId())
                   .param("role", "uncle")
                   .header(USER, GREEN_MEADOW_OWNER))
               .andExpect(status().isBadRequest());

        String json = mockMvc.perform(get("/api/reproduction/mating/farm/{farmId}/statistics", farm.getId())
                                 .header(USER, GREEN_MEADOW_OWNER))
                             .andExpect(status().isOk())
                             .andReturn().getResponse().getContentAsString();
        log.info("Mating statistics:\n{}", json);

        JsonNode statistics = objectMapper.readTree(json);
        assertThat(statistics.get("totalMatings").asInt()).isEqualTo(1);
        assertThat(statistics.get("successRate").asDouble()).isZero();
    }
}
