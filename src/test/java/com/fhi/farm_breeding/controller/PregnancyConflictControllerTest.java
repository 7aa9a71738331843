package com.fhi.farm_breeding.controller;

import static com.fhi.farm_breeding.support.TestHerd.GREEN_MEADOW;
import static com.fhi.farm_breeding.support.TestHerd.GREEN_MEADOW_OWNER;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doNothing;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fhi.farm_breeding.dto.MatingRequest;
import com.fhi.farm_breeding.dto.PregnancyRequest;
import com.fhi.farm_breeding.fixtures_fmwk.annotation.Fixtures;
import com.fhi.farm_breeding.fixtures_fmwk.springfixtureloader.annotation.SpringIntegrationTest;
import com.fhi.farm_breeding.model.Animal;
import com.fhi.farm_breeding.model.AnimalType;
import com.fhi.farm_breeding.model.Farm;
import com.fhi.farm_breeding.model.MatingEvent;
import com.fhi.farm_breeding.model.MatingType;
import com.fhi.farm_breeding.service.BreedingValidator;
import com.fhi.farm_breeding.service.MatingEventService;
import com.fhi.farm_breeding.support.TestHerd;


/**
 * Two registrations for the same dam that both got past the "not pregnant" check, as happens
 * when they run side by side. The database slot refuses the second one.
 */
@SpringIntegrationTest
@Fixtures({ AnimalType.class, Farm.class })
class PregnancyConflictControllerTest
{
    private static final LocalDate ADULT = LocalDate.of(2023, 3, 1);

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @Autowired
    TestHerd herd;

    @Autowired
    MatingEventService matingEventService;

    @SpyBean
    BreedingValidator validator;

    private Animal buck;
    private Animal doe;
    private MatingEvent mating;

    @BeforeEach
    void setUp()
    {
        Farm farm = herd.farm(GREEN_MEADOW);
        AnimalType rabbit = herd.type("Rabbit");
        buck = herd.male(farm, rabbit, "BUCK-1", ADULT);
        doe = herd.female(farm, rabbit, "DOE-1", ADULT);

        MatingRequest request = new MatingRequest();
        request.setSireId(buck.getId());
        request.setDamIds(List.of(doe.getId()));
        request.setMatingType(MatingType.NATURAL);
        request.setMatingDate(LocalDate.of(2025, 5, 1));
        mating = matingEventService.recordMating(request, GREEN_MEADOW_OWNER);

        doNothing().when(validator).requireNotPregnant(any());
    }

    private String pregnancyJson(LocalDate conceptionDate) throws Exception
    {
        PregnancyRequest request = new PregnancyRequest();
        request.setMatingEventId(mating.getId());
        request.setDamId(doe.getId());
        request.setSireId(buck.getId());
        request.setConceptionDate(conceptionDate);
        return objectMapper.writeValueAsString(request);
    }


    @DisplayName("POST /pregnancy: second active pregnancy of a dam -> 409 CONFLICT")
    @Test
    void createPregnancy_racingSecondRegistration_shouldReturnConflict() throws Exception
    {
        mockMvc.perform(post("/api/reproduction/pregnancy")
                            .header(ApiHeaders.USER_ID, GREEN_MEADOW_OWNER)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(pregnancyJson(LocalDate.of(2025, 5, 1))))
               .andExpect(status().isCreated());

        mockMvc.perform(post("/api/reproduction/pregnancy")
                            .header(ApiHeaders.USER_ID, GREEN_MEADOW_OWNER)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(pregnancyJson(LocalDate.of(2025, 5, 2))))
               .andExpect(status().isConflict())
               .andExpect(jsonPath("$.code").value("CONFLICT"))
               .andExpect(jsonPath("$.message").exists());
    }
}
