package com.fhi.farm_breeding.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.fhi.farm_breeding.registry.AnimalRegistry;

class OffspringTagGeneratorTest
{
    private final AnimalRegistry animalRegistry = mock(AnimalRegistry.class);
    private final OffspringTagGenerator generator = new OffspringTagGenerator(animalRegistry);

    @Test
    void speciesCode_shouldUseLookupTableBySubstring()
    {
        assertThat(OffspringTagGenerator.speciesCode("Rabbit")).isEqualTo("RAB");
        assertThat(OffspringTagGenerator.speciesCode("Dairy Cow")).isEqualTo("COW");
        assertThat(OffspringTagGenerator.speciesCode("PYGMY GOAT")).isEqualTo("GOA");
        assertThat(OffspringTagGenerator.speciesCode("Guinea pig")).isEqualTo("PIG");
    }

    @Test
    void speciesCode_shouldFallBackToFirstLettersOrUnknown()
    {
        assertThat(OffspringTagGenerator.speciesCode("Llama")).isEqualTo("LLA");
        assertThat(OffspringTagGenerator.speciesCode(" ox ")).isEqualTo("OX");
        assertThat(OffspringTagGenerator.speciesCode(null)).isEqualTo("UNK");
        assertThat(OffspringTagGenerator.speciesCode("  ")).isEqualTo("UNK");
    }

    @DisplayName("First rabbit of 2025 gets RAB25001")
    @Test
    void generate_shouldStartAtOne()
    {
        when(animalRegistry.findTagNumbersBornIn(1L, 2025, "RAB25")).thenReturn(List.of());

        assertThat(generator.generate(1L, "Rabbit", LocalDate.of(2025, 4, 2))).isEqualTo("RAB25001");
    }

    @DisplayName("Only tags following the exact pattern count towards the sequence")
    @Test
    void generate_shouldCountMatchingTagsOnly()
    {
        when(animalRegistry.findTagNumbersBornIn(1L, 2025, "RAB25"))
            .thenReturn(List.of("RAB25001", "RAB25002", "RAB25-X", "RAB250001"));

        assertThat(generator.generate(1L, "Rabbit", LocalDate.of(2025, 9, 30))).isEqualTo("RAB25003");
    }

    @DisplayName("A gap left by a removed animal is not reused: RAB25001 gone, RAB25003 present gives RAB25004")
    @Test
    void generate_shouldContinueAfterTheHighestSequence()
    {
        when(animalRegistry.findTagNumbersBornIn(1L, 2025, "RAB25")).thenReturn(List.of("RAB25003", "RAB25002"));

        assertThat(generator.generate(1L, "Rabbit", LocalDate.of(2025, 7, 1))).isEqualTo("RAB25004");
    }

    @Test
    void generate_shouldUseTwoDigitYear()
    {
        when(animalRegistry.findTagNumbersBornIn(7L, 2009, "SHP09")).thenReturn(List.of("SHP09001"));

        assertThat(generator.generate(7L, "Sheep", LocalDate.of(2009, 1, 15))).isEqualTo("SHP09002");
    }
}
