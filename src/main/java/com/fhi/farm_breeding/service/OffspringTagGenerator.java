package com.fhi.farm_breeding.service;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import org.springframework.stereotype.Service;

import com.fhi.farm_breeding.registry.AnimalRegistry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Tag numbers for farm-born offspring: {@code {speciesCode}{YY}{seq}}, e.g. {@code RAB25001}.
 *
 * <p>{@code seq} is one more than the highest sequence among the tags of the farm's animals born
 * in the same year that already follow the pattern, zero-padded to three digits. Gaps left by
 * removed animals are not reused. Uniqueness is finally enforced by the (farm, tag) unique
 * constraint of the registry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OffspringTagGenerator
{
    static final String UNKNOWN_SPECIES_CODE = "UNK";

    /**
     * Matched as substring of the lower-cased species name, in this order.
     */
    private static final Map<String, String> SPECIES_CODES = new LinkedHashMap<>();
    static
    {   SPECIES_CODES.put("rabbit",  "RAB");
        SPECIES_CODES.put("chicken", "CHK");
        SPECIES_CODES.put("cow",     "COW");
        SPECIES_CODES.put("goat",    "GOA");
        SPECIES_CODES.put("sheep",   "SHP");
        SPECIES_CODES.put("pig",     "PIG");
    }

    private final AnimalRegistry animalRegistry;


    public String generate(Long farmId, String speciesName, LocalDate birthDate)
    {
        String prefix = speciesCode(speciesName) + String.format("%02d", birthDate.getYear() % 100);
        Pattern tagPattern = Pattern.compile("^" + Pattern.quote(prefix) + "\\d{3}$");

        int highest = animalRegistry.findTagNumbersBornIn(farmId, birthDate.getYear(), prefix)
                                    .stream()
                                    .filter(tag -> tag != null && tagPattern.matcher(tag).matches())
                                    .mapToInt(tag -> Integer.parseInt(tag.substring(prefix.length())))
                                    .max()
                                    .orElse(0);
        String tag = prefix + String.format("%03d", highest + 1);
        log.debug("Generated tag {} on farm {} (highest sequence with prefix {} was {})", tag, farmId, prefix, highest);
        return tag;
    }

    /**
     * Code of a species: from the lookup table, else its first three letters upper-cased.
     * {@value #UNKNOWN_SPECIES_CODE} when the species is unknown.
     */
    public static String speciesCode(String speciesName)
    {
        if (speciesName == null || speciesName.isBlank()) return UNKNOWN_SPECIES_CODE;

        String lower = speciesName.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> entry : SPECIES_CODES.entrySet())
        {
            if (lower.contains(entry.getKey())) return entry.getValue();
        }

        String trimmed = speciesName.trim();
        return trimmed.substring(0, Math.min(3, trimmed.length())).toUpperCase(Locale.ROOT);
    }
}
