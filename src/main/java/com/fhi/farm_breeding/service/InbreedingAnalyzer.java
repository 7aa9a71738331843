package com.fhi.farm_breeding.service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.fhi.farm_breeding.model.Animal;
import com.fhi.farm_breeding.model.KnownRelative;
import com.fhi.farm_breeding.model.Relationship;
import com.fhi.farm_breeding.registry.AnimalRegistry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Close relatives of an animal and its inbreeding coefficient, both derived from the registry's
 * sire and dam links.
 *
 * <p>Relatives considered: parents, the parents' own parents, full and half siblings, offspring
 * and grandchildren. Aunts, uncles and cousins are not traced.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InbreedingAnalyzer
{
    /**
     * Generations walked up from each parent when looking for common ancestors.
     */
    static final int ANCESTOR_DEPTH = 2;

    private final AnimalRegistry animalRegistry;


    /**
     * Relatives in order of closeness; an animal reachable by several paths is listed once,
     * under the first (closest) relationship found.
     */
    public List<KnownRelative> findCloseRelatives(Animal animal)
    {
        Map<Long, KnownRelative> relatives = new LinkedHashMap<>();

        List<Animal> parents = new ArrayList<>();
        findAnimal(animal.getSireId()).ifPresent(parents::add);
        findAnimal(animal.getDamId()).ifPresent(parents::add);
        parents.forEach(parent -> add(relatives, animal, parent.getId(), Relationship.PARENT));

        for (Animal parent : parents)
        {   add(relatives, animal, parent.getSireId(), Relationship.GRANDPARENT);
            add(relatives, animal, parent.getDamId(), Relationship.GRANDPARENT);
        }

        List<Animal> halfSiblings = new ArrayList<>();
        for (Animal sibling : findSiblings(animal))
        {
            if (isFullSibling(animal, sibling)) add(relatives, animal, sibling.getId(), Relationship.FULL_SIBLING);
            else                                halfSiblings.add(sibling);
        }
        halfSiblings.forEach(sibling -> add(relatives, animal, sibling.getId(), Relationship.HALF_SIBLING));

        List<Animal> offspring = animalRegistry.findChildrenOf(animal.getId());
        offspring.forEach(child -> add(relatives, animal, child.getId(), Relationship.OFFSPRING));
        for (Animal child : offspring)
        {   animalRegistry.findChildrenOf(child.getId())
                          .forEach(grandchild -> add(relatives, animal, grandchild.getId(), Relationship.GRANDCHILD));
        }

        log.debug("Animal {}: {} close relatives", animal.describe(), relatives.size());
        return new ArrayList<>(relatives.values());
    }

    /**
     * Average relatedness of the ancestors shared by sire and dam, within {@value #ANCESTOR_DEPTH}
     * generations of each. A parent that is itself an ancestor of the other parent counts as shared.
     *
     * @return a value in [0, 1]; 0 when a parent is unknown or nothing is shared.
     */
    public double inbreedingCoefficient(Animal animal)
    {
        if (animal.getSireId() == null || animal.getDamId() == null) return 0.0;

        Map<Long, Double> sireAncestors = ancestorsOf(animal.getSireId());
        Map<Long, Double> damAncestors = ancestorsOf(animal.getDamId());

        List<Double> shared = new ArrayList<>();
        sireAncestors.forEach((ancestorId, coefficient) ->
        {
            if (damAncestors.containsKey(ancestorId)) shared.add(coefficient);
        });
        if (sireAncestors.containsKey(animal.getDamId())) shared.add(sireAncestors.get(animal.getDamId()));
        if (damAncestors.containsKey(animal.getSireId())) shared.add(damAncestors.get(animal.getSireId()));

        if (shared.isEmpty()) return 0.0;

        double average = shared.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double coefficient = Math.max(0.0, Math.min(1.0, average));
        log.debug("Animal {}: {} shared ancestors, inbreeding coefficient {}", animal.describe(), shared.size(), coefficient);
        return coefficient;
    }


    /**
     * Ancestors of the animal up to {@value #ANCESTOR_DEPTH} generations, with their relatedness
     * (0.5 for parents, 0.25 for grandparents). Cyclic links are cut by a visited set.
     */
    Map<Long, Double> ancestorsOf(Long animalId)
    {
        Map<Long, Double> ancestors = new LinkedHashMap<>();
        Set<Long> visited = new HashSet<>();
        visited.add(animalId);

        List<Long> generation = List.of(animalId);
        double coefficient = 0.5;
        for (int depth = 1; depth <= ANCESTOR_DEPTH && !generation.isEmpty(); depth++)
        {
            List<Long> next = new ArrayList<>();
            for (Long id : generation)
            {
                Optional<Animal> current = findAnimal(id);
                if (current.isEmpty()) continue;
                for (Long parentId : new Long[] { current.get().getSireId(), current.get().getDamId() })
                {
                    if (parentId != null && visited.add(parentId))
                    {   ancestors.put(parentId, coefficient);
                        next.add(parentId);
                    }
                }
            }
            generation = next;
            coefficient /= 2;
        }
        return ancestors;
    }

    private List<Animal> findSiblings(Animal animal)
    {
        Map<Long, Animal> siblings = new LinkedHashMap<>();
        for (Long parentId : new Long[] { animal.getSireId(), animal.getDamId() })
        {
            if (parentId == null) continue;
            animalRegistry.findChildrenOf(parentId)
                          .stream()
                          .filter(child -> !child.getId().equals(animal.getId()))
                          .forEach(child -> siblings.putIfAbsent(child.getId(), child));
        }
        return new ArrayList<>(siblings.values());
    }

    private static boolean isFullSibling(Animal animal, Animal sibling)
    {   return animal.getSireId() != null && animal.getDamId() != null
            && Objects.equals(animal.getSireId(), sibling.getSireId())
            && Objects.equals(animal.getDamId(), sibling.getDamId());
    }

    private static void add(Map<Long, KnownRelative> relatives, Animal self, Long relativeId, Relationship relationship)
    {
        if (relativeId == null || relativeId.equals(self.getId())) return;
        relatives.putIfAbsent(relativeId, KnownRelative.of(relativeId, relationship));
    }

    private Optional<Animal> findAnimal(Long animalId)
    {   return animalId == null ? Optional.empty() : animalRegistry.findAnimal(animalId);
    }
}
