package com.fhi.farm_breeding.service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.fhi.farm_breeding.dto.PedigreeNode;
import com.fhi.farm_breeding.model.Animal;
import com.fhi.farm_breeding.model.PedigreeAncestor;
import com.fhi.farm_breeding.registry.AnimalRegistry;

import lombok.RequiredArgsConstructor;

/**
 * Depth-first walk up the sire and dam links.
 *
 * <p>Both traversals carry the ids of the current branch. A parent link pointing back into the
 * branch is a data error in the registry; the branch stops there.
 */
@Component
@RequiredArgsConstructor
public class PedigreeTracer
{
    private final AnimalRegistry animalRegistry;


    /**
     * Flat list of ancestors, sire branch first. Parents are generation 1.
     *
     * @param maxAncestors the trace stops once this many ancestors are collected
     */
    public List<PedigreeAncestor> traceAncestors(Animal animal, int depth, int maxAncestors)
    {
        List<PedigreeAncestor> ancestors = new ArrayList<>();
        Set<Long> branch = new HashSet<>();
        branch.add(animal.getId());
        trace(animal, "", 1, depth, maxAncestors, branch, ancestors);
        return ancestors;
    }

    /**
     * Nested tree rooted at the animal (generation 0), parents nested down to {@code depth}.
     */
    public PedigreeNode buildTree(Animal animal, int depth)
    {   return node(animal, 0, depth, new HashSet<>());
    }


    private void trace(Animal current, String lineage, int generation, int depth, int maxAncestors,
                       Set<Long> branch, List<PedigreeAncestor> ancestors)
    {
        if (generation > depth) return;

        traceParent(current.getSireId(), lineage.isEmpty() ? "sire" : lineage + ".sire", generation, depth, maxAncestors, branch, ancestors);
        traceParent(current.getDamId(),  lineage.isEmpty() ? "dam"  : lineage + ".dam",  generation, depth, maxAncestors, branch, ancestors);
    }

    private void traceParent(Long parentId, String lineage, int generation, int depth, int maxAncestors,
                             Set<Long> branch, List<PedigreeAncestor> ancestors)
    {
        if (parentId == null || ancestors.size() >= maxAncestors || branch.contains(parentId)) return;

        ancestors.add(new PedigreeAncestor(parentId, lineage, generation));

        Optional<Animal> parent = animalRegistry.findAnimal(parentId);
        if (parent.isEmpty()) return;

        branch.add(parentId);
        trace(parent.get(), lineage, generation + 1, depth, maxAncestors, branch, ancestors);
        branch.remove(parentId);
    }

    private PedigreeNode node(Animal animal, int generation, int depth, Set<Long> branch)
    {
        PedigreeNode node = new PedigreeNode();
        node.setAnimalId(animal.getId());
        node.setTagNumber(animal.getTagNumber());
        node.setName(animal.getName());
        node.setGender(animal.getGender());
        node.setBreed(animal.getBreed());
        node.setDateOfBirth(animal.getDateOfBirth());
        node.setGeneration(generation);

        if (generation >= depth) return node;

        branch.add(animal.getId());
        node.setSire(parentNode(animal.getSireId(), node, generation, depth, branch));
        node.setDam(parentNode(animal.getDamId(), node, generation, depth, branch));
        branch.remove(animal.getId());
        return node;
    }

    private PedigreeNode parentNode(Long parentId, PedigreeNode child, int generation, int depth, Set<Long> branch)
    {
        if (parentId == null) return null;
        if (branch.contains(parentId))
        {   child.setCyclic(Boolean.TRUE);
            return null;
        }
        return animalRegistry.findAnimal(parentId)
                             .map(parent -> node(parent, generation + 1, depth, branch))
                             .orElse(null);
    }
}
