package com.fhi.farm_breeding.controller;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.fhi.farm_breeding.dto.BatchComputeResult;
import com.fhi.farm_breeding.dto.BreederRanking;
import com.fhi.farm_breeding.dto.CompatibilityReport;
import com.fhi.farm_breeding.dto.GeneticsDashboard;
import com.fhi.farm_breeding.dto.InbreedingRiskReport;
import com.fhi.farm_breeding.dto.PairSuggestion;
import com.fhi.farm_breeding.dto.PairSuggestionCriteria;
import com.fhi.farm_breeding.dto.PedigreeNode;
import com.fhi.farm_breeding.model.Gender;
import com.fhi.farm_breeding.model.GeneticProfile;
import com.fhi.farm_breeding.service.GeneticsService;

import lombok.RequiredArgsConstructor;


@RestController
@RequestMapping("/api/genetics")
@RequiredArgsConstructor
public class GeneticsController
{
    private final GeneticsService geneticsService;

    @GetMapping("/animal/{id}")
    public ResponseEntity<GeneticProfile> getProfile(@RequestHeader(ApiHeaders.USER_ID) Long userId,
                                                     @PathVariable Long id,
                                                     @RequestParam(defaultValue = "false") boolean forceRefresh)
    {   return ResponseEntity.ok(geneticsService.getProfile(id, forceRefresh, userId));
    }

    /**
     * Example: GET /api/genetics/animal/7/pedigree?depth=4
     */
    @GetMapping("/animal/{id}/pedigree")
    public ResponseEntity<PedigreeNode> getPedigree(@RequestHeader(ApiHeaders.USER_ID) Long userId,
                                                    @PathVariable Long id,
                                                    @RequestParam(required = false) Integer depth)
    {   return ResponseEntity.ok(geneticsService.pedigreeTree(id, depth, userId));
    }

    @GetMapping("/compatibility/{id1}/{id2}")
    public ResponseEntity<CompatibilityReport> compatibility(@RequestHeader(ApiHeaders.USER_ID) Long userId,
                                                             @PathVariable Long id1,
                                                             @PathVariable Long id2)
    {   return ResponseEntity.ok(geneticsService.compatibility(id1, id2, userId));
    }

    @GetMapping("/inbreeding-risk/{id1}/{id2}")
    public ResponseEntity<InbreedingRiskReport> inbreedingRisk(@RequestHeader(ApiHeaders.USER_ID) Long userId,
                                                               @PathVariable Long id1,
                                                               @PathVariable Long id2)
    {   return ResponseEntity.ok(geneticsService.inbreedingRisk(id1, id2, userId));
    }

    /**
     * Example: GET /api/genetics/farm/3/pair-suggestions?gender=FEMALE&minCompatibility=80&limit=3
     */
    @GetMapping("/farm/{farmId}/pair-suggestions")
    public ResponseEntity<List<PairSuggestion>> pairSuggestions(@RequestHeader(ApiHeaders.USER_ID) Long userId,
                                                                @PathVariable Long farmId,
                                                                @RequestParam(required = false) Long animalTypeId,
                                                                @RequestParam(required = false) Gender gender,
                                                                @RequestParam(required = false) Integer minCompatibility,
                                                                @RequestParam(required = false) Integer limit)
    {   PairSuggestionCriteria criteria = new PairSuggestionCriteria(animalTypeId, gender, minCompatibility, limit);
        return ResponseEntity.ok(geneticsService.pairSuggestions(farmId, criteria, userId));
    }

    @GetMapping("/farm/{farmId}/dashboard")
    public ResponseEntity<GeneticsDashboard> dashboard(@RequestHeader(ApiHeaders.USER_ID) Long userId, @PathVariable Long farmId)
    {   return ResponseEntity.ok(geneticsService.dashboard(farmId, userId));
    }

    @GetMapping("/farm/{farmId}/top-breeders")
    public ResponseEntity<List<BreederRanking>> topBreeders(@RequestHeader(ApiHeaders.USER_ID) Long userId,
                                                            @PathVariable Long farmId,
                                                            @RequestParam(defaultValue = "10") int limit)
    {   return ResponseEntity.ok(geneticsService.topBreeders(farmId, limit, userId));
    }

    @PostMapping("/farm/{farmId}/batch-compute")
    public ResponseEntity<BatchComputeResult> batchCompute(@RequestHeader(ApiHeaders.USER_ID) Long userId, @PathVariable Long farmId)
    {   return ResponseEntity.ok(geneticsService.batchCompute(farmId, userId));
    }
}
