package com.fhi.farm_breeding.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.fhi.farm_breeding.dto.AnimalReproductionSummary;
import com.fhi.farm_breeding.dto.ReproductionDashboard;
import com.fhi.farm_breeding.service.ReproductionOverviewService;

import lombok.RequiredArgsConstructor;


@RestController
@RequestMapping("/api/reproduction")
@RequiredArgsConstructor
public class ReproductionController
{
    private final ReproductionOverviewService overviewService;

    @GetMapping("/dashboard/farm/{farmId}")
    public ResponseEntity<ReproductionDashboard> dashboard(@RequestHeader(ApiHeaders.USER_ID) Long userId, @PathVariable Long farmId)
    {   return ResponseEntity.ok(overviewService.dashboard(farmId, userId));
    }

    @GetMapping("/summary/animal/{animalId}")
    public ResponseEntity<AnimalReproductionSummary> animalSummary(@RequestHeader(ApiHeaders.USER_ID) Long userId, @PathVariable Long animalId)
    {   return ResponseEntity.ok(overviewService.animalSummary(animalId, userId));
    }
}
