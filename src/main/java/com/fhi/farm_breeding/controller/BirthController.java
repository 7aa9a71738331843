package com.fhi.farm_breeding.controller;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.fhi.farm_breeding.dto.BirthRequest;
import com.fhi.farm_breeding.dto.BirthStatistics;
import com.fhi.farm_breeding.dto.BirthUpdateRequest;
import com.fhi.farm_breeding.dto.NeonatalDeathRequest;
import com.fhi.farm_breeding.model.BirthEvent;
import com.fhi.farm_breeding.service.BirthEventService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;


@RestController
@RequestMapping("/api/reproduction/birth")
@RequiredArgsConstructor
public class BirthController
{
    private final BirthEventService birthEventService;

    /**
     * Records the delivery, closes the pregnancy and registers the live-born offspring.
     */
    @PostMapping
    public ResponseEntity<BirthEvent> recordBirth(@RequestHeader(ApiHeaders.USER_ID) Long userId,
                                                  @Valid @RequestBody BirthRequest request)
    {   return ResponseEntity.status(HttpStatus.CREATED).body(birthEventService.recordBirth(request, userId));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BirthEvent> getBirth(@RequestHeader(ApiHeaders.USER_ID) Long userId, @PathVariable Long id)
    {   return ResponseEntity.ok(birthEventService.get(id, userId));
    }

    @GetMapping("/farm/{farmId}")
    public ResponseEntity<List<BirthEvent>> listByFarm(@RequestHeader(ApiHeaders.USER_ID) Long userId, @PathVariable Long farmId)
    {   return ResponseEntity.ok(birthEventService.listByFarm(farmId, userId));
    }

    @GetMapping("/dam/{damId}")
    public ResponseEntity<List<BirthEvent>> listByDam(@RequestHeader(ApiHeaders.USER_ID) Long userId, @PathVariable Long damId)
    {   return ResponseEntity.ok(birthEventService.listByDam(damId, userId));
    }

    @GetMapping("/farm/{farmId}/statistics")
    public ResponseEntity<BirthStatistics> statistics(@RequestHeader(ApiHeaders.USER_ID) Long userId, @PathVariable Long farmId)
    {   return ResponseEntity.ok(birthEventService.statistics(farmId, userId));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<BirthEvent> updateBirth(@RequestHeader(ApiHeaders.USER_ID) Long userId,
                                                  @PathVariable Long id,
                                                  @Valid @RequestBody BirthUpdateRequest request)
    {   return ResponseEntity.ok(birthEventService.update(id, request, userId));
    }

    @PatchMapping("/{id}/complete")
    public ResponseEntity<BirthEvent> markCompleted(@RequestHeader(ApiHeaders.USER_ID) Long userId, @PathVariable Long id)
    {   return ResponseEntity.ok(birthEventService.markCompleted(id, userId));
    }

    @PatchMapping("/{id}/neonatal-death")
    public ResponseEntity<BirthEvent> recordNeonatalDeath(@RequestHeader(ApiHeaders.USER_ID) Long userId,
                                                          @PathVariable Long id,
                                                          @Valid @RequestBody NeonatalDeathRequest request)
    {   return ResponseEntity.ok(birthEventService.recordNeonatalDeath(id, request, userId));
    }
}
