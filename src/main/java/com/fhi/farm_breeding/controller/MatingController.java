package com.fhi.farm_breeding.controller;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.fhi.farm_breeding.dto.MatingOutcomeRequest;
import com.fhi.farm_breeding.dto.MatingRequest;
import com.fhi.farm_breeding.dto.MatingStatistics;
import com.fhi.farm_breeding.dto.MatingUpdateRequest;
import com.fhi.farm_breeding.model.MatingEvent;
import com.fhi.farm_breeding.model.MatingStatus;
import com.fhi.farm_breeding.service.MatingEventService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;


@RestController
@RequestMapping("/api/reproduction/mating")
@RequiredArgsConstructor
public class MatingController
{
    private final MatingEventService matingEventService;

    @PostMapping
    public ResponseEntity<MatingEvent> recordMating(@RequestHeader(ApiHeaders.USER_ID) Long userId,
                                                    @Valid @RequestBody MatingRequest request)
    {   return ResponseEntity.status(HttpStatus.CREATED).body(matingEventService.recordMating(request, userId));
    }

    @GetMapping("/{id}")
    public ResponseEntity<MatingEvent> getMating(@RequestHeader(ApiHeaders.USER_ID) Long userId, @PathVariable Long id)
    {   return ResponseEntity.ok(matingEventService.get(id, userId));
    }

    @GetMapping("/farm/{farmId}")
    public ResponseEntity<List<MatingEvent>> listByFarm(@RequestHeader(ApiHeaders.USER_ID) Long userId,
                                                        @PathVariable Long farmId,
                                                        @RequestParam(required = false) MatingStatus status)
    {   return ResponseEntity.ok(matingEventService.listByFarm(farmId, status, userId));
    }

    /**
     * Example: GET /api/reproduction/mating/animal/12?role=dam
     */
    @GetMapping("/animal/{animalId}")
    public ResponseEntity<List<MatingEvent>> listByAnimal(@RequestHeader(ApiHeaders.USER_ID) Long userId,
                                                          @PathVariable Long animalId,
                                                          @RequestParam(required = false) String role)
    {   return ResponseEntity.ok(matingEventService.listByAnimal(animalId, role, userId));
    }

    @GetMapping("/farm/{farmId}/statistics")
    public ResponseEntity<MatingStatistics> statistics(@RequestHeader(ApiHeaders.USER_ID) Long userId, @PathVariable Long farmId)
    {   return ResponseEntity.ok(matingEventService.statistics(farmId, userId));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<MatingEvent> updateMating(@RequestHeader(ApiHeaders.USER_ID) Long userId,
                                                    @PathVariable Long id,
                                                    @Valid @RequestBody MatingUpdateRequest request)
    {   return ResponseEntity.ok(matingEventService.update(id, request, userId));
    }

    @PatchMapping("/{id}/outcome")
    public ResponseEntity<MatingEvent> recordOutcome(@RequestHeader(ApiHeaders.USER_ID) Long userId,
                                                     @PathVariable Long id,
                                                     @Valid @RequestBody MatingOutcomeRequest request)
    {   return ResponseEntity.ok(matingEventService.recordOutcome(id, request, userId));
    }

    @PatchMapping("/{id}/cancel")
    public ResponseEntity<MatingEvent> cancel(@RequestHeader(ApiHeaders.USER_ID) Long userId, @PathVariable Long id)
    {   return ResponseEntity.ok(matingEventService.cancel(id, userId));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteMating(@RequestHeader(ApiHeaders.USER_ID) Long userId, @PathVariable Long id)
    {   matingEventService.delete(id, userId);
        return ResponseEntity.noContent().build();
    }
}
