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
import org.springframework.web.bind.annotation.RestController;

import com.fhi.farm_breeding.dto.PregnancyAlerts;
import com.fhi.farm_breeding.dto.PregnancyRequest;
import com.fhi.farm_breeding.dto.PregnancyStatistics;
import com.fhi.farm_breeding.dto.PregnancyUpdateRequest;
import com.fhi.farm_breeding.dto.PregnancyView;
import com.fhi.farm_breeding.dto.TerminationRequest;
import com.fhi.farm_breeding.model.PregnancyCheckup;
import com.fhi.farm_breeding.model.PregnancyComplication;
import com.fhi.farm_breeding.service.PregnancyService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;


@RestController
@RequestMapping("/api/reproduction/pregnancy")
@RequiredArgsConstructor
public class PregnancyController
{
    private final PregnancyService pregnancyService;

    @PostMapping
    public ResponseEntity<PregnancyView> createPregnancy(@RequestHeader(ApiHeaders.USER_ID) Long userId,
                                                         @Valid @RequestBody PregnancyRequest request)
    {   return ResponseEntity.status(HttpStatus.CREATED).body(pregnancyService.createPregnancy(request, userId));
    }

    @GetMapping("/{id}")
    public ResponseEntity<PregnancyView> getPregnancy(@RequestHeader(ApiHeaders.USER_ID) Long userId, @PathVariable Long id)
    {   return ResponseEntity.ok(pregnancyService.get(id, userId));
    }

    @GetMapping("/farm/{farmId}")
    public ResponseEntity<List<PregnancyView>> listByFarm(@RequestHeader(ApiHeaders.USER_ID) Long userId, @PathVariable Long farmId)
    {   return ResponseEntity.ok(pregnancyService.listByFarm(farmId, userId));
    }

    @GetMapping("/dam/{damId}")
    public ResponseEntity<List<PregnancyView>> listByDam(@RequestHeader(ApiHeaders.USER_ID) Long userId, @PathVariable Long damId)
    {   return ResponseEntity.ok(pregnancyService.listByDam(damId, userId));
    }

    @GetMapping("/farm/{farmId}/alerts")
    public ResponseEntity<PregnancyAlerts> alerts(@RequestHeader(ApiHeaders.USER_ID) Long userId, @PathVariable Long farmId)
    {   return ResponseEntity.ok(pregnancyService.alerts(farmId, userId));
    }

    @GetMapping("/farm/{farmId}/statistics")
    public ResponseEntity<PregnancyStatistics> statistics(@RequestHeader(ApiHeaders.USER_ID) Long userId, @PathVariable Long farmId)
    {   return ResponseEntity.ok(pregnancyService.statistics(farmId, userId));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<PregnancyView> updatePregnancy(@RequestHeader(ApiHeaders.USER_ID) Long userId,
                                                         @PathVariable Long id,
                                                         @Valid @RequestBody PregnancyUpdateRequest request)
    {   return ResponseEntity.ok(pregnancyService.update(id, request, userId));
    }

    @PostMapping("/{id}/checkups")
    public ResponseEntity<PregnancyView> addCheckup(@RequestHeader(ApiHeaders.USER_ID) Long userId,
                                                    @PathVariable Long id,
                                                    @Valid @RequestBody PregnancyCheckup checkup)
    {   return ResponseEntity.status(HttpStatus.CREATED).body(pregnancyService.addCheckup(id, checkup, userId));
    }

    @PostMapping("/{id}/complications")
    public ResponseEntity<PregnancyView> addComplication(@RequestHeader(ApiHeaders.USER_ID) Long userId,
                                                         @PathVariable Long id,
                                                         @Valid @RequestBody PregnancyComplication complication)
    {   return ResponseEntity.status(HttpStatus.CREATED).body(pregnancyService.addComplication(id, complication, userId));
    }

    @PatchMapping("/{id}/terminate")
    public ResponseEntity<PregnancyView> terminate(@RequestHeader(ApiHeaders.USER_ID) Long userId,
                                                   @PathVariable Long id,
                                                   @Valid @RequestBody TerminationRequest request)
    {   return ResponseEntity.ok(pregnancyService.terminate(id, request, userId));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deletePregnancy(@RequestHeader(ApiHeaders.USER_ID) Long userId, @PathVariable Long id)
    {   pregnancyService.delete(id, userId);
        return ResponseEntity.noContent().build();
    }
}
