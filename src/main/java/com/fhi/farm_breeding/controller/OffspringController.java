package com.fhi.farm_breeding.controller;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.fhi.farm_breeding.dto.CullingRequest;
import com.fhi.farm_breeding.dto.DeathRequest;
import com.fhi.farm_breeding.dto.OffspringStatistics;
import com.fhi.farm_breeding.dto.OffspringTrackingView;
import com.fhi.farm_breeding.dto.SaleRequest;
import com.fhi.farm_breeding.dto.TrackingUpdateRequest;
import com.fhi.farm_breeding.dto.TransferRequest;
import com.fhi.farm_breeding.dto.WeaningRequest;
import com.fhi.farm_breeding.model.GrowthMeasurement;
import com.fhi.farm_breeding.service.OffspringTrackingService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;


/**
 * Post-birth lifecycle of an offspring, addressed by the offspring's animal id.
 */
@RestController
@RequestMapping("/api/reproduction/offspring")
@RequiredArgsConstructor
public class OffspringController
{
    private final OffspringTrackingService trackingService;

    @GetMapping("/{animalId}/tracking")
    public ResponseEntity<OffspringTrackingView> getTracking(@RequestHeader(ApiHeaders.USER_ID) Long userId, @PathVariable Long animalId)
    {   return ResponseEntity.ok(trackingService.get(animalId, userId));
    }

    @PatchMapping("/{animalId}/tracking")
    public ResponseEntity<OffspringTrackingView> updateTracking(@RequestHeader(ApiHeaders.USER_ID) Long userId,
                                                                @PathVariable Long animalId,
                                                                @Valid @RequestBody TrackingUpdateRequest request)
    {   return ResponseEntity.ok(trackingService.update(animalId, request, userId));
    }

    @PostMapping("/{animalId}/wean")
    public ResponseEntity<OffspringTrackingView> wean(@RequestHeader(ApiHeaders.USER_ID) Long userId,
                                                      @PathVariable Long animalId,
                                                      @Valid @RequestBody WeaningRequest request)
    {   return ResponseEntity.ok(trackingService.recordWeaning(animalId, request, userId));
    }

    @PostMapping("/{animalId}/sell")
    public ResponseEntity<OffspringTrackingView> sell(@RequestHeader(ApiHeaders.USER_ID) Long userId,
                                                      @PathVariable Long animalId,
                                                      @Valid @RequestBody SaleRequest request)
    {   return ResponseEntity.ok(trackingService.recordSale(animalId, request, userId));
    }

    @PostMapping("/{animalId}/death")
    public ResponseEntity<OffspringTrackingView> death(@RequestHeader(ApiHeaders.USER_ID) Long userId,
                                                       @PathVariable Long animalId,
                                                       @Valid @RequestBody DeathRequest request)
    {   return ResponseEntity.ok(trackingService.recordDeath(animalId, request, userId));
    }

    @PostMapping("/{animalId}/cull")
    public ResponseEntity<OffspringTrackingView> cull(@RequestHeader(ApiHeaders.USER_ID) Long userId,
                                                      @PathVariable Long animalId,
                                                      @Valid @RequestBody CullingRequest request)
    {   return ResponseEntity.ok(trackingService.recordCulling(animalId, request, userId));
    }

    @PostMapping("/{animalId}/transfer")
    public ResponseEntity<OffspringTrackingView> transfer(@RequestHeader(ApiHeaders.USER_ID) Long userId,
                                                          @PathVariable Long animalId,
                                                          @Valid @RequestBody TransferRequest request)
    {   return ResponseEntity.ok(trackingService.recordTransfer(animalId, request, userId));
    }

    @PostMapping("/{animalId}/growth")
    public ResponseEntity<OffspringTrackingView> growth(@RequestHeader(ApiHeaders.USER_ID) Long userId,
                                                        @PathVariable Long animalId,
                                                        @Valid @RequestBody GrowthMeasurement measurement)
    {   return ResponseEntity.ok(trackingService.recordGrowth(animalId, measurement, userId));
    }

    @GetMapping("/dam/{damId}")
    public ResponseEntity<List<OffspringTrackingView>> listByDam(@RequestHeader(ApiHeaders.USER_ID) Long userId, @PathVariable Long damId)
    {   return ResponseEntity.ok(trackingService.listByDam(damId, userId));
    }

    @GetMapping("/sire/{sireId}")
    public ResponseEntity<List<OffspringTrackingView>> listBySire(@RequestHeader(ApiHeaders.USER_ID) Long userId, @PathVariable Long sireId)
    {   return ResponseEntity.ok(trackingService.listBySire(sireId, userId));
    }

    @GetMapping("/farm/{farmId}/statistics")
    public ResponseEntity<OffspringStatistics> statistics(@RequestHeader(ApiHeaders.USER_ID) Long userId, @PathVariable Long farmId)
    {   return ResponseEntity.ok(trackingService.statistics(farmId, userId));
    }
}
