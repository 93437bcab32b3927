package com.grp.tank.web;

import com.grp.tank.catalog.CatalogEntry;
import com.grp.tank.catalog.CatalogPage;
import com.grp.tank.domain.BomResult;
import com.grp.tank.domain.CapacitySummary;
import com.grp.tank.domain.RecommendedFitting;
import com.grp.tank.domain.TankOptions;
import com.grp.tank.service.TankBomService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/tank")
@RequiredArgsConstructor
public class TankController {

    private final TankBomService tankBomService;

    @GetMapping("/options")
    public ResponseEntity<TankOptions> options() {
        return ResponseEntity.ok(tankBomService.options());
    }

    @PostMapping("/calculate")
    public ResponseEntity<BomResult> calculate(@Valid @RequestBody TankConfigRequest request) {
        BomResult result = tankBomService.calculate(request.toConfiguration());
        return ResponseEntity.ok(result);
    }

    @PostMapping("/capacity")
    public ResponseEntity<CapacitySummary> capacity(@Valid @RequestBody DimensionsRequest dimensions) {
        return ResponseEntity.ok(tankBomService.capacity(dimensions.toDimensions()));
    }

    @PostMapping("/fittings/recommended")
    public ResponseEntity<List<RecommendedFitting>> recommendedFittings(
            @Valid @RequestBody DimensionsRequest dimensions) {
        return ResponseEntity.ok(tankBomService.recommendFittings(dimensions.toDimensions()));
    }

    @GetMapping("/prices/{partNo}")
    public ResponseEntity<CatalogEntry> price(@PathVariable String partNo) {
        return ResponseEntity.ok(tankBomService.findPart(partNo));
    }

    @GetMapping("/prices")
    public ResponseEntity<CatalogPage> prices(@RequestParam(defaultValue = "0") int skip,
                                              @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(tankBomService.listParts(skip, limit));
    }
}
