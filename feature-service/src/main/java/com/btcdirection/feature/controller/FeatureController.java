package com.btcdirection.feature.controller;

import com.btcdirection.common.model.FeatureRow;
import com.btcdirection.feature.dto.AssemblyReport;
import com.btcdirection.feature.service.FeatureAssemblyService;
import com.btcdirection.feature.service.FeatureQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;

@RestController
@RequestMapping("/api/v1/features")
public class FeatureController {

    private static final Logger log = LoggerFactory.getLogger(FeatureController.class);

    private final FeatureAssemblyService assemblyService;
    private final FeatureQueryService queryService;
    private final Clock clock;

    public FeatureController(FeatureAssemblyService assemblyService,
                             FeatureQueryService queryService,
                             Clock clock) {
        this.assemblyService = assemblyService;
        this.queryService    = queryService;
        this.clock           = clock;
    }

    @PostMapping("/assemble")
    public Mono<ResponseEntity<AssemblyReport>> assemble(
            @RequestParam(defaultValue = "true") boolean updateOnly) {
        log.info("Feature assembly requested. updateOnly={}", updateOnly);
        return assemblyService.assembleFeatures(updateOnly)
            .map(ResponseEntity::ok);
    }

    @GetMapping
    public Flux<FeatureRow> latest(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf,
            @RequestParam(defaultValue = "30") int limit) {
        LocalDate effective = asOf != null ? asOf : LocalDate.now(clock);
        log.info("Feature rows requested. asOf={} limit={}", effective, limit);
        return queryService.latest(effective, limit);
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }
}
