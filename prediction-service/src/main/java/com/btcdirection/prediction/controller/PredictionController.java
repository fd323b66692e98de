package com.btcdirection.prediction.controller;

import com.btcdirection.common.model.EnsembleDecision;
import com.btcdirection.prediction.dto.LatestDecision;
import com.btcdirection.prediction.dto.SystemStatus;
import com.btcdirection.prediction.service.PredictionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/v1/predictions")
public class PredictionController {

    private static final Logger log = LoggerFactory.getLogger(PredictionController.class);

    private final PredictionService predictionService;

    public PredictionController(PredictionService predictionService) {
        this.predictionService = predictionService;
    }

    @PostMapping("/next-day")
    public Mono<ResponseEntity<EnsembleDecision>> predictNextDay(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        log.info("Next-day prediction requested. asOf={}", asOf);
        return predictionService.predictNextDay(asOf)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/tomorrow")
    public Mono<ResponseEntity<EnsembleDecision>> tomorrow() {
        return predictionService.tomorrow()
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/latest")
    public Mono<ResponseEntity<LatestDecision>> latest() {
        return predictionService.latest()
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/history")
    public Flux<EnsembleDecision> history(@RequestParam(defaultValue = "7") int days) {
        log.info("Prediction history requested. days={}", days);
        return predictionService.history(days);
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<SystemStatus>> health() {
        return predictionService.status()
            .map(ResponseEntity::ok);
    }
}
