package com.event.seating.web;

import com.event.seating.domain.OptimizationResult;
import com.event.seating.service.SeatingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/seating/optimize")
@RequiredArgsConstructor
public class SeatingController {

    private final SeatingService seatingService;

    @PostMapping
    public ResponseEntity<OptimizationResult> optimize(@RequestBody SeatingRequest request) {
        OptimizationResult result = seatingService.optimizeSeating(
                request.getGuests(),
                request.getConstraints(),
                request.getWeights(),
                request.getConfig(),
                request.getAlgorithm()
        );
        return ResponseEntity.ok(result);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        log.warn("Rejected seating request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
