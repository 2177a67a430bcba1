package com.adautopilot.optimization.controller;

import com.adautopilot.common.config.AutopilotSettings;
import com.adautopilot.common.exception.ValidationException;
import com.adautopilot.common.model.WorkerMode;
import com.adautopilot.optimization.dto.GuardrailPolicies;
import com.adautopilot.optimization.dto.ModeChangeResponse;
import com.adautopilot.optimization.dto.ToggleModeRequest;
import com.adautopilot.optimization.worker.AutonomousWorker;
import com.adautopilot.optimization.worker.TickStats;
import com.adautopilot.optimization.worker.WorkerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * Control surface for the autonomous worker.
 */
@RestController
@RequestMapping("/api/v1/autonomous")
public class AutonomousController {

    private static final Logger log = LoggerFactory.getLogger(AutonomousController.class);

    private final AutonomousWorker  worker;
    private final AutopilotSettings settings;

    public AutonomousController(AutonomousWorker worker, AutopilotSettings settings) {
        this.worker   = worker;
        this.settings = settings;
    }

    @PostMapping("/run-once")
    public Mono<TickStats> runOnce() {
        log.info("Run-once requested. mode={}", worker.mode());
        return worker.tick();
    }

    @GetMapping("/status")
    public Mono<WorkerStatus> status() {
        return Mono.just(worker.status());
    }

    @GetMapping("/policies")
    public Mono<GuardrailPolicies> policies() {
        return Mono.just(new GuardrailPolicies(settings.policy(), settings.safety()));
    }

    @PostMapping("/toggle-mode")
    public Mono<ModeChangeResponse> toggleMode(@RequestBody ToggleModeRequest request) {
        return Mono.fromCallable(() -> {
            WorkerMode target = parseMode(request.mode());
            WorkerMode previous = worker.setMode(target);
            return new ModeChangeResponse(previous, target);
        });
    }

    @PostMapping("/start")
    public Mono<WorkerStatus> start() {
        boolean started = worker.start();
        log.info("Worker start requested. started={}", started);
        return Mono.just(worker.status());
    }

    @PostMapping("/stop")
    public Mono<WorkerStatus> stop() {
        boolean stopped = worker.stop();
        log.info("Worker stop requested. stopped={}", stopped);
        return Mono.just(worker.status());
    }

    private static WorkerMode parseMode(String mode) {
        if (mode == null || mode.isBlank()) {
            throw new ValidationException("mode is required (suggest | auto)");
        }
        try {
            return WorkerMode.valueOf(mode.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown mode: " + mode + " (suggest | auto)");
        }
    }
}
