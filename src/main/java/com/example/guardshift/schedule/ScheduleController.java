package com.example.guardshift.schedule;

import com.example.guardshift.config.SchedulerSettings;
import com.example.guardshift.exception.ScheduleErrorCode;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@RestController
public class ScheduleController {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleController.class);

    private final ScheduleService scheduleService;
    private final SchedulerSettings settings;
    private final Clock clock;

    public ScheduleController(ScheduleService scheduleService, SchedulerSettings settings, Clock clock) {
        this.scheduleService = scheduleService;
        this.settings = settings;
        this.clock = clock;
    }

    // Input errors are raised by toRequest and rendered by GlobalExceptionHandler
    @PostMapping({"/schedule", "/api/schedule"})
    public ResponseEntity<ScheduleGenerationResponse> createSchedule(
            @Valid @RequestBody ScheduleGenerationRequest payload) throws InterruptedException {
        ScheduleRequest request = scheduleService.toRequest(payload);
        CompletableFuture<ScheduleResult> future = scheduleService.generateAsync(request);
        try {
            ScheduleResult result = future.get(settings.getTimeoutSeconds(), TimeUnit.SECONDS);
            return ResponseEntity.ok(ScheduleGenerationResponse.from(result, LocalDateTime.now(clock)));
        } catch (TimeoutException e) {
            // The worker is not interrupted; the assembler loop is bounded and runs to completion
            logger.warn("Schedule generation exceeded {}s for {} guards / {} posts",
                    settings.getTimeoutSeconds(), request.guards().size(), request.posts().size());
            return ResponseEntity.ok(ScheduleGenerationResponse.failure(ScheduleErrorCode.TIMEOUT,
                    "Schedule generation timed out after " + settings.getTimeoutSeconds() + " seconds",
                    Map.of()));
        } catch (ExecutionException e) {
            throw new IllegalStateException("Unexpected error generating schedule", e.getCause());
        }
    }
}
