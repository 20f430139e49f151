package com.salesforecast.engine.api;

import com.salesforecast.engine.domain.model.TuningJob;
import com.salesforecast.engine.domain.service.tuning.ParameterGrid;
import com.salesforecast.engine.domain.service.tuning.ParameterTuningService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/forecast")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class TuningController {

    private final ParameterTuningService tuningService;

    @PostMapping("/parameter_tuning")
    public ResponseEntity<Map<String, Object>> startTuning(@RequestBody TuningRequest request) {
        TuningJob job = tuningService.startTuning(request.category(), request.parameters());
        log.info("[Tuning API] job {} accepted for category={}", job.getId(), job.getCategory());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
                "success", true,
                "data", Map.of(
                        "job_id", job.getId(),
                        "status", job.getStatus(),
                        "category", job.getCategory()),
                "message", "Parameter tuning job has been queued. You can check the status using the job ID."));
    }

    @GetMapping("/tuning_jobs")
    public ResponseEntity<Map<String, Object>> jobs(@RequestParam(required = false) String status,
                                                    @RequestParam(required = false) String category) {
        TuningJob.Status parsed = status == null || status.isBlank()
                ? null
                : TuningJob.Status.valueOf(status.trim().toUpperCase(Locale.ROOT));
        List<TuningJob> jobs = tuningService.findJobs(parsed, category);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "data", jobs,
                "message", "Jobs retrieved successfully"));
    }

    @GetMapping("/tuning_jobs/{id}")
    public ResponseEntity<Map<String, Object>> job(@PathVariable long id) {
        return tuningService.findJob(id)
                .<ResponseEntity<Map<String, Object>>>map(job -> ResponseEntity.ok(Map.of(
                        "success", true,
                        "data", job,
                        "message", "Job retrieved successfully")))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                        "success", false,
                        "message", "Job " + id + " not found")));
    }

    public record TuningRequest(String category, ParameterGrid parameters) {
    }
}
