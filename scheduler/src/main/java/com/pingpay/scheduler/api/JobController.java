package com.pingpay.scheduler.api;

import com.pingpay.scheduler.api.dto.JobRequest;
import com.pingpay.scheduler.api.dto.JobResponse;
import com.pingpay.scheduler.api.dto.MessageResponse;
import com.pingpay.scheduler.api.dto.StatusRequest;
import com.pingpay.scheduler.model.Job;
import com.pingpay.scheduler.model.JobStatus;
import com.pingpay.scheduler.service.JobService;
import com.pingpay.scheduler.service.ValidationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for job lifecycle.
 *
 * POST   /jobs               - create a job (201)
 * GET    /jobs?status=       - list jobs, newest first
 * GET    /jobs/{id}          - fetch one job
 * PUT    /jobs/{id}          - replace a job's definition
 * PATCH  /jobs/{id}/status   - active / inactive
 * DELETE /jobs/{id}          - delete a job and its queue entries
 * POST   /jobs/{id}/run      - queue one immediate run
 *
 * Errors are rendered by {@link ApiExceptionHandler}.
 */
@RestController
@RequestMapping("/jobs")
public class JobController {

    private final JobService jobService;

    public JobController(JobService jobService) {
        this.jobService = jobService;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/jobs \
     *     -H "Content-Type: application/json" \
     *     -d '{"name":"hourly-sync","type":"http","target":"https://example.com/hook",
     *          "schedule_type":"cron","cron_expression":"0 * * * *"}'
     */
    @PostMapping
    public ResponseEntity<JobResponse> create(@RequestBody JobRequest req) {
        Job job = jobService.create(req.toDefinition());
        return ResponseEntity.status(HttpStatus.CREATED).body(JobResponse.from(job));
    }

    @GetMapping
    public List<JobResponse> list(@RequestParam(required = false) String status) {
        return jobService.list(parseStatus(status)).stream()
                .map(JobResponse::from)
                .toList();
    }

    @GetMapping("/{id}")
    public JobResponse get(@PathVariable UUID id) {
        return JobResponse.from(jobService.get(id));
    }

    @PutMapping("/{id}")
    public JobResponse update(@PathVariable UUID id, @RequestBody JobRequest req) {
        return JobResponse.from(jobService.update(id, req.toDefinition()));
    }

    @PatchMapping("/{id}/status")
    public JobResponse setStatus(@PathVariable UUID id, @RequestBody StatusRequest req) {
        JobStatus status = parseStatus(req.status());
        if (status == null) {
            throw new ValidationException("Invalid status value", Map.of("status", "Status is required"));
        }
        return JobResponse.from(jobService.setStatus(id, status));
    }

    @DeleteMapping("/{id}")
    public MessageResponse delete(@PathVariable UUID id) {
        jobService.delete(id);
        return new MessageResponse("Job deleted successfully");
    }

    @PostMapping("/{id}/run")
    public MessageResponse run(@PathVariable UUID id) {
        jobService.runNow(id);
        return new MessageResponse("Job triggered successfully");
    }

    private static JobStatus parseStatus(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return JobStatus.fromValue(raw);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid status value",
                    Map.of("status", "Status must be one of: active, inactive, failed"));
        }
    }
}
