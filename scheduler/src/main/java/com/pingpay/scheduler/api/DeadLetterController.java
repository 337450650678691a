package com.pingpay.scheduler.api;

import com.pingpay.scheduler.api.dto.FailedExecutionResponse;
import com.pingpay.scheduler.api.dto.JobResponse;
import com.pingpay.scheduler.service.DeadLetterService;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Dead-letter lane inspection.
 *
 * GET  /dlq                 - inactive jobs
 * POST /dlq/{id}/reactivate - back to ACTIVE, re-armed (400 unless INACTIVE)
 * POST /dlq/{id}/complete   - acknowledge without re-arming (400 unless INACTIVE)
 * GET  /dlq/failed          - executions that ran out of retries
 */
@RestController
@RequestMapping("/dlq")
public class DeadLetterController {

    private final DeadLetterService deadLetterService;

    public DeadLetterController(DeadLetterService deadLetterService) {
        this.deadLetterService = deadLetterService;
    }

    @GetMapping
    public List<JobResponse> list() {
        return deadLetterService.list().stream()
                .map(JobResponse::from)
                .toList();
    }

    @PostMapping("/{id}/reactivate")
    public JobResponse reactivate(@PathVariable UUID id) {
        return JobResponse.from(deadLetterService.reactivate(id));
    }

    @PostMapping("/{id}/complete")
    public JobResponse complete(@PathVariable UUID id) {
        return JobResponse.from(deadLetterService.complete(id));
    }

    @GetMapping("/failed")
    public List<FailedExecutionResponse> failed() {
        return deadLetterService.failedExecutions().stream()
                .map(FailedExecutionResponse::from)
                .toList();
    }
}
