package com.stepwright.orchestrator.api;

import com.stepwright.orchestrator.api.dto.SystemStateResponse;
import com.stepwright.orchestrator.api.dto.WorkerPauseRequest;
import com.stepwright.orchestrator.model.WorkerPauseMode;
import com.stepwright.orchestrator.service.QueueValidationException;
import com.stepwright.orchestrator.service.WorkerPauseService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;

/**
 * GET  /system/worker-pause   current global pause
 * POST /system/worker-pause   {action: pause|resume, mode: drain|quiesce, reason}
 */
@RestController
@RequestMapping("/system")
public class SystemController {

    private final WorkerPauseService workerPause;

    public SystemController(WorkerPauseService workerPause) {
        this.workerPause = workerPause;
    }

    @GetMapping("/worker-pause")
    public SystemStateResponse current() {
        return SystemStateResponse.from(workerPause.current());
    }

    @PostMapping("/worker-pause")
    public SystemStateResponse update(@Valid @RequestBody WorkerPauseRequest req) {
        String actor = req.actor() == null || req.actor().isBlank() ? "operator" : req.actor();
        return switch (req.action().trim().toLowerCase(Locale.ROOT)) {
            case "pause"  -> SystemStateResponse.from(workerPause.pause(parseMode(req.mode()), req.reason(), actor));
            case "resume" -> SystemStateResponse.from(workerPause.resume(req.reason(), actor));
            default -> throw new QueueValidationException("Unknown worker-pause action '" + req.action() + "'");
        };
    }

    private static WorkerPauseMode parseMode(String raw) {
        if (raw == null || raw.isBlank()) return WorkerPauseMode.DRAIN;
        try {
            return WorkerPauseMode.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new QueueValidationException("Unknown worker-pause mode '" + raw + "'");
        }
    }
}
