package hk.edu.hulab.portal.backend.controller;

import hk.edu.hulab.portal.backend.exception.PortalException;
import hk.edu.hulab.portal.backend.lrs.EventLogClient;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/health")
@Tag(name = "Health", description = "Service and store reachability")
public class HealthController {

    private final EventLogClient eventLog;
    private final Clock clock;

    public HealthController(EventLogClient eventLog, Clock clock) {
        this.eventLog = eventLog;
        this.clock = clock;
    }

    @GetMapping
    @Operation(summary = "Health check", description = "Reports whether the learning record store is reachable")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", clock.instant().toString());
        try {
            eventLog.ping();
            body.put("status", "healthy");
            body.put("store", "connected");
            return ResponseEntity.ok(body);
        } catch (PortalException e) {
            body.put("status", "unhealthy");
            body.put("store", "disconnected");
            body.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }
    }
}
