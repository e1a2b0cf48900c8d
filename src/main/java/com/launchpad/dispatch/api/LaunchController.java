package com.launchpad.dispatch.api;

import com.launchpad.core.engine.LaunchEngine;
import com.launchpad.core.model.Launch;
import com.launchpad.core.model.LaunchStatus;
import com.launchpad.core.model.NewLaunch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for launch lifecycle operations.
 * <p>
 * Errors are mapped to HTTP statuses by {@link ApiExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1/launches")
public class LaunchController {

    private static final Logger log = LoggerFactory.getLogger(LaunchController.class);

    private final LaunchEngine launchEngine;

    public LaunchController(LaunchEngine launchEngine) {
        this.launchEngine = launchEngine;
    }

    /**
     * POST /api/v1/launches: Create a pending launch.
     */
    @PostMapping
    public ResponseEntity<LaunchResponse> create(@RequestBody LaunchRequest request) {
        Launch launch = launchEngine.create(new NewLaunch(request.name(), request.description(),
                request.productType(), request.targetMarket()));
        return ResponseEntity.status(HttpStatus.CREATED).body(LaunchResponse.from(launch));
    }

    /**
     * GET /api/v1/launches: List launches, newest first, optionally filtered by status.
     */
    @GetMapping
    public List<LaunchResponse> list(@RequestParam(name = "status", required = false) String status) {
        LaunchStatus filter = status == null || status.isBlank() ? null : LaunchStatus.fromWireName(status);
        return launchEngine.list(filter).stream().map(LaunchResponse::from).toList();
    }

    @GetMapping("/{id}")
    public LaunchResponse get(@PathVariable("id") String id) {
        return LaunchResponse.from(launchEngine.find(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") String id) {
        launchEngine.delete(id);
        return ResponseEntity.noContent().build();
    }

    /**
     * POST /api/v1/launches/{id}/start: Start a pending launch. The run continues in the background.
     */
    @PostMapping("/{id}/start")
    public ResponseEntity<LaunchStatusResponse> start(@PathVariable("id") String id) {
        launchEngine.start(id);
        log.info("Start accepted for launch {}", id);
        return ResponseEntity.accepted().body(LaunchStatusResponse.from(launchEngine.status(id)));
    }

    /**
     * POST /api/v1/launches/{id}/resume: Continue an in-progress launch from its first missing result.
     */
    @PostMapping("/{id}/resume")
    public ResponseEntity<LaunchStatusResponse> resume(@PathVariable("id") String id) {
        launchEngine.resume(id);
        log.info("Resume accepted for launch {}", id);
        return ResponseEntity.accepted().body(LaunchStatusResponse.from(launchEngine.status(id)));
    }

    @GetMapping("/{id}/status")
    public LaunchStatusResponse status(@PathVariable("id") String id) {
        return LaunchStatusResponse.from(launchEngine.status(id));
    }

    @GetMapping("/{id}/results")
    public List<AgentResultResponse> results(@PathVariable("id") String id) {
        return launchEngine.results(id).stream().map(AgentResultResponse::from).toList();
    }
}
