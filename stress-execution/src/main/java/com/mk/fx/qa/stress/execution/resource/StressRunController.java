package com.mk.fx.qa.stress.execution.resource;

import com.mk.fx.qa.stress.execution.dto.RunRequest;
import com.mk.fx.qa.stress.execution.dto.RunStatusResponse;
import com.mk.fx.qa.stress.execution.dto.WorkloadInfo;
import com.mk.fx.qa.stress.execution.model.RunConfiguration;
import com.mk.fx.qa.stress.execution.service.StressRunService;
import com.mk.fx.qa.stress.execution.state.ErrorRecord;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(
    name = "Stress Runs",
    description = "Endpoints for starting, observing and cancelling stress runs")
@RestController
@RequestMapping("/api/runs")
@Validated
@RequiredArgsConstructor
public class StressRunController {

  private final StressRunService stressRunService;
  private final RunRequestMapper runRequestMapper;
  private final ApiResponseFactory responseFactory;

  // -----------------------------------------------------
  // Run control
  // -----------------------------------------------------
  @Operation(
      summary = "Start a run",
      description = "Starts one engine thread per selected core. Rejected while a run is active.")
  @PostMapping
  public ResponseEntity<?> startRun(@Valid @RequestBody RunRequest request) {
    log.info(
        "Received run request cores={} workloads={} cycles={} mode={}",
        request.getCores(),
        request.getWorkloads(),
        request.getCycles(),
        request.getMode());
    RunConfiguration configuration = runRequestMapper.toConfiguration(request);
    Optional<RunStatusResponse> started = stressRunService.start(configuration);
    if (started.isEmpty()) {
      return responseFactory.conflict("A run is already active");
    }
    log.info("Run {} started", started.get().runId());
    return responseFactory.accepted(started.get());
  }

  @Operation(
      summary = "Cancel the current run",
      description = "Cores stop at their next cycle boundary; the monitor writes a final snapshot.")
  @DeleteMapping("/current")
  public ResponseEntity<?> cancelRun() {
    return stressRunService
        .cancel()
        .<ResponseEntity<?>>map(ResponseEntity::ok)
        .orElseGet(() -> responseFactory.notFound("No run has been started"));
  }

  // -----------------------------------------------------
  // Run views
  // -----------------------------------------------------
  @Operation(summary = "Current run status", description = "Returns the status of the latest run.")
  @GetMapping("/current")
  public ResponseEntity<?> currentRun() {
    return stressRunService
        .status()
        .<ResponseEntity<?>>map(ResponseEntity::ok)
        .orElseGet(() -> responseFactory.notFound("No run has been started"));
  }

  @Operation(
      summary = "Latest monitor snapshot",
      description = "Returns the snapshot of the monitor's most recent tick.")
  @GetMapping("/current/snapshot")
  public ResponseEntity<?> latestSnapshot() {
    return stressRunService
        .latestSnapshot()
        .<ResponseEntity<?>>map(ResponseEntity::ok)
        .orElseGet(
            () -> {
              log.debug("No monitor snapshot available yet");
              return responseFactory.notFound("No monitor snapshot available yet");
            });
  }

  @Operation(
      summary = "Recent errors",
      description = "Returns engine and monitor errors surfaced by the monitor, newest first.")
  @GetMapping("/current/errors")
  public ResponseEntity<List<ErrorRecord>> recentErrors() {
    return ResponseEntity.ok(stressRunService.recentErrors());
  }

  // -----------------------------------------------------
  // Catalog
  // -----------------------------------------------------
  @Operation(summary = "Available workloads", description = "Lists the selectable workloads.")
  @GetMapping("/workloads")
  public ResponseEntity<List<WorkloadInfo>> workloads() {
    return ResponseEntity.ok(stressRunService.listedWorkloads());
  }
}
