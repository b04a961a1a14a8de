package com.mk.fx.qa.stress.execution.launcher;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.stress.execution.cfg.StressRunCfg;
import com.mk.fx.qa.stress.execution.model.RunConfiguration;
import com.mk.fx.qa.stress.execution.model.SchedulingPolicy;
import com.mk.fx.qa.stress.execution.service.StressRunService;
import com.mk.fx.qa.stress.execution.utils.StressUtils;
import com.mk.fx.qa.stress.workloads.catalog.WorkloadCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/** Starts the run described by {@code stress.run.*} at boot when auto-start is enabled. */
@Slf4j
@Component
@RequiredArgsConstructor
public class StressRunLauncher implements ApplicationRunner {

  private final StressRunCfg properties;
  private final WorkloadCatalog catalog;
  private final StressRunService stressRunService;

  @Override
  public void run(ApplicationArguments args) {
    if (!properties.getRun().isAutoStart()) {
      log.info("Auto-start disabled, waiting for runs to be submitted over REST");
      return;
    }
    var configuration = fromProperties(properties.getRun(), StressUtils.availableCores());
    stressRunService
        .start(configuration)
        .ifPresentOrElse(
            status -> log.info("Auto-started run {}", status.runId()),
            () -> log.warn("Auto-start skipped, a run is already active"));
  }

  @VisibleForTesting
  RunConfiguration fromProperties(StressRunCfg.Run run, int processorCount) {
    var cores = StressUtils.parseCoreIndices(run.getCores(), processorCount);
    if (cores.isEmpty()) {
      throw new IllegalArgumentException(
          "stress.run.cores '" + run.getCores() + "' selects no core of " + processorCount);
    }
    return new RunConfiguration(
        cores,
        catalog.parseSelection(run.getWorkloads()),
        StressUtils.parseCycles(run.getCycles()),
        SchedulingPolicy.fromValue(run.getMode()));
  }
}
