package com.mk.fx.qa.stress.execution.cfg;

import com.mk.fx.qa.stress.execution.engine.AffinityBinder;
import com.mk.fx.qa.stress.execution.engine.AffinityBinders;
import com.mk.fx.qa.stress.execution.engine.NoOpAffinityBinder;
import com.mk.fx.qa.stress.execution.telemetry.ProcfsTelemetrySource;
import com.mk.fx.qa.stress.execution.telemetry.TelemetrySource;
import com.mk.fx.qa.stress.workloads.catalog.WorkloadCatalog;
import java.nio.file.Path;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class StressBeansCfg {

  @Bean
  public WorkloadCatalog workloadCatalog() {
    return WorkloadCatalog.defaultCatalog();
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public AffinityBinder affinityBinder(StressRunCfg properties) {
    if (!properties.getAffinity().isEnabled()) {
      log.info("Thread affinity disabled by configuration");
      return NoOpAffinityBinder.INSTANCE;
    }
    return AffinityBinders.detect();
  }

  @Bean
  public TelemetrySource telemetrySource(StressRunCfg properties) {
    return new ProcfsTelemetrySource(Path.of(properties.getTelemetry().getRoot()));
  }
}
