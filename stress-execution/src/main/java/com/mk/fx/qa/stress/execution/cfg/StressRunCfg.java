package com.mk.fx.qa.stress.execution.cfg;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "stress")
public class StressRunCfg {

  @Valid private Run run = new Run();
  @Valid private Monitor monitor = new Monitor();
  @Valid private Telemetry telemetry = new Telemetry();
  @Valid private Affinity affinity = new Affinity();

  /** Run started from configuration at boot. */
  @Data
  public static class Run {
    private boolean autoStart = false;

    /** {@code all}, {@code even}, {@code odd}, or indices and ranges such as {@code 0-3,6}. */
    @NotBlank private String cores = "all";

    /** Catalog ids, comma separated. */
    @NotBlank private String workloads = "1,2,3";

    /** One cycle count per workload. */
    @NotBlank private String cycles = "100,100,100";

    /** {@code seq}, {@code round} or {@code rand}. */
    private String mode = "seq";

    /** Cancel the monitor once every core has stopped. */
    private boolean stopWhenFinished = true;

    /** How long shutdown waits for a running run to wind down. */
    @NotNull private Duration shutdownTimeout = Duration.ofSeconds(30);
  }

  @Data
  public static class Monitor {
    @NotNull private Duration interval = Duration.ofSeconds(1);
    @NotNull private Duration readyTimeout = Duration.ofSeconds(3);
    @NotNull private Duration warmup = Duration.ofMillis(800);

    /** Core for the monitor thread, unset leaves it unpinned. */
    @Min(0)
    private Integer core;

    @NotBlank private String logFile = "log.json";

    @Positive private int errorHistorySize = 50;

    @Min(0)
    @Max(100)
    private int topOffenders = 5;
  }

  @Data
  public static class Telemetry {
    /** Directory holding {@code proc} and {@code sys}; tests point it at fixtures. */
    @NotBlank private String root = "/";
  }

  @Data
  public static class Affinity {
    private boolean enabled = true;
  }
}
