package com.mk.fx.qa.stress.execution.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Request to start a run. Fields use the same notation as the {@code stress.run.*} properties, e.g.
 * {@code cores = "0-3,6"}, {@code workloads = "1,2"}, {@code cycles = "100,50"}, {@code mode =
 * "round"}.
 */
@Data
public class RunRequest {

  @NotBlank
  @JsonProperty("cores")
  private String cores;

  @NotBlank
  @JsonProperty("workloads")
  private String workloads;

  @NotBlank
  @JsonProperty("cycles")
  private String cycles;

  @JsonProperty("mode")
  private String mode;
}
