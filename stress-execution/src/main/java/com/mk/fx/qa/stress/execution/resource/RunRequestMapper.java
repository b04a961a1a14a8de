package com.mk.fx.qa.stress.execution.resource;

import com.mk.fx.qa.stress.execution.dto.RunRequest;
import com.mk.fx.qa.stress.execution.model.RunConfiguration;
import com.mk.fx.qa.stress.execution.model.SchedulingPolicy;
import com.mk.fx.qa.stress.execution.utils.StressUtils;
import com.mk.fx.qa.stress.workloads.catalog.WorkloadCatalog;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;
import org.springframework.beans.factory.annotation.Autowired;

/** Turns the textual selections of a {@link RunRequest} into a {@link RunConfiguration}. */
@Mapper(componentModel = "spring")
public abstract class RunRequestMapper {

  @Autowired protected WorkloadCatalog catalog;

  @Mapping(target = "coreIds", source = "cores", qualifiedByName = "mapCores")
  @Mapping(target = "workloadIds", source = "workloads", qualifiedByName = "mapWorkloads")
  @Mapping(target = "cyclesPerWorkload", source = "cycles", qualifiedByName = "mapCycles")
  @Mapping(target = "policy", source = "mode", qualifiedByName = "mapPolicy")
  public abstract RunConfiguration toConfiguration(RunRequest request);

  @Named("mapCores")
  protected List<Integer> mapCores(String cores) {
    return StressUtils.parseCoreIndices(cores, StressUtils.availableCores());
  }

  @Named("mapWorkloads")
  protected List<Integer> mapWorkloads(String workloads) {
    return catalog.parseSelection(workloads);
  }

  @Named("mapCycles")
  protected int[] mapCycles(String cycles) {
    return StressUtils.parseCycles(cycles);
  }

  @Named("mapPolicy")
  protected SchedulingPolicy mapPolicy(String mode) {
    return SchedulingPolicy.fromValue(mode);
  }
}
