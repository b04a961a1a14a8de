package com.mk.fx.qa.stress.execution.support;

import com.mk.fx.qa.stress.workloads.Workload;
import com.mk.fx.qa.stress.workloads.WorkloadValidationException;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Workload that appends its name to a shared log on every step and can be told to fail validation,
 * or throw, on a given step.
 */
public class RecordingWorkload implements Workload {

  private final String name;
  private final List<String> executionLog;
  private final AtomicInteger steps = new AtomicInteger();
  private volatile int failValidationOnStep = -1;
  private volatile int throwOnStep = -1;
  private volatile Runnable onStep = () -> {};

  public RecordingWorkload(String name, List<String> executionLog) {
    this.name = name;
    this.executionLog = executionLog;
  }

  public RecordingWorkload failValidationOnStep(int step) {
    this.failValidationOnStep = step;
    return this;
  }

  public RecordingWorkload throwOnStep(int step) {
    this.throwOnStep = step;
    return this;
  }

  public RecordingWorkload onStep(Runnable action) {
    this.onStep = action;
    return this;
  }

  public int steps() {
    return steps.get();
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public void runStep() {
    int step = steps.incrementAndGet();
    executionLog.add(name);
    onStep.run();
    if (step == throwOnStep) {
      throw new IllegalStateException(name + " blew up on step " + step);
    }
  }

  @Override
  public void validate() throws WorkloadValidationException {
    if (steps.get() == failValidationOnStep) {
      throw new WorkloadValidationException(name + " mismatch on step " + steps.get());
    }
  }
}
