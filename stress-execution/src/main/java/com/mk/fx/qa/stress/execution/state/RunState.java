package com.mk.fx.qa.stress.execution.state;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiPredicate;

/**
 * Run-control state shared by every engine thread and the monitor for the duration of one run.
 *
 * <p>Thread-safety: each field is internally synchronised. The cancellation flag is an {@link
 * AtomicBoolean}, the error queue an unbounded lock-free FIFO, the readiness signal a one-shot
 * {@link CountDownLatch}. Progress lists are registered once per core and then written only by
 * that core's engine thread.
 */
public final class RunState {

  private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
  private final Queue<ErrorRecord> errorQueue = new ConcurrentLinkedQueue<>();
  private final CountDownLatch monitorReady = new CountDownLatch(1);
  private final Map<Integer, List<WorkloadProgress>> progressTable = new ConcurrentHashMap<>();

  // -----------------------------------------------------
  // Cancellation
  // -----------------------------------------------------

  public void requestCancel() {
    cancelRequested.set(true);
  }

  public boolean isCancelRequested() {
    return cancelRequested.get();
  }

  // -----------------------------------------------------
  // Error queue
  // -----------------------------------------------------

  public void publishError(ErrorRecord record) {
    errorQueue.add(record);
  }

  /** Removes and returns every queued record in FIFO order. Empty if nothing is queued. */
  public List<ErrorRecord> drainErrors() {
    List<ErrorRecord> drained = new ArrayList<>();
    ErrorRecord next;
    while ((next = errorQueue.poll()) != null) {
      drained.add(next);
    }
    return drained;
  }

  public int pendingErrors() {
    return errorQueue.size();
  }

  // -----------------------------------------------------
  // Monitor readiness
  // -----------------------------------------------------

  /** Opens the readiness barrier. Further calls have no effect. */
  public void signalMonitorReady() {
    monitorReady.countDown();
  }

  public boolean isMonitorReady() {
    return monitorReady.getCount() == 0;
  }

  /**
   * Waits for the monitor to signal readiness.
   *
   * @return {@code true} if readiness was signalled, {@code false} if the timeout elapsed first
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public boolean awaitMonitorReady(Duration timeout) throws InterruptedException {
    return monitorReady.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  // -----------------------------------------------------
  // Progress table
  // -----------------------------------------------------

  /**
   * Registers the progress list of a core. Must happen once, before the core runs any cycle.
   *
   * @throws IllegalStateException if the core already has a progress list
   */
  public void registerProgress(int core, List<WorkloadProgress> progress) {
    var existing = progressTable.putIfAbsent(core, Collections.unmodifiableList(progress));
    if (existing != null) {
      throw new IllegalStateException("Progress for core " + core + " is already registered");
    }
  }

  public Optional<List<WorkloadProgress>> progressFor(int core) {
    return Optional.ofNullable(progressTable.get(core));
  }

  /**
   * Copies every core's progress, ordered by core.
   *
   * @param hasFailures tells whether a (core, workload name) pair has recorded failures
   */
  public SortedMap<Integer, List<WorkloadProgressSnapshot>> snapshotProgress(
      BiPredicate<Integer, String> hasFailures) {
    SortedMap<Integer, List<WorkloadProgressSnapshot>> snapshot = new TreeMap<>();
    for (var entry : progressTable.entrySet()) {
      List<WorkloadProgressSnapshot> copies = new ArrayList<>(entry.getValue().size());
      for (WorkloadProgress p : entry.getValue()) {
        copies.add(p.snapshot(hasFailures.test(p.getCore(), p.getWorkloadName())));
      }
      snapshot.put(entry.getKey(), List.copyOf(copies));
    }
    return snapshot;
  }
}
