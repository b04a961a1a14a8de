package com.mk.fx.qa.stress.execution.engine;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import lombok.extern.slf4j.Slf4j;

/** Picks the affinity binder the host supports. */
@Slf4j
public final class AffinityBinders {

  private AffinityBinders() {
    throw new UnsupportedOperationException("AffinityBinders cannot be instantiated");
  }

  /**
   * Returns a {@link LinuxAffinityBinder} when {@code /proc/thread-self} exists and {@code taskset}
   * is on the {@code PATH}, otherwise {@link NoOpAffinityBinder}.
   */
  public static AffinityBinder detect() {
    if (Files.exists(Path.of("/proc/thread-self")) && onPath("taskset")) {
      return new LinuxAffinityBinder();
    }
    log.warn("Thread affinity is not supported on this host, cores will not be pinned");
    return NoOpAffinityBinder.INSTANCE;
  }

  static boolean onPath(String executable) {
    String path = System.getenv("PATH");
    if (path == null || path.isBlank()) {
      return false;
    }
    return Arrays.stream(path.split(File.pathSeparator))
        .filter(dir -> !dir.isBlank())
        .map(dir -> Path.of(dir, executable))
        .anyMatch(Files::isExecutable);
  }
}
