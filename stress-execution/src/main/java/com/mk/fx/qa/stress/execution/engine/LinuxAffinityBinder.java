package com.mk.fx.qa.stress.execution.engine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Pins threads with {@code taskset}. The native id of the calling thread comes from the {@code
 * /proc/thread-self} link, which resolves to {@code <pid>/task/<tid>}.
 */
@Slf4j
public final class LinuxAffinityBinder implements AffinityBinder {

  private static final long COMMAND_TIMEOUT_SECONDS = 5;

  /** Runs an external command and returns its exit code. */
  @FunctionalInterface
  interface CommandRunner {
    int run(List<String> command) throws IOException, InterruptedException;
  }

  private final Path procRoot;
  private final CommandRunner commandRunner;

  public LinuxAffinityBinder() {
    this(Path.of("/proc"), LinuxAffinityBinder::runProcess);
  }

  LinuxAffinityBinder(Path procRoot, CommandRunner commandRunner) {
    this.procRoot = Objects.requireNonNull(procRoot, "procRoot");
    this.commandRunner = Objects.requireNonNull(commandRunner, "commandRunner");
  }

  @Override
  public boolean bindCurrentThread(int core) {
    if (core < 0) {
      return false;
    }
    var tid = currentNativeThreadId();
    if (tid.isEmpty()) {
      log.debug("Native thread id unavailable under {}", procRoot);
      return false;
    }
    var command =
        List.of("taskset", "-p", "-c", Integer.toString(core), Long.toString(tid.getAsLong()));
    try {
      int exit = commandRunner.run(command);
      if (exit != 0) {
        log.debug("{} exited with {}", command, exit);
      }
      return exit == 0;
    } catch (IOException e) {
      log.debug("Failed to run {}: {}", command, e.getMessage());
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  OptionalLong currentNativeThreadId() {
    try {
      Path target = Files.readSymbolicLink(procRoot.resolve("thread-self"));
      return OptionalLong.of(Long.parseLong(target.getFileName().toString()));
    } catch (IOException | UnsupportedOperationException | NumberFormatException e) {
      log.debug("Cannot resolve thread-self: {}", e.getMessage());
      return OptionalLong.empty();
    }
  }

  private static int runProcess(List<String> command) throws IOException, InterruptedException {
    Process process =
        new ProcessBuilder(command)
            .redirectErrorStream(true)
            .redirectOutput(ProcessBuilder.Redirect.DISCARD)
            .start();
    if (!process.waitFor(COMMAND_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
      process.destroyForcibly();
      return -1;
    }
    return process.exitValue();
  }
}
