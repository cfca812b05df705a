package amc.process;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import amc.error.BackendFailureException;
import amc.error.EvaluationCancelledException;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

@EnabledOnOs({OS.LINUX, OS.MAC})
final class ProcessRunnerTest {

  @Test
  void feedsStdinAndCollectsStdout() {
    try (ResourceGuard guard = ResourceGuard.open()) {
      ProcessResult result = ProcessRunner.run(guard, "cat", List.of("cat"), "p cnf 1 1\n1 0\n");
      assertEquals(0, result.exitCode());
      assertEquals("p cnf 1 1\n1 0\n", result.stdout());
    }
  }

  @Test
  void largeOutputDoesNotStall() {
    try (ResourceGuard guard = ResourceGuard.open()) {
      ProcessResult result =
          ProcessRunner.run(guard, "seq", List.of("seq", "1", "200000")).requireSuccess();
      String[] lines = result.stdout().split("\n");
      assertEquals(200000, lines.length);
      assertEquals("200000", lines[lines.length - 1]);
    }
  }

  @Test
  void exitCodesAreCheckedOnRequest() {
    try (ResourceGuard guard = ResourceGuard.open()) {
      ProcessResult result =
          ProcessRunner.run(guard, "solver", List.of("sh", "-c", "echo oops >&2; exit 20"));
      assertEquals(20, result.exitCode());
      assertEquals("oops\n", result.stderr());
      result.requireExitCode(Set.of(10, 20));
      BackendFailureException failure =
          assertThrows(BackendFailureException.class, result::requireSuccess);
      assertEquals(20, failure.exitCode());
      assertEquals("solver", failure.backend());
    }
  }

  @Test
  void missingExecutableIsABackendFailure() {
    try (ResourceGuard guard = ResourceGuard.open()) {
      BackendFailureException failure =
          assertThrows(
              BackendFailureException.class,
              () -> ProcessRunner.run(guard, "ghost", List.of("/nonexistent/amc-backend")));
      assertEquals(-1, failure.exitCode());
    }
  }

  @Test
  void cancellingKillsRunningProcesses() {
    try (ResourceGuard guard = ResourceGuard.open();
        ExternalProcess process = ExternalProcess.start(guard, "sleep", List.of("sleep", "30"))) {
      guard.cancel();
      assertThrows(EvaluationCancelledException.class, process::waitFor);
      assertFalse(process.isAlive());
    }
  }

  @Test
  void cancelledGuardStartsNothing() {
    try (ResourceGuard guard = ResourceGuard.open()) {
      guard.cancel();
      assertThrows(
          EvaluationCancelledException.class,
          () -> ProcessRunner.run(guard, "cat", List.of("cat"), ""));
    }
  }

  @Test
  void terminateStopsALongRunningProcess() {
    try (ResourceGuard guard = ResourceGuard.open();
        ExternalProcess process = ExternalProcess.start(guard, "sleep", List.of("sleep", "30"))) {
      process.terminate(Duration.ofSeconds(5));
      assertFalse(process.isAlive());
    }
  }
}
