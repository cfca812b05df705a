package amc.process;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import amc.error.EvaluationCancelledException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class ResourceGuardTest {

  @Test
  void closeDeletesRegisteredFiles() throws Exception {
    Path created;
    try (ResourceGuard guard = ResourceGuard.open()) {
      created = guard.createTempFile("amc-test-", ".cnf");
      assertTrue(Files.exists(created));
      assertEquals(Set.of(created), guard.registeredPaths());
    }
    assertFalse(Files.exists(created), "Temp file removed on close");
  }

  @Test
  void deleteDeregistersImmediately() {
    try (ResourceGuard guard = ResourceGuard.open()) {
      Path created = guard.createTempFile("amc-test-", ".nnf");
      guard.delete(created);
      assertFalse(Files.exists(created));
      assertTrue(guard.registeredPaths().isEmpty());
    }
  }

  @Test
  void registeredForeignPathsAreRemovedToo(@TempDir Path dir) throws Exception {
    Path sibling = dir.resolve("input.cnf.nnf");
    try (ResourceGuard guard = ResourceGuard.open()) {
      guard.register(sibling, ResourceKind.FILE);
      Files.writeString(sibling, "nnf 0 0 0\n");
    }
    assertFalse(Files.exists(sibling));
  }

  @Test
  void cancelledGuardRefusesNewWork() {
    try (ResourceGuard guard = ResourceGuard.open()) {
      Path created = guard.createTempFile("amc-test-", ".cnf");
      guard.cancel();
      assertTrue(guard.isCancelled());
      assertFalse(Files.exists(created), "Cancel cleans up at once");
      assertThrows(EvaluationCancelledException.class, guard::checkNotCancelled);
      assertThrows(
          EvaluationCancelledException.class, () -> guard.createTempFile("amc-test-", ".cnf"));
    }
  }

  @Test
  void closedGuardRejectsPathsWithoutLeakingFiles() throws Exception {
    ResourceGuard guard = ResourceGuard.open();
    guard.close();
    assertThrows(
        IllegalStateException.class,
        () -> guard.register(Path.of("late.cnf"), ResourceKind.FILE));

    String prefix = "amc-closed-" + System.nanoTime() + "-";
    assertThrows(IllegalStateException.class, () -> guard.createTempFile(prefix, ".cnf"));
    Path tmp = Path.of(System.getProperty("java.io.tmpdir"));
    try (Stream<Path> files = Files.list(tmp)) {
      assertEquals(
          0,
          files.filter(path -> path.getFileName().toString().startsWith(prefix)).count(),
          "Temp file created for a closed guard is removed again");
    }
  }

  @Test
  void cancelAllReachesEveryOpenGuard() {
    try (ResourceGuard first = ResourceGuard.open();
        ResourceGuard second = ResourceGuard.open()) {
      ResourceGuard.cancelAll();
      assertTrue(first.isCancelled());
      assertTrue(second.isCancelled());
    }
  }
}
