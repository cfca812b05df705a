package amc.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import amc.testing.GreedyTreewidthSolver;
import amc.testing.TestBackends;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class MainTest {

  private static final String PROBABILISTIC_OR =
      String.join(
          "\n",
          "p cnf 2 1",
          "1 2 0",
          "c p weight 1 0.5 0",
          "c p weight -1 0.5 0",
          "c p weight 2 0.5 0",
          "c p weight -2 0.5 0",
          "c p semirings probabilistic 0",
          "c p quantify 1 2 0",
          "");

  private static Path write(Path dir, String name, String content) throws Exception {
    Path file = dir.resolve(name);
    Files.writeString(file, content, StandardCharsets.UTF_8);
    return file;
  }

  @Test
  void helpExitsCleanly() {
    assertEquals(Main.EXIT_OK, Main.run(new String[] {"--help"}));
    assertEquals(Main.EXIT_OK, Main.run(new String[0]));
  }

  @Test
  void badOptionsAreConfigurationErrors() {
    assertEquals(Main.EXIT_CONFIGURATION, Main.run(new String[] {"--fast"}));
    assertEquals(Main.EXIT_CONFIGURATION, Main.run(new String[] {"--strategy", "fastest"}));
    assertEquals(
        Main.EXIT_CONFIGURATION, Main.run(new String[] {"evaluate", "/nonexistent/input.cnf"}));
  }

  @Test
  void malformedInputIsAFormatError(@TempDir Path dir) throws Exception {
    Path input = write(dir, "broken.cnf", "p cnf 2 1\n1 3 0\n");
    assertEquals(Main.EXIT_FORMAT, Main.run(new String[] {"evaluate", input.toString()}));
    assertEquals(Main.EXIT_FORMAT, Main.run(new String[] {"treewidth", input.toString()}));
  }

  @Test
  void evaluateWritesAJsonReport(@TempDir Path dir) throws Exception {
    Path input = write(dir, "or.cnf", PROBABILISTIC_OR);
    Path report = dir.resolve("report.json");
    CliOptions options =
        CliArguments.parse(
            new String[] {"evaluate", input.toString(), "--json", report.toString()});
    TestBackends backends = new TestBackends();
    int exitCode = new EvaluateCommand(opts -> backends.backends()).execute(options);
    assertEquals(Main.EXIT_OK, exitCode);

    JsonObject json = JsonParser.parseString(Files.readString(report)).getAsJsonObject();
    JsonObject meta = json.getAsJsonObject("meta");
    assertEquals("evaluate", meta.get("command").getAsString());
    assertEquals(input.toString(), meta.get("input").getAsString());
    assertEquals("compilation", meta.get("method").getAsString());
    assertEquals("probabilistic", json.get("semiring").getAsString());
    JsonArray results = json.getAsJsonArray("results");
    assertEquals(1, results.size());
    String value = results.get(0).getAsJsonObject().get("value").getAsString();
    assertEquals(0.75, Double.parseDouble(value), 1e-12);
  }

  @Test
  void treewidthReportsTheDecomposition(@TempDir Path dir) throws Exception {
    Path input = write(dir, "chain.cnf", "p cnf 4 3\n1 2 0\n2 3 0\n3 4 0\n");
    Path report = dir.resolve("tw.json");
    CliOptions options =
        CliArguments.parse(new String[] {"treewidth", input.toString(), "--json=" + report});
    GreedyTreewidthSolver solver = new GreedyTreewidthSolver();
    assertEquals(Main.EXIT_OK, new TreewidthCommand(solver).execute(options));
    assertEquals(1, solver.calls());

    JsonObject json = JsonParser.parseString(Files.readString(report)).getAsJsonObject();
    JsonObject treewidth = json.getAsJsonObject("treewidth");
    assertEquals(1, treewidth.get("width").getAsInt(), "A path has width one");
    assertEquals(4, treewidth.get("vertices").getAsInt());
    assertTrue(treewidth.get("bags").getAsInt() >= 3);
  }
}
