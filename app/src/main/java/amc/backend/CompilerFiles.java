package amc.backend;

import amc.error.BackendFailureException;
import amc.process.ResourceGuard;
import amc.process.ResourceKind;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Temp file helpers shared by the subprocess adapters. */
final class CompilerFiles {
  private CompilerFiles() {}

  static Path writeTemp(ResourceGuard guard, String backend, String suffix, String content) {
    Path path = guard.createTempFile("amc-", suffix);
    write(backend, path, content);
    return path;
  }

  static void write(String backend, Path path, String content) {
    try {
      Files.writeString(path, content, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new BackendFailureException(backend, "could not write " + path, ex);
    }
  }

  /** Registers {@code base + suffix}, a file a backend will create next to {@code base}. */
  static Path sibling(ResourceGuard guard, Path base, String suffix) {
    Path path = base.resolveSibling(base.getFileName() + suffix);
    guard.register(path, ResourceKind.FILE);
    return path;
  }

  static String read(String backend, Path path) {
    try {
      return Files.readString(path, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new BackendFailureException(backend, "could not read " + path, ex);
    }
  }

  static NnfCircuit readCircuit(String backend, Path path, NnfFormat format) {
    if (!Files.exists(path)) {
      throw new BackendFailureException(backend, "produced no circuit at " + path, null);
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return NnfParser.parse(reader, format);
    } catch (IOException ex) {
      throw new BackendFailureException(backend, "could not read " + path, ex);
    }
  }
}
