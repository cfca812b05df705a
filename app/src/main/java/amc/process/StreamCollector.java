package amc.process;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/** Daemon thread that drains a process stream into memory so the child never blocks on a pipe. */
final class StreamCollector extends Thread {
  private final InputStream stream;
  private final StringBuilder content = new StringBuilder();
  private IOException failure;

  StreamCollector(InputStream stream, String name) {
    super(name);
    this.stream = stream;
    setDaemon(true);
  }

  static StreamCollector start(InputStream stream, String name) {
    StreamCollector collector = new StreamCollector(stream, name);
    collector.start();
    return collector;
  }

  @Override
  public void run() {
    try (BufferedReader reader =
        new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
      char[] buffer = new char[8192];
      int read;
      while ((read = reader.read(buffer)) != -1) {
        synchronized (content) {
          content.append(buffer, 0, read);
        }
      }
    } catch (IOException ex) {
      // a killed child closes its pipes under us
      failure = ex;
    }
  }

  /** Waits for the stream to reach end-of-file and returns everything read. */
  String await() throws InterruptedException {
    join();
    return content();
  }

  String content() {
    synchronized (content) {
      return content.toString();
    }
  }

  IOException failure() {
    return failure;
  }
}
