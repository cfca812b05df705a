package amc.process;

import java.util.Objects;

/**
 * Outcome of an anytime computation: the best result produced so far and whether the computation
 * ran to completion or was stopped at its deadline.
 */
public record AnytimeResult<T>(T result, boolean completed) {
  public AnytimeResult {
    Objects.requireNonNull(result, "result");
  }
}
