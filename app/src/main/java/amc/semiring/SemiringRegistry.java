package amc.semiring;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Closed table of the available semirings. Names are resolved once, when a weighted CNF is built;
 * evaluation code only ever sees {@link Semiring} instances.
 */
public final class SemiringRegistry {
  private static final Map<String, Semiring<?>> SEMIRINGS = buildRegistry();

  private SemiringRegistry() {}

  /**
   * Resolves a semiring by name. A dotted module prefix such as {@code aspmc.semirings.} is
   * ignored, so files written by other tools load unchanged.
   *
   * @throws IllegalArgumentException if no semiring is registered under the name
   */
  public static Semiring<?> lookup(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Unknown semiring: " + name);
    }
    String normalized = name.trim();
    int lastDot = normalized.lastIndexOf('.');
    if (lastDot >= 0) {
      normalized = normalized.substring(lastDot + 1);
    }
    Semiring<?> semiring = SEMIRINGS.get(normalized.toLowerCase(Locale.ROOT));
    if (semiring == null) {
      throw new IllegalArgumentException("Unknown semiring: " + name);
    }
    return semiring;
  }

  public static boolean isRegistered(String name) {
    try {
      lookup(name);
      return true;
    } catch (IllegalArgumentException ex) {
      return false;
    }
  }

  public static Set<String> names() {
    return SEMIRINGS.keySet();
  }

  public static Semiring<Double> probabilistic() {
    return cast(SEMIRINGS.get(ProbabilisticSemiring.NAME));
  }

  public static Semiring<BigInteger> counting() {
    return cast(SEMIRINGS.get(CountingSemiring.NAME));
  }

  public static boolean isProbabilistic(Semiring<?> semiring) {
    return semiring != null && ProbabilisticSemiring.NAME.equals(semiring.name());
  }

  @SuppressWarnings("unchecked")
  private static <T> Semiring<T> cast(Semiring<?> semiring) {
    return (Semiring<T>) semiring;
  }

  private static Map<String, Semiring<?>> buildRegistry() {
    Map<String, Semiring<?>> semirings = new LinkedHashMap<>();
    register(semirings, new ProbabilisticSemiring());
    register(semirings, new MaxPlusSemiring());
    register(semirings, new MaxTimesSemiring());
    register(semirings, new MinPlusSemiring());
    register(semirings, new MaxPlusDecisionsSemiring());
    register(semirings, new MaxTimesDecisionsSemiring());
    register(semirings, new TwoNatSemiring());
    register(semirings, new CountingSemiring());
    return Map.copyOf(semirings);
  }

  private static void register(Map<String, Semiring<?>> semirings, Semiring<?> semiring) {
    semirings.put(semiring.name(), semiring);
  }
}
