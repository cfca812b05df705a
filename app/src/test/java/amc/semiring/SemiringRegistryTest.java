package amc.semiring;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import org.junit.jupiter.api.Test;

final class SemiringRegistryTest {

  @Test
  void resolvesNamesWithModulePrefix() {
    assertSame(
        SemiringRegistry.lookup("maxtimes"),
        SemiringRegistry.lookup("aspmc.semirings.maxtimes"),
        "Dotted prefix should be ignored");
    assertTrue(SemiringRegistry.isRegistered("two_nat"), "two_nat should be registered");
    assertFalse(SemiringRegistry.isRegistered("tropical"), "Unknown names are not registered");
    assertThrows(IllegalArgumentException.class, () -> SemiringRegistry.lookup("tropical"));
  }

  @Test
  void registryListsEverySemiring() {
    for (String name :
        new String[] {
          "probabilistic",
          "maxplus",
          "maxtimes",
          "minplus",
          "maxplusdecisions",
          "maxtimesdecisions",
          "two_nat",
          "counting"
        }) {
      assertTrue(SemiringRegistry.names().contains(name), "Missing semiring " + name);
      assertEquals(name, SemiringRegistry.lookup(name).name(), "Name should round-trip");
    }
  }

  @Test
  void idempotentSemiringsAreTheTropicalOnes() {
    for (String name : SemiringRegistry.names()) {
      Semiring<Object> semiring = Semirings.erase(SemiringRegistry.lookup(name));
      Object value = semiring.parse(sampleText(name));
      boolean idempotent = semiring.add(value, value).equals(value);
      if (semiring.isIdempotent()) {
        assertTrue(idempotent, name + " claims idempotence but a + a != a");
      } else {
        assertFalse(idempotent, name + " is idempotent on the sample but claims not to be");
      }
    }
  }

  @Test
  void neutralElementsBehave() {
    for (String name : SemiringRegistry.names()) {
      Semiring<Object> semiring = Semirings.erase(SemiringRegistry.lookup(name));
      Object value = semiring.parse(sampleText(name));
      assertEquals(value, semiring.add(value, semiring.zero()), name + ": a + 0 == a");
      assertEquals(value, semiring.multiply(value, semiring.one()), name + ": a * 1 == a");
      assertEquals(
          semiring.zero(), semiring.multiply(value, semiring.zero()), name + ": a * 0 == 0");
    }
  }

  @Test
  void formatAndParseAreInverse() {
    for (String name : SemiringRegistry.names()) {
      Semiring<Object> semiring = Semirings.erase(SemiringRegistry.lookup(name));
      Object value = semiring.parse(sampleText(name));
      assertEquals(value, semiring.parse(semiring.format(value)), name + " format/parse");
    }
  }

  @Test
  void tropicalOperations() {
    Semiring<Double> maxPlus = cast(SemiringRegistry.lookup("maxplus"));
    assertEquals(3.0, maxPlus.add(3.0, -1.0));
    assertEquals(2.0, maxPlus.multiply(3.0, -1.0));
    assertEquals(Double.NEGATIVE_INFINITY, maxPlus.zero());

    Semiring<Double> minPlus = cast(SemiringRegistry.lookup("minplus"));
    assertEquals(-1.0, minPlus.add(3.0, -1.0));
    assertEquals(Double.POSITIVE_INFINITY, minPlus.zero());

    Semiring<Double> maxTimes = cast(SemiringRegistry.lookup("maxtimes"));
    assertEquals(0.5, maxTimes.add(0.5, 0.25));
    assertEquals(0.125, maxTimes.multiply(0.5, 0.25));
  }

  @Test
  void decisionsFollowTheBetterOperand() {
    Semiring<DecisionValue> semiring = cast(SemiringRegistry.lookup("maxtimesdecisions"));
    DecisionValue left = semiring.parse("(0.5,1)");
    DecisionValue right = semiring.parse("(0.25,2)");
    assertEquals(BigInteger.ONE, semiring.add(left, right).decisions());
    DecisionValue product = semiring.multiply(left, right);
    assertEquals(0.125, product.value());
    assertEquals(BigInteger.valueOf(3), product.decisions(), "Decisions are joined");
    assertTrue(product.isDecided(0) && product.isDecided(1), "Both decisions are set");
    assertEquals(semiring.zero(), DecisionValue.of(0.0), "Zero of max-times decisions is 0");
  }

  @Test
  void countingUsesExactIntegers() {
    Semiring<BigInteger> counting = SemiringRegistry.counting();
    BigInteger big = counting.parse("123456789012345678901234567890");
    assertEquals(big.multiply(big), counting.multiply(big, big));
    assertFalse(counting.isIdempotent());
  }

  @Test
  void probabilisticIsRecognised() {
    assertTrue(SemiringRegistry.isProbabilistic(SemiringRegistry.probabilistic()));
    assertFalse(SemiringRegistry.isProbabilistic(SemiringRegistry.lookup("maxtimes")));
    assertEquals(0.25, SemiringRegistry.probabilistic().negate(0.75));
  }

  private static String sampleText(String name) {
    return switch (name) {
      case "maxplusdecisions", "maxtimesdecisions" -> "(0.5,3)";
      case "two_nat" -> "(2.0,3.0)";
      case "counting" -> "7";
      default -> "0.5";
    };
  }

  @SuppressWarnings("unchecked")
  private static <T> Semiring<T> cast(Semiring<?> semiring) {
    return (Semiring<T>) semiring;
  }
}
