package amc.semiring;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Element-wise operations on value vectors (one value per query). Vectors are immutable lists and
 * the semiring is passed in erased form, because the two levels of a weighted CNF may carry
 * different value types.
 */
public final class Semirings {
  private Semirings() {}

  @SuppressWarnings("unchecked")
  public static Semiring<Object> erase(Semiring<?> semiring) {
    return (Semiring<Object>) semiring;
  }

  public static List<Object> filled(Object value, int size) {
    return Collections.nCopies(size, value);
  }

  public static List<Object> add(Semiring<Object> semiring, List<Object> left, List<Object> right) {
    checkSameLength(left, right);
    List<Object> result = new ArrayList<>(left.size());
    for (int i = 0; i < left.size(); i++) {
      result.add(semiring.add(left.get(i), right.get(i)));
    }
    return Collections.unmodifiableList(result);
  }

  public static List<Object> multiply(
      Semiring<Object> semiring, List<Object> left, List<Object> right) {
    checkSameLength(left, right);
    List<Object> result = new ArrayList<>(left.size());
    for (int i = 0; i < left.size(); i++) {
      result.add(semiring.multiply(left.get(i), right.get(i)));
    }
    return Collections.unmodifiableList(result);
  }

  public static List<String> format(Semiring<Object> semiring, List<Object> values) {
    List<String> formatted = new ArrayList<>(values.size());
    for (Object value : values) {
      formatted.add(semiring.format(value));
    }
    return formatted;
  }

  private static void checkSameLength(List<Object> left, List<Object> right) {
    if (left.size() != right.size()) {
      throw new IllegalArgumentException(
          "Weight vectors differ in length: " + left.size() + " vs " + right.size());
    }
  }
}
