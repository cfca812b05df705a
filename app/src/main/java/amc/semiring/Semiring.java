package amc.semiring;

/**
 * An algebraic value domain for model counting.
 *
 * <p>{@link #add} must be commutative and associative, {@link #multiply} associative and
 * distributive over {@code add}, with {@link #zero()} and {@link #one()} their neutral elements.
 * {@link #format} is the inverse of {@link #parse} up to the precision of the value type.
 *
 * @param <T> value type carried by the semiring
 */
public interface Semiring<T> {

  /** Registry name, as written in {@code c p semirings} lines. */
  String name();

  T zero();

  T one();

  T add(T left, T right);

  T multiply(T left, T right);

  T parse(String text);

  String format(T value);

  /** True if {@code add(a, a) == a} for every value. */
  boolean isIdempotent();

  /**
   * Complement used when deriving weights for default-negated literals. Not required to be an
   * inverse.
   */
  T negate(T value);

  /** Lifts a plain number, typically the result of a cross-semiring transform. */
  T fromValue(double value);

  /** Numeric projection of a value; component 0 is the value used for comparisons. */
  double[] components(T value);

  /** How values map onto the additive scale of a MaxSAT objective. */
  default MaxSatScale maxSatScale() {
    return MaxSatScale.UNSUPPORTED;
  }

  /** Mapping of idempotent semiring values onto a common "larger is better" additive scale. */
  enum MaxSatScale {
    /** Values already add up along an assignment (max-plus). */
    IDENTITY,
    /** Values multiply along an assignment; take logarithms (max-times). */
    LOGARITHM,
    /** Smaller is better; negate (min-plus). */
    NEGATION,
    UNSUPPORTED
  }
}
