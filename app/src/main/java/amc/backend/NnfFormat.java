package amc.backend;

/** Textual circuit formats produced by the supported knowledge compilers. */
public enum NnfFormat {
  /** {@code nnf} header with {@code L}, {@code A} and {@code O} node lines (c2d). */
  C2D,
  /** {@code o/a/t/f} node lines and literal-labelled edge lines (d4, sharpsat-td). */
  D4
}
