package amc.backend;

import amc.cnf.WeightedCnf;
import amc.semiring.Semiring;
import amc.semiring.Semirings;
import java.util.BitSet;
import java.util.List;

/**
 * Evaluates an X/D-constrained circuit of a two-level instance. Sub-circuits over level-1
 * variables only are counted in the level-1 semiring; where they meet level-0 structure their
 * values are mapped through the transform and counting continues in the level-0 semiring.
 * Constants stay untyped until they are combined with a typed value.
 *
 * <p>Level-1 variables missing below a level-0 node are summed out in the level-1 semiring and
 * folded as one factor.
 */
public final class ConstrainedCircuitEvaluator implements CircuitEvaluator {

  private enum Level {
    INNER,
    OUTER,
    NEUTRAL
  }

  private record Value(Level level, List<Object> values, boolean truth) {
    static Value neutral(boolean truth) {
      return new Value(Level.NEUTRAL, null, truth);
    }
  }

  @Override
  public List<Object> evaluate(NnfCircuit circuit, WeightedCnf cnf) {
    if (!cnf.isTwoLevel()) {
      throw new IllegalArgumentException("Constrained evaluation needs a two-level instance");
    }
    return new Run(circuit, cnf).evaluate();
  }

  private static final class Run {
    private final NnfCircuit circuit;
    private final WeightedCnf cnf;
    private final Semiring<Object> inner;
    private final Semiring<Object> outer;
    private final int queries;
    private final BitSet outerVariables = new BitSet();

    Run(NnfCircuit circuit, WeightedCnf cnf) {
      this.circuit = circuit;
      this.cnf = cnf;
      this.inner = cnf.semiringOfLevel(1);
      this.outer = cnf.semiringOfLevel(0);
      this.queries = cnf.queryCount();
      for (int variable : cnf.quantified().get(0)) {
        outerVariables.set(variable);
      }
    }

    List<Object> evaluate() {
      Value[] values = new Value[circuit.size()];
      for (int node : circuit.postOrder()) {
        values[node] =
            switch (circuit.kind(node)) {
              case LITERAL -> literal(circuit.literal(node));
              case TRUE -> Value.neutral(true);
              case FALSE -> Value.neutral(false);
              case AND -> and(node, values);
              case OR -> or(node, values);
            };
      }
      BitSet all = new BitSet();
      all.set(1, cnf.nrVars() + 1);
      Value root = values[circuit.root()];
      BitSet missing = SmoothingCircuitEvaluator.missing(all, circuit.variables(circuit.root()));
      if (root.level() == Level.INNER) {
        BitSet innerMissing = (BitSet) missing.clone();
        innerMissing.andNot(outerVariables);
        missing.and(outerVariables);
        List<Object> counted = smooth(inner, root.values(), innerMissing);
        return smooth(outer, cnf.foldToOuter(counted), missing);
      }
      return smoothOuter(toOuter(root), missing);
    }

    private Value literal(int literal) {
      SmoothingCircuitEvaluator.checkLiteral(literal, cnf);
      Level level = outerVariables.get(Math.abs(literal)) ? Level.OUTER : Level.INNER;
      return new Value(level, cnf.weight(literal), true);
    }

    private Value and(int node, Value[] values) {
      Level level = Level.NEUTRAL;
      boolean truth = true;
      for (int child : circuit.children(node)) {
        Value value = values[child];
        if (value.level() == Level.OUTER) {
          level = Level.OUTER;
        } else if (value.level() == Level.INNER && level == Level.NEUTRAL) {
          level = Level.INNER;
        } else if (value.level() == Level.NEUTRAL) {
          truth &= value.truth();
        }
      }
      if (level == Level.NEUTRAL) {
        return Value.neutral(truth);
      }
      Semiring<Object> semiring = level == Level.OUTER ? outer : inner;
      List<Object> product = Semirings.filled(semiring.one(), queries);
      for (int child : circuit.children(node)) {
        List<Object> operand = level == Level.OUTER ? toOuter(values[child]) : toInner(values[child]);
        product = Semirings.multiply(semiring, product, operand);
      }
      return new Value(level, product, true);
    }

    private Value or(int node, Value[] values) {
      BitSet scope = circuit.variables(node);
      Level level = scope.intersects(outerVariables) ? Level.OUTER : Level.NEUTRAL;
      boolean truth = false;
      for (int child : circuit.children(node)) {
        Value value = values[child];
        if (value.level() == Level.OUTER) {
          level = Level.OUTER;
        } else if (value.level() == Level.INNER && level == Level.NEUTRAL) {
          level = Level.INNER;
        } else if (value.level() == Level.NEUTRAL) {
          truth |= value.truth();
        }
      }
      if (level == Level.NEUTRAL) {
        return Value.neutral(truth);
      }
      Semiring<Object> semiring = level == Level.OUTER ? outer : inner;
      List<Object> sum = Semirings.filled(semiring.zero(), queries);
      for (int child : circuit.children(node)) {
        BitSet missing = SmoothingCircuitEvaluator.missing(scope, circuit.variables(child));
        List<Object> operand =
            level == Level.OUTER
                ? smoothOuter(toOuter(values[child]), missing)
                : smooth(inner, toInner(values[child]), missing);
        sum = Semirings.add(semiring, sum, operand);
      }
      return new Value(level, sum, true);
    }

    private List<Object> toInner(Value value) {
      if (value.level() == Level.NEUTRAL) {
        return Semirings.filled(value.truth() ? inner.one() : inner.zero(), queries);
      }
      return value.values();
    }

    private List<Object> toOuter(Value value) {
      return switch (value.level()) {
        case NEUTRAL -> Semirings.filled(value.truth() ? outer.one() : outer.zero(), queries);
        case INNER -> cnf.foldToOuter(value.values());
        case OUTER -> value.values();
      };
    }

    /** Multiplies in the free sums of {@code missing}, split by level. */
    private List<Object> smoothOuter(List<Object> value, BitSet missing) {
      BitSet innerMissing = (BitSet) missing.clone();
      innerMissing.andNot(outerVariables);
      BitSet outerMissing = (BitSet) missing.clone();
      outerMissing.and(outerVariables);
      List<Object> result = smooth(outer, value, outerMissing);
      if (!innerMissing.isEmpty()) {
        List<Object> factor = smooth(inner, Semirings.filled(inner.one(), queries), innerMissing);
        result = Semirings.multiply(outer, result, cnf.foldToOuter(factor));
      }
      return result;
    }

    private List<Object> smooth(Semiring<Object> semiring, List<Object> value, BitSet missing) {
      List<Object> result = value;
      for (int v = missing.nextSetBit(0); v >= 0; v = missing.nextSetBit(v + 1)) {
        result =
            Semirings.multiply(semiring, result, Semirings.add(semiring, cnf.weight(v), cnf.weight(-v)));
      }
      return result;
    }
  }
}
