package amc.cnf;

import amc.backend.SatSolver;
import amc.error.FormatException;
import amc.graph.Graph;
import amc.graph.Hypergraph;
import amc.process.ResourceGuard;
import amc.semiring.Semiring;
import amc.semiring.SemiringRegistry;
import amc.semiring.Semirings;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A CNF with per-literal weight vectors over up to two semirings.
 *
 * <p>Each weight is a vector with one value per query; all vectors share the same length. With
 * one semiring every variable lives on level 0. With two semirings the variables are split into
 * two quantification levels: level 1 is eliminated first, its values are mapped through the
 * {@link Transform} into the level-0 semiring, and level 0 is eliminated last. Without any
 * semiring the instance is a plain model counting problem over {@link
 * SemiringRegistry#counting()} with unit weights.
 *
 * <p>Weights, semirings, levels and the transform are fixed at construction. Clauses change only
 * through {@link #removeTrivialClauses()} and {@link #replaceClauses} (preprocessing).
 */
public final class WeightedCnf {
  private static final Logger LOG = LoggerFactory.getLogger(WeightedCnf.class);

  private int nrVars;
  private final List<List<Integer>> clauses;
  private final Map<Integer, List<Object>> weights;
  private final List<Semiring<?>> semirings;
  private final List<Set<Integer>> quantified;
  private final Transform transform;
  private final int queryCount;

  private WeightedCnf(Builder builder, int queryCount) {
    this.nrVars = builder.nrVars;
    this.clauses = new ArrayList<>(builder.clauses);
    this.weights = new LinkedHashMap<>(builder.weights);
    this.semirings = List.copyOf(builder.semirings);
    List<Set<Integer>> levels = new ArrayList<>();
    for (Set<Integer> level : builder.quantified) {
      levels.add(Collections.unmodifiableSet(new LinkedHashSet<>(level)));
    }
    this.quantified = Collections.unmodifiableList(levels);
    this.transform = builder.transform;
    this.queryCount = queryCount;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Parses the extended DIMACS format.
   *
   * @throws FormatException if the text is malformed or violates the instance invariants
   */
  public static WeightedCnf parse(String text) {
    return parse(new StringReader(text));
  }

  public static WeightedCnf parse(Reader reader) {
    return new WeightedCnfParser().parse(reader);
  }

  public static WeightedCnf fromFile(Path path) throws IOException {
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return parse(reader);
    }
  }

  public int nrVars() {
    return nrVars;
  }

  public List<List<Integer>> clauses() {
    return Collections.unmodifiableList(clauses);
  }

  public List<Semiring<?>> semirings() {
    return semirings;
  }

  public List<Set<Integer>> quantified() {
    return quantified;
  }

  public Optional<Transform> transform() {
    return Optional.ofNullable(transform);
  }

  /** Number of queries, i.e. the length of every weight vector. */
  public int queryCount() {
    return queryCount;
  }

  public boolean isTwoLevel() {
    return semirings.size() == 2;
  }

  /** Semiring in which the final result is expressed. */
  public Semiring<Object> outerSemiring() {
    return semiringOfLevel(0);
  }

  public Semiring<Object> semiringOfLevel(int level) {
    if (semirings.isEmpty()) {
      return Semirings.erase(SemiringRegistry.counting());
    }
    return Semirings.erase(semirings.get(level));
  }

  /** Quantification level of {@code variable}: 0 for single-level instances. */
  public int levelOf(int variable) {
    for (int level = 0; level < quantified.size(); level++) {
      if (quantified.get(level).contains(variable)) {
        return level;
      }
    }
    return 0;
  }

  public Semiring<Object> semiringOf(int variable) {
    return semiringOfLevel(levelOf(variable));
  }

  /** Weight vector of {@code literal}; literals without a declared weight weigh {@code one()}. */
  public List<Object> weight(int literal) {
    List<Object> declared = weights.get(literal);
    if (declared != null) {
      return declared;
    }
    return Semirings.filled(semiringOf(Math.abs(literal)).one(), queryCount);
  }

  public boolean hasWeight(int literal) {
    return weights.containsKey(literal);
  }

  /** Declared weights in declaration order. */
  public Map<Integer, List<Object>> weights() {
    return Collections.unmodifiableMap(weights);
  }

  /** Variables whose positive and negative literal weigh differently. */
  public Set<Integer> contributingVariables() {
    Set<Integer> contributing = new TreeSet<>();
    for (int v = 1; v <= nrVars; v++) {
      if (!weight(v).equals(weight(-v))) {
        contributing.add(v);
      }
    }
    return contributing;
  }

  public Set<Integer> nonContributingVariables() {
    Set<Integer> nonContributing = new TreeSet<>();
    for (int v = 1; v <= nrVars; v++) {
      if (weight(v).equals(weight(-v))) {
        nonContributing.add(v);
      }
    }
    return nonContributing;
  }

  /** Graph on {@code 1..nrVars} with an edge between any two variables sharing a clause. */
  public Graph primalGraph() {
    Graph graph = new Graph();
    for (int v = 1; v <= nrVars; v++) {
      graph.addVertex(v);
    }
    for (List<Integer> clause : clauses) {
      for (int i = 0; i < clause.size(); i++) {
        for (int j = i + 1; j < clause.size(); j++) {
          graph.addEdge(Math.abs(clause.get(i)), Math.abs(clause.get(j)));
        }
      }
    }
    return graph;
  }

  /** Hypergraph on {@code 1..nrVars} with one hyperedge per clause. */
  public Hypergraph primalHypergraph() {
    Hypergraph hypergraph = new Hypergraph();
    for (int v = 1; v <= nrVars; v++) {
      hypergraph.addVertex(v);
    }
    for (List<Integer> clause : clauses) {
      Set<Integer> edge = new LinkedHashSet<>();
      for (int literal : clause) {
        edge.add(Math.abs(literal));
      }
      hypergraph.addEdge(edge);
    }
    return hypergraph;
  }

  /** Drops every clause that contains a literal together with its negation. */
  public void removeTrivialClauses() {
    Iterator<List<Integer>> it = clauses.iterator();
    while (it.hasNext()) {
      List<Integer> clause = it.next();
      Set<Integer> literals = new LinkedHashSet<>(clause);
      for (int literal : clause) {
        if (literals.contains(-literal)) {
          it.remove();
          break;
        }
      }
    }
  }

  /** Replaces the clause set, e.g. with the output of a preprocessor. */
  public void replaceClauses(int newNrVars, List<List<Integer>> newClauses) {
    List<List<Integer>> checked = new ArrayList<>(newClauses.size());
    for (List<Integer> clause : newClauses) {
      checked.add(checkClause(clause, newNrVars));
    }
    if (newNrVars != nrVars) {
      LOG.warn("Variable count changed from {} to {}", nrVars, newNrVars);
    }
    nrVars = newNrVars;
    clauses.clear();
    clauses.addAll(checked);
  }

  /**
   * Flat weight table: entry {@code 2(v-1)} is the weight of {@code v}, entry {@code 2(v-1)+1}
   * the weight of {@code -v}.
   */
  public WeightsView weightsView() {
    List<List<Object>> flat = new ArrayList<>(2 * nrVars);
    for (int v = 1; v <= nrVars; v++) {
      flat.add(weight(v));
      flat.add(weight(-v));
    }
    Semiring<Object> semiring = outerSemiring();
    return new WeightsView(flat, semiring.zero(), semiring.one(), semiring);
  }

  /**
   * Answers instances that need no counting: no clauses left after removing trivial ones, or
   * unsatisfiable clauses. Returns empty otherwise.
   */
  public Optional<List<Object>> evaluateTrivial(SatSolver solver, ResourceGuard guard) {
    return TrivialEvaluator.evaluate(this, solver, guard);
  }

  /** Maps level-1 values into the level-0 semiring through the transform. */
  public List<Object> foldToOuter(List<Object> innerValues) {
    if (!isTwoLevel()) {
      throw new IllegalStateException("Only two-level instances have a transform");
    }
    Semiring<Object> inner = semiringOfLevel(1);
    Semiring<Object> outer = semiringOfLevel(0);
    List<Object> folded = new ArrayList<>(innerValues.size());
    for (Object value : innerValues) {
      folded.add(transform.fold(inner, outer, value));
    }
    return Collections.unmodifiableList(folded);
  }

  /**
   * Serializes to the extended DIMACS format. Without extras only the header and clauses are
   * written, for backends that reject weight lines.
   */
  public String serialize(boolean extras) {
    return WeightedCnfWriter.write(this, extras);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof WeightedCnf that)) {
      return false;
    }
    return nrVars == that.nrVars
        && clauses.equals(that.clauses)
        && weights.equals(that.weights)
        && semirings.equals(that.semirings)
        && quantified.equals(that.quantified)
        && Objects.equals(transform, that.transform);
  }

  @Override
  public int hashCode() {
    return Objects.hash(nrVars, clauses, weights, semirings, quantified, transform);
  }

  @Override
  public String toString() {
    return serialize(true);
  }

  private static List<Integer> checkClause(List<Integer> clause, int nrVars) {
    for (int literal : clause) {
      if (literal == 0 || Math.abs(literal) > nrVars) {
        throw new FormatException(
            "Literal " + literal + " outside the declared " + nrVars + " variables");
      }
    }
    return List.copyOf(clause);
  }

  /** Collects clauses, weights and levels; {@link #build()} checks the instance invariants. */
  public static final class Builder {
    private int nrVars;
    private final List<List<Integer>> clauses = new ArrayList<>();
    private final Map<Integer, List<Object>> weights = new LinkedHashMap<>();
    private final List<Semiring<?>> semirings = new ArrayList<>();
    private final List<Set<Integer>> quantified = new ArrayList<>();
    private Transform transform;

    private Builder() {}

    public Builder nrVars(int nrVars) {
      if (nrVars < 0) {
        throw new IllegalArgumentException("Negative variable count " + nrVars);
      }
      this.nrVars = nrVars;
      return this;
    }

    public Builder addClause(int... literals) {
      List<Integer> clause = new ArrayList<>(literals.length);
      for (int literal : literals) {
        clause.add(literal);
      }
      return addClause(clause);
    }

    public Builder addClause(List<Integer> literals) {
      clauses.add(List.copyOf(literals));
      return this;
    }

    public Builder weight(int literal, Object... values) {
      return weight(literal, List.of(values));
    }

    public Builder weight(int literal, List<?> values) {
      if (literal == 0) {
        throw new IllegalArgumentException("Literal 0 cannot carry a weight");
      }
      weights.put(literal, Collections.unmodifiableList(new ArrayList<>(values)));
      return this;
    }

    public Builder semiring(Semiring<?> semiring) {
      semirings.add(Objects.requireNonNull(semiring, "semiring"));
      return this;
    }

    public Builder semiring(String name) {
      return semiring(SemiringRegistry.lookup(name));
    }

    public Builder quantify(Collection<Integer> variables) {
      quantified.add(new LinkedHashSet<>(variables));
      return this;
    }

    public Builder quantify(int... variables) {
      Set<Integer> level = new LinkedHashSet<>();
      for (int variable : variables) {
        level.add(variable);
      }
      quantified.add(level);
      return this;
    }

    /** Adds a level holding every variable {@code 1..nrVars}. */
    public Builder quantifyAll() {
      Set<Integer> level = new LinkedHashSet<>();
      for (int v = 1; v <= nrVars; v++) {
        level.add(v);
      }
      quantified.add(level);
      return this;
    }

    public Builder transform(Transform transform) {
      this.transform = transform;
      return this;
    }

    public Builder transform(String source) {
      return transform(Transform.parse(source));
    }

    /** @throws FormatException if the collected instance violates an invariant */
    public WeightedCnf build() {
      List<List<Integer>> checked = new ArrayList<>(clauses.size());
      for (List<Integer> clause : clauses) {
        checked.add(checkClause(clause, nrVars));
      }
      clauses.clear();
      clauses.addAll(checked);
      if (semirings.size() > 2) {
        throw new FormatException("At most two semirings are supported, got " + semirings.size());
      }
      if (semirings.size() != quantified.size()) {
        throw new FormatException(
            "We must have the same number of semirings and quantifiers, got "
                + semirings.size()
                + " and "
                + quantified.size());
      }
      if (semirings.size() == 2 && transform == null) {
        throw new FormatException("Two semirings need a transform");
      }
      if (semirings.size() != 2 && transform != null) {
        throw new FormatException("A transform is only allowed with two semirings");
      }
      if (semirings.isEmpty() && !weights.isEmpty()) {
        throw new FormatException("Weights need a semiring");
      }
      checkLevels();
      return new WeightedCnf(this, checkWeights());
    }

    private void checkLevels() {
      if (quantified.isEmpty()) {
        return;
      }
      Set<Integer> seen = new TreeSet<>();
      for (Set<Integer> level : quantified) {
        for (int variable : level) {
          if (variable < 1 || variable > nrVars) {
            throw new FormatException("Quantified variable " + variable + " does not exist");
          }
          if (!seen.add(variable)) {
            throw new FormatException("Variable " + variable + " is quantified on two levels");
          }
        }
      }
      if (seen.size() != nrVars) {
        Set<Integer> missing = new TreeSet<>();
        for (int v = 1; v <= nrVars; v++) {
          if (!seen.contains(v)) {
            missing.add(v);
          }
        }
        throw new FormatException("Variables " + missing + " are not quantified");
      }
    }

    private int checkWeights() {
      int length = -1;
      for (Map.Entry<Integer, List<Object>> entry : weights.entrySet()) {
        int literal = entry.getKey();
        if (Math.abs(literal) > nrVars) {
          throw new FormatException("Weight for unknown literal " + literal);
        }
        int size = entry.getValue().size();
        if (size == 0) {
          throw new FormatException("Empty weight vector for literal " + literal);
        }
        if (length >= 0 && size != length) {
          throw new FormatException(
              "Weight vector of literal " + literal + " has " + size + " values, expected " + length);
        }
        length = size;
      }
      return length < 0 ? 1 : length;
    }
  }
}
