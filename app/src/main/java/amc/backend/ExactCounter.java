package amc.backend;

import amc.process.ResourceGuard;
import java.util.List;

/** External exact weighted model counter over the probabilistic semiring. */
public interface ExactCounter {

  /** Counts the weighted CNF in {@code cnfText}; one value per query. */
  List<Double> count(String cnfText, ResourceGuard guard);
}
