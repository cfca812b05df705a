package amc.graph;

/** Order in which {@link TreeDecomposition#iterate} visits bags. */
public enum TraversalOrder {
  /** Every child strictly before its parent. */
  POST_ORDER,
  /** Every parent before its children. */
  PRE_ORDER
}
