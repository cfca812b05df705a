package amc.process;

/** What a registered path is, which decides how it is cleaned up. */
public enum ResourceKind {
  FILE,
  PIPE
}
