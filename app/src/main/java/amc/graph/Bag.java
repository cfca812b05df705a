package amc.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/** A node of a tree decomposition. Children are only meaningful once the tree is rooted. */
public final class Bag {
  private final int id;
  private final Set<Integer> vertices;
  private final List<Bag> children = new ArrayList<>();

  Bag(int id, Collection<Integer> vertices) {
    this.id = id;
    this.vertices = new TreeSet<>(vertices);
  }

  public int id() {
    return id;
  }

  public Set<Integer> vertices() {
    return Collections.unmodifiableSet(vertices);
  }

  public List<Bag> children() {
    return Collections.unmodifiableList(children);
  }

  public boolean containsAll(Collection<Integer> candidates) {
    return vertices.containsAll(candidates);
  }

  void removeVertices(Collection<Integer> removed) {
    vertices.removeAll(removed);
  }

  void replaceChildren(List<Bag> newChildren) {
    children.clear();
    children.addAll(newChildren);
  }

  @Override
  public String toString() {
    return "Bag{" + id + " " + vertices + "}";
  }
}
