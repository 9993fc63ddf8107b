package uk.curriculum.triplestore.tdb;

import org.apache.jena.graph.Graph;
import org.apache.jena.graph.Node;
import org.apache.jena.sparql.core.DatasetGraph;
import org.apache.jena.sparql.core.DatasetGraphWrapper;
import org.apache.jena.sparql.core.Quad;

/**
 * Update view of a union-default-graph store: writes aimed at the default graph land in a named
 * graph, the only place queries without GRAPH can see them.
 */
class DefaultGraphRedirect extends DatasetGraphWrapper {
  private final Node target;

  DefaultGraphRedirect(DatasetGraph dsg, Node target) {
    super(dsg);
    this.target = target;
  }

  @Override
  public Graph getDefaultGraph() {
    return getWrapped().getGraph(target);
  }

  @Override
  public void add(Quad quad) {
    super.add(redirect(quad));
  }

  @Override
  public void delete(Quad quad) {
    super.delete(redirect(quad));
  }

  @Override
  public void add(Node g, Node s, Node p, Node o) {
    super.add(redirect(g), s, p, o);
  }

  @Override
  public void delete(Node g, Node s, Node p, Node o) {
    super.delete(redirect(g), s, p, o);
  }

  @Override
  public void deleteAny(Node g, Node s, Node p, Node o) {
    super.deleteAny(redirect(g), s, p, o);
  }

  private Quad redirect(Quad quad) {
    return quad.isDefaultGraph() ? Quad.create(target, quad.asTriple()) : quad;
  }

  // null and ANY mean every graph
  private Node redirect(Node g) {
    return g != null && Quad.isDefaultGraph(g) ? target : g;
  }
}
