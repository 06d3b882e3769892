package migrator.plan;

import migrator.Migration;
import migrator.exceptions.DependencyException;

import java.util.*;

/**
 * Directed acyclic graph of migrations, keyed by node index.
 *
 * <p>Nodes are stored in insertion order in a growable list and referenced by
 * their {@code int} index; edges point from a dependency to its dependent and
 * are kept as index lists in both directions. Nodes never reference each
 * other directly.
 *
 * <p>The graph enforces acyclicity on every {@link #addEdge(int, int)}: an edge
 * that would close a cycle is rejected and the graph is left untouched. Id
 * uniqueness and dependency resolution are the caller's concern (see
 * {@link migrator.engine.Migrator}).
 *
 * <p>Not thread-safe.
 *
 * @param <M> the migration type stored in the nodes
 */
public final class DependencyGraph<M extends Migration> {

    private final List<M> nodes = new ArrayList<>();
    private final List<List<Integer>> outgoing = new ArrayList<>();
    private final List<List<Integer>> incoming = new ArrayList<>();

    /**
     * Adds a node. Always succeeds.
     *
     * @param migration the migration to store
     * @return the index of the new node
     */
    public int addNode(M migration) {
        Objects.requireNonNull(migration, "migration");
        nodes.add(migration);
        outgoing.add(new ArrayList<>());
        incoming.add(new ArrayList<>());
        return nodes.size() - 1;
    }

    /**
     * Adds an edge from a dependency to its dependent.
     *
     * <p>Before committing, checks whether {@code from} is reachable from
     * {@code to}; if it is (including {@code from == to}) the edge would close
     * a cycle and is rejected. Adding an edge that already exists is a no-op.
     *
     * @param from index of the dependency
     * @param to index of the dependent
     * @throws DependencyException of kind {@code CYCLE} if the edge would create a cycle
     * @throws IndexOutOfBoundsException if either index is not a node
     */
    public void addEdge(int from, int to) throws DependencyException {
        checkIndex(from);
        checkIndex(to);

        if (reachable(to, outgoing).contains(from)) {
            throw DependencyException.cycle(nodes.get(from).id(), nodes.get(to).id());
        }
        if (outgoing.get(from).contains(to)) {
            return;
        }
        outgoing.get(from).add(to);
        incoming.get(to).add(from);
    }

    /**
     * Returns all node indices in an order where every dependency precedes its
     * dependents.
     *
     * <p>Kahn's algorithm; among nodes that are ready at the same time the one
     * with the lowest index (earliest registered) goes first, so the order is
     * the same for the same graph.
     *
     * @return node indices in topological order
     * @throws IllegalStateException if the graph contains a cycle, which the
     *         edge checks make impossible
     */
    public List<Integer> toposort() {
        int n = nodes.size();
        int[] inDegree = new int[n];
        for (int i = 0; i < n; i++) {
            inDegree[i] = incoming.get(i).size();
        }

        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = 0; i < n; i++) {
            if (inDegree[i] == 0) ready.add(i);
        }

        List<Integer> order = new ArrayList<>(n);
        while (!ready.isEmpty()) {
            int idx = ready.poll();
            order.add(idx);
            for (int next : outgoing.get(idx)) {
                if (--inDegree[next] == 0) {
                    ready.add(next);
                }
            }
        }

        if (order.size() != n) {
            throw new IllegalStateException(
                    "Dependency graph is not acyclic: sorted " + order.size() + " of " + n + " migrations");
        }
        return order;
    }

    /**
     * Returns the node and everything it transitively depends on.
     *
     * @param node the start index
     * @return reachable indices following edges backward, including {@code node}
     */
    public Set<Integer> ancestors(int node) {
        checkIndex(node);
        return reachable(node, incoming);
    }

    /**
     * Returns the node and everything that transitively depends on it.
     *
     * @param node the start index
     * @return reachable indices following edges forward, including {@code node}
     */
    public Set<Integer> descendants(int node) {
        checkIndex(node);
        return reachable(node, outgoing);
    }

    /** Returns the indices of nodes without dependencies. */
    public Set<Integer> sources() {
        return externals(incoming);
    }

    /** Returns the indices of nodes without dependents. */
    public Set<Integer> sinks() {
        return externals(outgoing);
    }

    /** Returns the migration stored at {@code index}. */
    public M node(int index) {
        checkIndex(index);
        return nodes.get(index);
    }

    /** Returns the indices of the direct dependencies of {@code index}. */
    public List<Integer> dependenciesOf(int index) {
        checkIndex(index);
        return List.copyOf(incoming.get(index));
    }

    /** Returns the indices of the direct dependents of {@code index}. */
    public List<Integer> dependentsOf(int index) {
        checkIndex(index);
        return List.copyOf(outgoing.get(index));
    }

    /** Returns the number of nodes. */
    public int size() {
        return nodes.size();
    }

    /** Returns the total number of edges. */
    public int edgeCount() {
        int count = 0;
        for (List<Integer> out : outgoing) {
            count += out.size();
        }
        return count;
    }

    /**
     * Drops every node with an index of {@code size} or more, together with all
     * edges touching them.
     *
     * <p>Used to undo a failed batch registration; edges between the remaining
     * nodes are never touched by a batch, so the graph ends up exactly as it
     * was before the batch.
     */
    public void truncate(int size) {
        if (size < 0 || size > nodes.size()) {
            throw new IndexOutOfBoundsException("Cannot truncate to " + size + " of " + nodes.size());
        }
        while (nodes.size() > size) {
            int last = nodes.size() - 1;
            nodes.remove(last);
            outgoing.remove(last);
            incoming.remove(last);
        }
        for (List<Integer> out : outgoing) {
            out.removeIf(i -> i >= size);
        }
        for (List<Integer> in : incoming) {
            in.removeIf(i -> i >= size);
        }
    }

    // ===== internals =====

    private Set<Integer> reachable(int start, List<List<Integer>> edges) {
        Set<Integer> seen = new LinkedHashSet<>();
        Deque<Integer> toVisit = new ArrayDeque<>();
        toVisit.add(start);
        while (!toVisit.isEmpty()) {
            int idx = toVisit.poll();
            if (seen.add(idx)) {
                toVisit.addAll(edges.get(idx));
            }
        }
        return seen;
    }

    private Set<Integer> externals(List<List<Integer>> edges) {
        Set<Integer> result = new LinkedHashSet<>();
        for (int i = 0; i < edges.size(); i++) {
            if (edges.get(i).isEmpty()) result.add(i);
        }
        return result;
    }

    private void checkIndex(int index) {
        Objects.checkIndex(index, nodes.size());
    }
}
