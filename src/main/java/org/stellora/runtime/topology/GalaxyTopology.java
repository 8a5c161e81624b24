package org.stellora.runtime.topology;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;

/**
 * Undirected graph of planet identifiers.
 * <p>
 * Planets are addressed by id only; the graph never holds references to planet state,
 * so cycles in the galaxy do not create reference cycles. The set of critical nodes
 * (articulation points) is cached and recomputed lazily after every change of the
 * edge set.
 * <p>
 * <b>Thread safety:</b> a mutable topology is owned by the orchestrator thread.
 * {@link #frozenCopy()} produces an immutable instance with all derived data
 * precomputed, which may be read concurrently by any number of explorers.
 * <p>
 * All traversals visit neighbors in ascending id order, so paths and DFS trees are
 * deterministic.
 */
public class GalaxyTopology {

    private final Int2ObjectOpenHashMap<IntOpenHashSet> adjacency;
    private final boolean frozen;
    private IntSet criticalCache;
    private int edgeCount;

    public GalaxyTopology() {
        this.adjacency = new Int2ObjectOpenHashMap<>();
        this.frozen = false;
    }

    private GalaxyTopology(GalaxyTopology source, boolean frozen) {
        this.adjacency = new Int2ObjectOpenHashMap<>(source.adjacency.size());
        source.adjacency.int2ObjectEntrySet().forEach(entry ->
                this.adjacency.put(entry.getIntKey(), new IntOpenHashSet(entry.getValue())));
        this.edgeCount = source.edgeCount;
        this.frozen = frozen;
        if (frozen) {
            this.criticalCache = computeCriticalNodes();
        }
    }

    /**
     * @return a mutable deep copy.
     */
    public GalaxyTopology copy() {
        return new GalaxyTopology(this, false);
    }

    /**
     * @return an immutable deep copy, safe to share between threads.
     */
    public GalaxyTopology frozenCopy() {
        return frozen ? this : new GalaxyTopology(this, true);
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Adds an isolated node. Adding an existing node is a no-op.
     *
     * @param id The planet id.
     */
    public void addNode(int id) {
        checkMutable();
        if (!adjacency.containsKey(id)) {
            adjacency.put(id, new IntOpenHashSet());
            criticalCache = null;
        }
    }

    /**
     * Connects two planets, adding missing nodes. Connecting an existing edge is a no-op.
     *
     * @param a First planet id.
     * @param b Second planet id.
     * @throws IllegalArgumentException if {@code a == b}.
     */
    public void connect(int a, int b) {
        checkMutable();
        if (a == b) {
            throw new IllegalArgumentException("A planet cannot be connected to itself: " + a);
        }
        addNode(a);
        addNode(b);
        if (adjacency.get(a).add(b)) {
            adjacency.get(b).add(a);
            edgeCount++;
            criticalCache = null;
        }
    }

    /**
     * Removes a node and all its edges (planet destruction).
     *
     * @param id The planet id.
     * @return {@code true} if the node existed.
     */
    public boolean removeNode(int id) {
        checkMutable();
        IntOpenHashSet neighbors = adjacency.remove(id);
        if (neighbors == null) {
            return false;
        }
        neighbors.forEach((int n) -> {
            IntOpenHashSet back = adjacency.get(n);
            if (back != null) {
                back.remove(id);
            }
        });
        edgeCount -= neighbors.size();
        criticalCache = null;
        return true;
    }

    public boolean contains(int id) {
        return adjacency.containsKey(id);
    }

    public boolean areAdjacent(int a, int b) {
        IntOpenHashSet n = adjacency.get(a);
        return n != null && n.contains(b);
    }

    public int nodeCount() {
        return adjacency.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    /**
     * @return all node ids in ascending order.
     */
    public IntList nodes() {
        int[] ids = adjacency.keySet().toIntArray();
        Arrays.sort(ids);
        return IntArrayList.wrap(ids);
    }

    /**
     * @param id The planet id.
     * @return the neighbors of {@code id} in ascending order; empty for unknown ids.
     */
    public IntList neighbors(int id) {
        IntOpenHashSet n = adjacency.get(id);
        if (n == null) {
            return new IntArrayList();
        }
        int[] ids = n.toIntArray();
        Arrays.sort(ids);
        return IntArrayList.wrap(ids);
    }

    /**
     * An empty graph counts as connected.
     *
     * @return {@code true} if every node is reachable from every other node.
     */
    public boolean isConnected() {
        if (adjacency.isEmpty()) {
            return true;
        }
        return reachableFrom(nodes().getInt(0)).size() == adjacency.size();
    }

    /**
     * @return the connected components, each sorted, ordered by their smallest id.
     */
    public List<IntList> components() {
        List<IntList> result = new ArrayList<>();
        IntOpenHashSet seen = new IntOpenHashSet();
        for (int id : nodes()) {
            if (seen.contains(id)) {
                continue;
            }
            IntSet component = reachableFrom(id);
            seen.addAll(component);
            int[] members = component.toIntArray();
            Arrays.sort(members);
            result.add(IntArrayList.wrap(members));
        }
        return result;
    }

    /**
     * @param id The start node.
     * @return the set of nodes reachable from {@code id} (including itself); empty for unknown ids.
     */
    public IntSet reachableFrom(int id) {
        IntOpenHashSet visited = new IntOpenHashSet();
        if (!adjacency.containsKey(id)) {
            return visited;
        }
        ArrayDeque<Integer> queue = new ArrayDeque<>();
        queue.add(id);
        visited.add(id);
        while (!queue.isEmpty()) {
            int current = queue.poll();
            for (int n : adjacency.get(current)) {
                if (visited.add(n)) {
                    queue.add(n);
                }
            }
        }
        return visited;
    }

    /**
     * @param id Any node.
     * @return the sorted members of the component containing {@code id}; empty for unknown ids.
     */
    public IntList componentOf(int id) {
        int[] members = reachableFrom(id).toIntArray();
        Arrays.sort(members);
        return IntArrayList.wrap(members);
    }

    /**
     * Breadth-first distances from {@code id} to every reachable node.
     *
     * @param id The start node.
     * @return a map from reachable node to hop count (the start maps to 0).
     */
    public Int2IntOpenHashMap distancesFrom(int id) {
        Int2IntOpenHashMap distance = new Int2IntOpenHashMap();
        if (!adjacency.containsKey(id)) {
            return distance;
        }
        ArrayDeque<Integer> queue = new ArrayDeque<>();
        queue.add(id);
        distance.put(id, 0);
        while (!queue.isEmpty()) {
            int current = queue.poll();
            int d = distance.get(current);
            for (int n : neighbors(current)) {
                if (!distance.containsKey(n)) {
                    distance.put(n, d + 1);
                    queue.add(n);
                }
            }
        }
        return distance;
    }

    /**
     * Finds a shortest path with breadth-first search. Among equally short paths the
     * one through lower ids is chosen.
     *
     * @param from Start node.
     * @param to   Target node.
     * @return the hops to take, excluding {@code from} and ending with {@code to};
     *         an empty list if {@code from == to}; empty optional if unreachable.
     */
    public Optional<IntList> shortestPath(int from, int to) {
        if (!adjacency.containsKey(from) || !adjacency.containsKey(to)) {
            return Optional.empty();
        }
        if (from == to) {
            return Optional.of(new IntArrayList());
        }
        Int2IntOpenHashMap parent = new Int2IntOpenHashMap();
        ArrayDeque<Integer> queue = new ArrayDeque<>();
        queue.add(from);
        parent.put(from, from);
        while (!queue.isEmpty()) {
            int current = queue.poll();
            for (int n : neighbors(current)) {
                if (parent.containsKey(n)) {
                    continue;
                }
                parent.put(n, current);
                if (n == to) {
                    return Optional.of(reconstruct(parent, from, to));
                }
                queue.add(n);
            }
        }
        return Optional.empty();
    }

    private static IntList reconstruct(Int2IntOpenHashMap parent, int from, int to) {
        IntArrayList path = new IntArrayList();
        int current = to;
        while (current != from) {
            path.add(current);
            current = parent.get(current);
        }
        int[] reversed = path.toIntArray();
        for (int i = 0, j = reversed.length - 1; i < j; i++, j--) {
            int tmp = reversed[i];
            reversed[i] = reversed[j];
            reversed[j] = tmp;
        }
        return IntArrayList.wrap(reversed);
    }

    /**
     * Returns the articulation points: nodes whose removal increases the number of
     * connected components. For a disconnected graph the result is the union over all
     * components.
     *
     * @return an unmodifiable set of critical node ids.
     */
    public IntSet criticalNodes() {
        if (criticalCache == null) {
            criticalCache = computeCriticalNodes();
        }
        return criticalCache;
    }

    /**
     * Iterative Tarjan articulation-point search, O(V + E).
     * <p>
     * A non-root node {@code u} is critical if some DFS child {@code v} satisfies
     * {@code low[v] >= disc[u]}; a DFS root is critical if it has more than one child.
     */
    private IntSet computeCriticalNodes() {
        IntList ids = nodes();
        int n = ids.size();
        Int2IntOpenHashMap index = new Int2IntOpenHashMap(n);
        for (int i = 0; i < n; i++) {
            index.put(ids.getInt(i), i);
        }
        int[][] adj = new int[n][];
        for (int i = 0; i < n; i++) {
            IntList neighbors = neighbors(ids.getInt(i));
            adj[i] = new int[neighbors.size()];
            for (int j = 0; j < adj[i].length; j++) {
                adj[i][j] = index.get(neighbors.getInt(j));
            }
        }

        int[] disc = new int[n];
        int[] low = new int[n];
        int[] parent = new int[n];
        int[] nextEdge = new int[n];
        Arrays.fill(disc, -1);
        IntOpenHashSet critical = new IntOpenHashSet();
        int[] stack = new int[n];
        int time = 0;

        for (int root = 0; root < n; root++) {
            if (disc[root] != -1) {
                continue;
            }
            int top = 0;
            stack[top++] = root;
            disc[root] = low[root] = time++;
            parent[root] = -1;
            int rootChildren = 0;

            while (top > 0) {
                int u = stack[top - 1];
                if (nextEdge[u] < adj[u].length) {
                    int v = adj[u][nextEdge[u]++];
                    if (disc[v] == -1) {
                        parent[v] = u;
                        disc[v] = low[v] = time++;
                        if (u == root) {
                            rootChildren++;
                        }
                        stack[top++] = v;
                    } else if (v != parent[u]) {
                        low[u] = Math.min(low[u], disc[v]);
                    }
                } else {
                    top--;
                    int p = parent[u];
                    if (p != -1) {
                        low[p] = Math.min(low[p], low[u]);
                        if (parent[p] != -1 && low[u] >= disc[p]) {
                            critical.add(ids.getInt(p));
                        }
                    }
                }
            }
            if (rootChildren > 1) {
                critical.add(ids.getInt(root));
            }
        }
        return IntSets.unmodifiable(critical);
    }

    private void checkMutable() {
        if (frozen) {
            throw new UnsupportedOperationException("Topology is frozen");
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("GalaxyTopology{");
        for (int id : nodes()) {
            sb.append(id).append("->").append(neighbors(id)).append(' ');
        }
        return sb.append('}').toString();
    }
}
