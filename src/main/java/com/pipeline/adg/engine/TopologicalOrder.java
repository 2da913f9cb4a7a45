package com.pipeline.adg.engine;

import com.pipeline.adg.asset.AssetKey;
import com.pipeline.adg.asset.DependencyKind;
import com.pipeline.adg.error.CyclicDependencyException;
import com.pipeline.adg.error.DuplicateKeyException;
import com.pipeline.adg.error.UnknownDependencyException;

import java.util.*;

/**
 * CSR-encoded static DAG of asset keys.
 *
 * Built once per resolved graph and immutable afterwards. Index {@code i} is the
 * i-th key of one valid topological ordering, ties broken by ascending key so
 * the ordering is deterministic for a given declaration set.
 *
 * Data layout:
 * - topoOrder: keys in topological order; iterating 0..N visits upstreams first.
 * - childrenOffset/childrenList: children of node i are
 * childrenList[childrenOffset[i] .. childrenOffset[i+1]).
 * - parentOffset/parentList: same layout for parents, with the edge kind of each
 * parent entry in parentKinds.
 * - sourceWords: bitset of source nodes, 64 flags per long.
 */
public final class TopologicalOrder {
    private final AssetKey[] topoOrder;
    private final int[] childrenOffset;
    private final int[] childrenList;
    private final int[] parentOffset;
    private final int[] parentList;
    private final DependencyKind[] parentKinds;
    private final Map<AssetKey, Integer> keyToIndex;
    private final long[] sourceWords;

    private TopologicalOrder(AssetKey[] topoOrder, int[] childrenOffset, int[] childrenList,
            int[] parentOffset, int[] parentList, DependencyKind[] parentKinds,
            Map<AssetKey, Integer> keyToIndex, long[] sourceWords) {
        this.topoOrder = topoOrder;
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.parentOffset = parentOffset;
        this.parentList = parentList;
        this.parentKinds = parentKinds;
        this.keyToIndex = keyToIndex;
        this.sourceWords = sourceWords;
    }

    public int nodeCount() {
        return topoOrder.length;
    }

    public int edgeCount() {
        return childrenList.length;
    }

    /** Returns the key at the given topological index. */
    public AssetKey key(int ti) {
        return topoOrder[ti];
    }

    public boolean contains(AssetKey key) {
        return keyToIndex.containsKey(key);
    }

    /** Resolves a key to its topological index. */
    public int topoIndex(AssetKey key) {
        Integer idx = keyToIndex.get(key);
        if (idx == null)
            throw new UnknownDependencyException(key.toUserString(), "Unknown asset: " + key);
        return idx;
    }

    public boolean isSource(int ti) {
        return (sourceWords[ti >> 6] & (1L << ti)) != 0;
    }

    public int childCount(int ti) {
        return childrenOffset[ti + 1] - childrenOffset[ti];
    }

    public int child(int ti, int i) {
        return childrenList[childrenOffset[ti] + i];
    }

    public int parentCount(int ti) {
        return parentOffset[ti + 1] - parentOffset[ti];
    }

    public int parent(int ti, int i) {
        return parentList[parentOffset[ti] + i];
    }

    public DependencyKind parentKind(int ti, int i) {
        return parentKinds[parentOffset[ti] + i];
    }

    /** Keys in topological order. */
    public List<AssetKey> keys() {
        return List.of(topoOrder);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for constructing the TopologicalOrder.
     * Handles cycle detection and topological sorting.
     */
    public static final class Builder {
        private final List<AssetKey> nodes = new ArrayList<>();
        private final Map<AssetKey, Integer> keyToIdx = new HashMap<>();
        // child index -> kind, per parent index. A repeated edge keeps the stronger kind.
        private final Map<Integer, Map<Integer, DependencyKind>> forwardEdges = new HashMap<>();
        private final Set<Integer> sourceIndices = new HashSet<>();

        public Builder addNode(AssetKey key) {
            if (keyToIdx.containsKey(key))
                throw new DuplicateKeyException(key.toUserString(), "node " + keyToIdx.get(key), "node " + nodes.size());
            int idx = nodes.size();
            nodes.add(key);
            keyToIdx.put(key, idx);
            forwardEdges.put(idx, new TreeMap<>());
            return this;
        }

        public Builder addEdge(AssetKey upstream, AssetKey downstream, DependencyKind kind) {
            if (upstream.equals(downstream))
                throw new CyclicDependencyException(List.of(upstream, downstream));
            forwardEdges.get(requireIndex(upstream)).merge(requireIndex(downstream), kind, DependencyKind::strongest);
            return this;
        }

        public Builder markSource(AssetKey key) {
            sourceIndices.add(requireIndex(key));
            return this;
        }

        private int requireIndex(AssetKey key) {
            Integer idx = keyToIdx.get(key);
            if (idx == null)
                throw new UnknownDependencyException(key.toUserString(), "Unknown asset: " + key);
            return idx;
        }

        /**
         * Compiles the graph.
         * <p>
         * A depth-first pass with recursion-stack marking rejects cycles and names
         * the offending key sequence, then Kahn's algorithm with a key-ordered ready
         * queue produces the ordering.
         */
        public TopologicalOrder build() {
            int n = nodes.size();
            detectCycle(n);

            int[] inDegree = new int[n];
            for (var entry : forwardEdges.entrySet())
                for (int child : entry.getValue().keySet())
                    inDegree[child]++;

            PriorityQueue<Integer> ready = new PriorityQueue<>(Math.max(1, n), Comparator.comparing(nodes::get));
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    ready.add(i);

            int[] topoMap = new int[n], reverseMap = new int[n];
            int topoIdx = 0;
            while (!ready.isEmpty()) {
                int curr = ready.poll();
                topoMap[curr] = topoIdx;
                reverseMap[topoIdx] = curr;
                topoIdx++;
                for (int child : forwardEdges.get(curr).keySet())
                    if (--inDegree[child] == 0)
                        ready.add(child);
            }
            if (topoIdx != n)
                throw new IllegalStateException("Cycle survived detection. Processed " + topoIdx + " of " + n);

            AssetKey[] ordered = new AssetKey[n];
            long[] srcWords = new long[(n + 63) / 64];
            Map<AssetKey, Integer> newKeyToIndex = new HashMap<>(n * 2);
            for (int ti = 0; ti < n; ti++) {
                int origIdx = reverseMap[ti];
                ordered[ti] = nodes.get(origIdx);
                if (sourceIndices.contains(origIdx))
                    srcWords[ti >> 6] |= (1L << ti);
                newKeyToIndex.put(ordered[ti], ti);
            }

            // Children CSR, child lists sorted by topological index.
            List<List<int[]>> parentsOf = new ArrayList<>(n);
            for (int ti = 0; ti < n; ti++)
                parentsOf.add(new ArrayList<>());
            int[] offsets = new int[n + 1];
            int[][] childrenByTi = new int[n][];
            for (int ti = 0; ti < n; ti++) {
                Map<Integer, DependencyKind> children = forwardEdges.get(reverseMap[ti]);
                int[] c = new int[children.size()];
                int j = 0;
                for (var e : children.entrySet()) {
                    c[j++] = topoMap[e.getKey()];
                    parentsOf.get(topoMap[e.getKey()]).add(new int[] { ti, e.getValue().ordinal() });
                }
                Arrays.sort(c);
                childrenByTi[ti] = c;
                offsets[ti + 1] = offsets[ti] + c.length;
            }
            int[] flatChildren = new int[offsets[n]];
            for (int ti = 0; ti < n; ti++)
                System.arraycopy(childrenByTi[ti], 0, flatChildren, offsets[ti], childrenByTi[ti].length);

            // Parents CSR. Parents are appended in ascending ti order already.
            int[] pOffsets = new int[n + 1];
            for (int ti = 0; ti < n; ti++)
                pOffsets[ti + 1] = pOffsets[ti] + parentsOf.get(ti).size();
            int[] flatParents = new int[pOffsets[n]];
            DependencyKind[] kinds = new DependencyKind[pOffsets[n]];
            DependencyKind[] allKinds = DependencyKind.values();
            for (int ti = 0; ti < n; ti++) {
                List<int[]> ps = parentsOf.get(ti);
                for (int j = 0; j < ps.size(); j++) {
                    flatParents[pOffsets[ti] + j] = ps.get(j)[0];
                    kinds[pOffsets[ti] + j] = allKinds[ps.get(j)[1]];
                }
            }

            return new TopologicalOrder(ordered, offsets, flatChildren, pOffsets, flatParents, kinds,
                    Collections.unmodifiableMap(newKeyToIndex), srcWords);
        }

        private void detectCycle(int n) {
            // 0 = unvisited, 1 = on the recursion stack, 2 = done
            byte[] state = new byte[n];
            Deque<Integer> path = new ArrayDeque<>();
            Integer[] order = new Integer[n];
            for (int i = 0; i < n; i++)
                order[i] = i;
            Arrays.sort(order, Comparator.comparing(nodes::get));
            for (int start : order) {
                if (state[start] == 0) {
                    List<AssetKey> cycle = visit(start, state, path);
                    if (cycle != null)
                        throw new CyclicDependencyException(cycle);
                }
            }
        }

        // Iterative DFS: path mirrors the recursion stack, pending holds each frame's unvisited children.
        private List<AssetKey> visit(int start, byte[] state, Deque<Integer> path) {
            Deque<Iterator<Integer>> pending = new ArrayDeque<>();
            state[start] = 1;
            path.addLast(start);
            pending.addLast(forwardEdges.get(start).keySet().iterator());
            while (!pending.isEmpty()) {
                Iterator<Integer> children = pending.peekLast();
                if (!children.hasNext()) {
                    pending.removeLast();
                    state[path.removeLast()] = 2;
                    continue;
                }
                int child = children.next();
                if (state[child] == 1) {
                    List<AssetKey> cycle = new ArrayList<>();
                    boolean on = false;
                    for (int p : path) {
                        if (p == child)
                            on = true;
                        if (on)
                            cycle.add(nodes.get(p));
                    }
                    cycle.add(nodes.get(child));
                    return cycle;
                }
                if (state[child] == 0) {
                    state[child] = 1;
                    path.addLast(child);
                    pending.addLast(forwardEdges.get(child).keySet().iterator());
                }
            }
            return null;
        }
    }
}
