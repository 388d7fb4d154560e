package com.circuitsim.engine;

import java.util.Arrays;

/**
 * Integer-keyed disjoint-set (union-find) with path halving and union by size.
 *
 * Elements are dense indices handed out by {@link #add()}, so the structure is
 * two flat int arrays and never hashes anything.
 */
public final class DisjointSet {
    private int[] parent;
    private int[] size;
    private int count;

    public DisjointSet() {
        this(16);
    }

    public DisjointSet(int initialCapacity) {
        int cap = Math.max(1, initialCapacity);
        this.parent = new int[cap];
        this.size = new int[cap];
    }

    /** Registers a new singleton element and returns its index. */
    public int add() {
        if (count == parent.length) {
            parent = Arrays.copyOf(parent, count * 2);
            size = Arrays.copyOf(size, count * 2);
        }
        parent[count] = count;
        size[count] = 1;
        return count++;
    }

    public int size() {
        return count;
    }

    /** Returns the canonical root of {@code x}, compressing the path on the way up. */
    public int find(int x) {
        checkIndex(x);
        while (parent[x] != x) {
            parent[x] = parent[parent[x]];
            x = parent[x];
        }
        return x;
    }

    /**
     * Merges the sets containing {@code a} and {@code b}.
     *
     * @return the root of the merged set.
     */
    public int union(int a, int b) {
        int ra = find(a);
        int rb = find(b);
        if (ra == rb)
            return ra;
        if (size[ra] < size[rb]) {
            int t = ra;
            ra = rb;
            rb = t;
        }
        parent[rb] = ra;
        size[ra] += size[rb];
        return ra;
    }

    public boolean connected(int a, int b) {
        return find(a) == find(b);
    }

    private void checkIndex(int x) {
        if (x < 0 || x >= count)
            throw new IndexOutOfBoundsException("Element " + x + " not in disjoint set of size " + count);
    }
}
