package com.circuitsim.engine;

import org.junit.Test;

import static org.junit.Assert.*;

public class DisjointSetTest {

    @Test
    public void testSingletons() {
        DisjointSet ds = new DisjointSet();
        int a = ds.add();
        int b = ds.add();
        assertEquals(0, a);
        assertEquals(1, b);
        assertEquals(2, ds.size());
        assertEquals(a, ds.find(a));
        assertFalse(ds.connected(a, b));
    }

    @Test
    public void testUnionIsTransitive() {
        DisjointSet ds = new DisjointSet(2);
        for (int i = 0; i < 5; i++)
            ds.add();
        ds.union(0, 1);
        ds.union(1, 2);
        assertTrue(ds.connected(0, 2));
        assertFalse(ds.connected(0, 3));
        ds.union(4, 3);
        ds.union(3, 2);
        int root = ds.find(0);
        for (int i = 1; i < 5; i++)
            assertEquals(root, ds.find(i));
    }

    @Test
    public void testUnionIsIdempotent() {
        DisjointSet ds = new DisjointSet();
        ds.add();
        ds.add();
        int r1 = ds.union(0, 1);
        int r2 = ds.union(1, 0);
        assertEquals(r1, r2);
        assertEquals(r1, ds.find(0));
    }

    @Test
    public void testGrowsPastInitialCapacity() {
        DisjointSet ds = new DisjointSet(1);
        for (int i = 0; i < 1000; i++)
            ds.add();
        for (int i = 1; i < 1000; i++)
            ds.union(i - 1, i);
        assertTrue(ds.connected(0, 999));
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void testUnknownElement() {
        DisjointSet ds = new DisjointSet();
        ds.add();
        ds.find(1);
    }
}
