/*
 * This file is part of JRDD.
 * Copyright (c) 2024 The JRDD authors.
 *
 * JRDD is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JRDD is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JRDD. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jrdd;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;

import com.google.common.collect.ImmutableSet;
import java.util.BitSet;
import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Hand-built diagrams around two adjacent rows {@code d} (above) and {@code u} (below), checked node by node after
 * lifting {@code u}. The rows {@code a} and {@code x*} below serve as leaves, the row {@code z} above holds roots.
 */
@SuppressWarnings("checkstyle:javadoc")
public class SwapFixtureTest {
    private Diagram diagram;
    private int z;
    private int d;
    private int u;
    private int a;
    private int[] leaves;
    private int[] all;

    @BeforeEach
    public void setUp() {
        diagram = DiagramFactory.create(ImmutableStoreConfiguration.builder()
                .validateStructuralChanges(true)
                .build());
        z = diagram.createVariable(VariableKind.SCAFFOLD);
        d = diagram.createVariable(VariableKind.SCAFFOLD);
        u = diagram.createVariable(VariableKind.SCAFFOLD);
        a = diagram.createVariable(VariableKind.SCAFFOLD);
        int[] x = diagram.createVariables(4);

        leaves = new int[4];
        for (int i = 0; i < leaves.length; i++) {
            leaves[i] = node(a, diagram.literal(x[i]), Reference.FALSE);
        }
        all = new int[] {z, d, u, a, x[0], x[1], x[2], x[3]};
    }

    private int node(int variable, int high, int low) {
        return diagram.insertOrReuse(variable, high, low, 1);
    }

    private int rootLow() {
        return diagram.literal(all[7]);
    }

    private void releaseAll(int... references) {
        for (int reference : references) {
            diagram.release(reference);
        }
    }

    private void assertNode(int reference, int variable, int high, int low) {
        assertThat(diagram.get(reference).orElseThrow(), is(new Vhl(variable, high, low)));
    }

    private int other(Set<Integer> row, int known) {
        Set<Integer> rest = new HashSet<>(row);
        rest.remove(known);
        assertThat(rest, hasSize(1));
        return rest.iterator().next();
    }

    private void swapPreservingFunction(int... roots) {
        BitSet[] before = new BitSet[roots.length];
        for (int i = 0; i < roots.length; i++) {
            before[i] = diagram.truthTable(roots[i], all);
        }
        diagram.swap(u);
        assertThat(diagram.order().position(u), is(1));
        assertThat(diagram.order().position(d), is(2));
        for (int i = 0; i < roots.length; i++) {
            assertThat(diagram.truthTable(roots[i], all), is(before[i]));
        }
    }

    @Test
    public void testIndependentNodes() {
        int n2 = node(u, leaves[2], leaves[3]);
        int n1 = node(d, leaves[0], leaves[1]);
        int z0 = node(z, n1, n2);
        releaseAll(leaves);
        releaseAll(n1, n2);
        diagram.validate("setup");

        swapPreservingFunction(z0);

        assertThat(diagram.row(u), is(ImmutableSet.of(n2)));
        assertThat(diagram.row(d), is(ImmutableSet.of(n1)));
        assertNode(n2, u, leaves[2], leaves[3]);
        assertNode(n1, d, leaves[0], leaves[1]);
        assertNode(z0, z, n1, n2);
        for (int leaf : leaves) {
            assertThat(diagram.refcount(leaf), is(1));
        }
        assertThat(diagram.refcount(n1), is(1));
        assertThat(diagram.refcount(n2), is(1));
    }

    @Test
    public void testUnreferencedNodesAreGone() {
        int n2 = node(u, leaves[1], leaves[2]);
        int n1 = node(d, leaves[0], n2);
        releaseAll(n2, n1);
        assertThat(diagram.row(u), is(empty()));
        assertThat(diagram.row(d), is(empty()));

        diagram.swap(u);

        assertThat(diagram.row(u), is(empty()));
        assertThat(diagram.row(d), is(empty()));
        for (int leaf : leaves) {
            assertThat(diagram.get(leaf).orElseThrow().variable(), is(a));
            assertThat(diagram.refcount(leaf), is(1));
        }
    }

    @Test
    public void testDependentOnOneSide() {
        int n2 = node(u, leaves[0], leaves[1]);
        int n1 = node(d, n2, leaves[2]);
        int z0 = node(z, n1, rootLow());
        releaseAll(leaves);
        releaseAll(n1, n2);

        swapPreservingFunction(z0);

        assertThat(diagram.row(u), is(ImmutableSet.of(n1)));
        assertThat(diagram.row(d), hasSize(2));
        // The freed u node's slot is taken by the first new d node
        assertThat(diagram.row(d), hasItem(n2));
        int n3 = other(diagram.row(d), n2);
        assertNode(n3, d, leaves[1], leaves[2]);
        assertNode(n2, d, leaves[0], leaves[2]);
        assertNode(n1, u, n2, n3);
        assertNode(z0, z, n1, rootLow());
        assertThat(diagram.refcount(leaves[1]), is(1));
        assertThat(diagram.refcount(leaves[2]), is(2));
        assertThat(diagram.refcount(leaves[0]), is(1));
        assertThat(diagram.refcount(n2), is(1));
        assertThat(diagram.refcount(n3), is(1));
        assertThat(diagram.refcount(n1), is(1));
    }

    @Test
    public void testSharedLowerNodeSurvives() {
        int n2 = node(u, leaves[0], leaves[1]);
        int n1 = node(d, n2, leaves[2]);
        int z1 = node(z, n2, rootLow());
        int z0 = node(z, n1, rootLow());
        releaseAll(leaves);
        releaseAll(n1, n2);

        swapPreservingFunction(z0, z1);

        assertThat(diagram.row(u), is(ImmutableSet.of(n2, n1)));
        assertThat(diagram.row(d), hasSize(2));
        int n3 = diagram.get(n1).orElseThrow().high();
        int n4 = diagram.get(n1).orElseThrow().low();
        assertThat(diagram.row(d), is(ImmutableSet.of(n3, n4)));
        assertNode(n4, d, leaves[1], leaves[2]);
        assertNode(n3, d, leaves[0], leaves[2]);
        assertNode(n1, u, n3, n4);
        assertNode(n2, u, leaves[0], leaves[1]);
        assertNode(z0, z, n1, rootLow());
        assertNode(z1, z, n2, rootLow());
        assertThat(diagram.refcount(leaves[1]), is(2));
        assertThat(diagram.refcount(leaves[2]), is(2));
        assertThat(diagram.refcount(leaves[0]), is(2));
        assertThat(diagram.refcount(n3), is(1));
        assertThat(diagram.refcount(n4), is(1));
        assertThat(diagram.refcount(n1), is(1));
        assertThat(diagram.refcount(n2), is(1));
    }

    @Test
    public void testDependentOnBothSides() {
        int n3 = node(u, leaves[2], leaves[3]);
        int n2 = node(u, leaves[0], leaves[1]);
        int n1 = node(d, n2, n3);
        int z0 = node(z, n1, rootLow());
        releaseAll(leaves);
        releaseAll(n1, n2, n3);

        swapPreservingFunction(z0);

        assertThat(diagram.row(u), is(ImmutableSet.of(n1)));
        assertThat(diagram.row(d), is(ImmutableSet.of(n2, n3)));
        assertNode(n3, d, leaves[1], leaves[3]);
        assertNode(n2, d, leaves[0], leaves[2]);
        assertNode(n1, u, n2, n3);
        assertNode(z0, z, n1, rootLow());
        for (int leaf : leaves) {
            assertThat(diagram.refcount(leaf), is(1));
        }
        assertThat(diagram.refcount(n2), is(1));
        assertThat(diagram.refcount(n3), is(1));
        assertThat(diagram.refcount(n1), is(1));
    }

    @Test
    public void testLiteralChild() {
        // d ? u : a0, where u is only present as a literal
        int n1 = node(d, diagram.literal(u), leaves[0]);
        int z0 = node(z, n1, rootLow());
        releaseAll(leaves);
        diagram.release(n1);

        swapPreservingFunction(z0);

        // u ? (d ? 1 : a0) : (d ? 0 : a0)
        assertThat(diagram.row(u), is(ImmutableSet.of(n1)));
        assertThat(diagram.row(d), hasSize(2));
        Vhl lifted = diagram.get(n1).orElseThrow();
        assertThat(lifted.variable(), is(u));
        assertThat(diagram.row(d), is(ImmutableSet.of(lifted.high(), lifted.low())));
        assertNode(lifted.high(), d, Reference.TRUE, leaves[0]);
        assertNode(lifted.low(), d, Reference.FALSE, leaves[0]);
        assertThat(diagram.refcount(leaves[0]), is(2));
    }

    @Test
    public void testSwapBackRestoresStructure() {
        int n3 = node(u, leaves[2], leaves[3]);
        int n2 = node(u, leaves[0], leaves[1]);
        int n1 = node(d, n2, n3);
        releaseAll(n2, n3);
        BitSet table = diagram.truthTable(n1, all);
        int length = diagram.len();

        diagram.swap(u);
        diagram.swap(d);

        assertThat(diagram.order().position(d), is(1));
        assertThat(diagram.len(), is(length));
        assertThat(diagram.truthTable(n1, all), is(table));
        assertThat(diagram.get(n1).orElseThrow().variable(), is(d));
        assertThat(diagram.row(u), hasSize(2));
        assertThat(diagram.row(d), is(ImmutableSet.of(n1)));
    }

    @Test
    public void testSwapTopIsIgnored() {
        int n1 = node(z, leaves[0], leaves[1]);
        diagram.swap(z);
        assertThat(diagram.order().position(z), is(0));
        assertNode(n1, z, leaves[0], leaves[1]);
        diagram.validate("top swap");
    }
}
