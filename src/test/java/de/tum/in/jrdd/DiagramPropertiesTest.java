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
import static org.hamcrest.Matchers.is;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Randomized checks of canonicity, exact reference counting and function preservation under swaps. Every formula is
 * compared against its own evaluation, independent of the diagram.
 */
@SuppressWarnings({"checkstyle:javadoc", "PMD.AvoidInstantiatingObjectsInLoops"})
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class DiagramPropertiesTest {
    private static final Logger logger = Logger.getLogger(DiagramPropertiesTest.class.getName());

    private static final int VARIABLE_COUNT = 6;
    private static final int FORMULA_COUNT = 60;
    private static final int FORMULA_DEPTH = 5;

    Stream<Long> seeds() {
        return IntStream.range(0, 8).mapToObj(i -> 31L * i + 7);
    }

    private static Diagram createDiagram() {
        return DiagramFactory.create(ImmutableStoreConfiguration.builder()
                .initialSize(16)
                .validateStructuralChanges(true)
                .build());
    }

    private static BitSet table(Formula formula, int[] variables) {
        BitSet table = new BitSet();
        BitSet assignment = new BitSet();
        for (int row = 0; row < 1 << variables.length; row++) {
            assignment.clear();
            for (int index = 0; index < variables.length; index++) {
                if ((row & (1 << index)) != 0) {
                    assignment.set(variables[index]);
                }
            }
            if (formula.evaluate(assignment)) {
                table.set(row);
            }
        }
        return table;
    }

    @ParameterizedTest
    @MethodSource("seeds")
    public void testCanonicity(long seed) {
        Random random = new Random(seed);
        Diagram diagram = createDiagram();
        int[] variables = diagram.createVariables(VARIABLE_COUNT);

        Map<BitSet, Integer> canonical = new HashMap<>();
        List<Integer> held = new ArrayList<>();
        for (int i = 0; i < FORMULA_COUNT; i++) {
            Formula formula = Formula.random(random, variables, FORMULA_DEPTH);
            int reference = formula.build(diagram);
            held.add(reference);
            BitSet expected = table(formula, variables);
            assertThat(formula.toString(), diagram.truthTable(reference, variables), is(expected));

            Integer previous = canonical.putIfAbsent(expected, reference);
            if (previous != null) {
                assertThat(formula.toString(), reference, is(previous));
            }
            if (expected.isEmpty()) {
                assertThat(reference, is(Reference.FALSE));
            }
        }
        diagram.validate("canonicity");
        logger.log(Level.FINE, "Seed {0}: {1} distinct functions, {2} nodes",
                new Object[] {seed, canonical.size(), diagram.len()});

        for (int reference : held) {
            diagram.release(reference);
        }
        assertThat(diagram.len(), is(0));
        diagram.validate("released");
    }

    @ParameterizedTest
    @MethodSource("seeds")
    public void testReferenceCountsAreExact(long seed) {
        Random random = new Random(seed);
        Diagram diagram = createDiagram();
        int[] variables = diagram.createVariables(VARIABLE_COUNT);

        List<Integer> held = new ArrayList<>();
        for (int step = 0; step < 200; step++) {
            if (!held.isEmpty() && random.nextInt(3) == 0) {
                diagram.release(held.remove(random.nextInt(held.size())));
            } else if (held.size() >= 2 && random.nextBoolean()) {
                int first = held.get(random.nextInt(held.size()));
                int second = held.get(random.nextInt(held.size()));
                held.add(random.nextBoolean() ? diagram.and(first, second) : diagram.xor(first, second));
            } else {
                held.add(Formula.random(random, variables, 3).build(diagram));
            }
            diagram.validate("step " + step);
        }
        for (int reference : held) {
            diagram.release(reference);
        }
        assertThat(diagram.len(), is(0));
        diagram.validate("released");
    }

    @ParameterizedTest
    @MethodSource("seeds")
    public void testSwapPreservesFunctions(long seed) {
        Random random = new Random(seed);
        Diagram diagram = createDiagram();
        int[] variables = diagram.createVariables(VARIABLE_COUNT);

        List<Formula> formulas = new ArrayList<>();
        List<Integer> roots = new ArrayList<>();
        List<BitSet> tables = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            Formula formula = Formula.random(random, variables, FORMULA_DEPTH);
            formulas.add(formula);
            roots.add(formula.build(diagram));
            tables.add(table(formula, variables));
        }

        for (int swap = 0; swap < 30; swap++) {
            int variable = diagram.order().variableAt(1 + random.nextInt(VARIABLE_COUNT - 1));
            diagram.swap(variable);
            for (int i = 0; i < roots.size(); i++) {
                assertThat(formulas.get(i) + " after swap " + swap,
                        diagram.truthTable(roots.get(i), variables), is(tables.get(i)));
            }
        }

        // Rebuilding under the new order yields the very same references
        for (int i = 0; i < formulas.size(); i++) {
            int rebuilt = formulas.get(i).build(diagram);
            assertThat(rebuilt, is(roots.get(i)));
            diagram.release(rebuilt);
        }
        logger.log(Level.FINE, "Order after swaps: {0}", diagram.order());

        for (int root : roots) {
            diagram.release(root);
        }
        assertThat(diagram.len(), is(0));
        diagram.validate("released");
    }

    @ParameterizedTest
    @MethodSource("seeds")
    public void testSwapAndSubstitutionAgree(long seed) {
        Random random = new Random(seed);
        Diagram diagram = createDiagram();
        int[] variables = diagram.createVariables(VARIABLE_COUNT);

        Formula formula = Formula.random(random, variables, FORMULA_DEPTH);
        int root = formula.build(diagram);
        int first = variables[random.nextInt(VARIABLE_COUNT)];
        int second = variables[random.nextInt(VARIABLE_COUNT)];
        int swapped = diagram.swapVariables(root, first, second);

        BitSet assignment = new BitSet();
        for (int row = 0; row < 1 << VARIABLE_COUNT; row++) {
            assignment.clear();
            for (int index = 0; index < VARIABLE_COUNT; index++) {
                if ((row & (1 << index)) != 0) {
                    assignment.set(variables[index]);
                }
            }
            BitSet exchanged = BitSets.copyOf(assignment);
            exchanged.set(first, assignment.get(second));
            exchanged.set(second, assignment.get(first));
            assertThat(diagram.evaluate(swapped, assignment), is(formula.evaluate(exchanged)));
        }

        int twice = diagram.swapVariables(swapped, first, second);
        assertThat(twice, is(root));
        diagram.release(twice);
        diagram.release(swapped);
        diagram.release(root);
        assertThat(diagram.len(), is(0));
    }
}
