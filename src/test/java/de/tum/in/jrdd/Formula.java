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

import java.util.BitSet;
import java.util.Objects;
import java.util.Random;

/**
 * Propositional formulas, used as an independent model of the functions built in a diagram.
 */
@SuppressWarnings({"AccessingNonPublicFieldOfAnotherObject", "checkstyle:javadoc"})
abstract class Formula {
    enum Operation {
        AND, OR, XOR, IMPLICATION, EQUIVALENCE, GT, LT;

        boolean apply(boolean first, boolean second) {
            switch (this) {
                case AND:
                    return first && second;
                case OR:
                    return first || second;
                case XOR:
                    return first ^ second;
                case IMPLICATION:
                    return !first || second;
                case EQUIVALENCE:
                    return first == second;
                case GT:
                    return first && !second;
                case LT:
                    return !first && second;
                default:
                    throw new AssertionError();
            }
        }

        int apply(Diagram diagram, int first, int second) {
            switch (this) {
                case AND:
                    return diagram.and(first, second);
                case OR:
                    return diagram.or(first, second);
                case XOR:
                    return diagram.xor(first, second);
                case IMPLICATION:
                    return diagram.implication(first, second);
                case EQUIVALENCE:
                    return diagram.equivalence(first, second);
                case GT:
                    return diagram.gt(first, second);
                case LT:
                    return diagram.lt(first, second);
                default:
                    throw new AssertionError();
            }
        }
    }

    abstract boolean evaluate(BitSet assignment);

    /**
     * Builds the formula in the diagram, returning a reference with one hold.
     */
    abstract int build(Diagram diagram);

    static Formula constant(boolean value) {
        return new Constant(value);
    }

    static Formula variable(int variable) {
        return new Variable(variable);
    }

    static Formula not(Formula formula) {
        return new Not(formula);
    }

    static Formula binary(Operation operation, Formula left, Formula right) {
        return new Binary(operation, left, right);
    }

    static Formula ite(Formula condition, Formula thenFormula, Formula elseFormula) {
        return new Ite(condition, thenFormula, elseFormula);
    }

    static Formula random(Random random, int[] variables, int depth) {
        if (depth == 0 || random.nextInt(8) == 0) {
            int pick = random.nextInt(variables.length + 2);
            return pick < variables.length ? variable(variables[pick]) : constant(pick == variables.length);
        }
        int kind = random.nextInt(10);
        if (kind == 0) {
            return not(random(random, variables, depth - 1));
        }
        if (kind == 1) {
            return ite(random(random, variables, depth - 1), random(random, variables, depth - 1),
                    random(random, variables, depth - 1));
        }
        Operation[] operations = Operation.values();
        return binary(operations[random.nextInt(operations.length)], random(random, variables, depth - 1),
                random(random, variables, depth - 1));
    }

    private static final class Constant extends Formula {
        private final boolean value;

        Constant(boolean value) {
            this.value = value;
        }

        @Override
        boolean evaluate(BitSet assignment) {
            return value;
        }

        @Override
        int build(Diagram diagram) {
            return value ? Reference.TRUE : Reference.FALSE;
        }

        @Override
        public String toString() {
            return value ? "1" : "0";
        }
    }

    private static final class Variable extends Formula {
        private final int variable;

        Variable(int variable) {
            this.variable = variable;
        }

        @Override
        boolean evaluate(BitSet assignment) {
            return assignment.get(variable);
        }

        @Override
        int build(Diagram diagram) {
            return diagram.literal(variable);
        }

        @Override
        public String toString() {
            return "x" + variable;
        }
    }

    private static final class Not extends Formula {
        private final Formula child;

        Not(Formula child) {
            this.child = child;
        }

        @Override
        boolean evaluate(BitSet assignment) {
            return !child.evaluate(assignment);
        }

        @Override
        int build(Diagram diagram) {
            int built = child.build(diagram);
            return diagram.consume(diagram.not(built), built);
        }

        @Override
        public String toString() {
            return "!" + child;
        }
    }

    private static final class Binary extends Formula {
        private final Operation operation;
        private final Formula left;
        private final Formula right;

        Binary(Operation operation, Formula left, Formula right) {
            this.operation = operation;
            this.left = left;
            this.right = right;
        }

        @Override
        boolean evaluate(BitSet assignment) {
            return operation.apply(left.evaluate(assignment), right.evaluate(assignment));
        }

        @Override
        int build(Diagram diagram) {
            int first = left.build(diagram);
            int second = right.build(diagram);
            return diagram.consume(operation.apply(diagram, first, second), first, second);
        }

        @Override
        public String toString() {
            return String.format("(%s %s %s)", left, operation, right);
        }
    }

    private static final class Ite extends Formula {
        private final Formula condition;
        private final Formula thenFormula;
        private final Formula elseFormula;

        Ite(Formula condition, Formula thenFormula, Formula elseFormula) {
            this.condition = Objects.requireNonNull(condition);
            this.thenFormula = Objects.requireNonNull(thenFormula);
            this.elseFormula = Objects.requireNonNull(elseFormula);
        }

        @Override
        boolean evaluate(BitSet assignment) {
            return condition.evaluate(assignment)
                    ? thenFormula.evaluate(assignment)
                    : elseFormula.evaluate(assignment);
        }

        @Override
        int build(Diagram diagram) {
            int first = condition.build(diagram);
            int second = thenFormula.build(diagram);
            int third = elseFormula.build(diagram);
            return diagram.consume(diagram.ite(first, second, third), first, second, third);
        }

        @Override
        public String toString() {
            return String.format("(%s ? %s : %s)", condition, thenFormula, elseFormula);
        }
    }
}
