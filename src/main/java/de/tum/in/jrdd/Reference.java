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

/**
 * Static helpers for the {@code int} encoding of node references.
 *
 * <p>Layout: {@code <---PAYLOAD---><LIT><NEG>}. The payload is a slot index for internal references and a variable
 * number for literals. Slot 0 is the false anchor, hence {@link #FALSE} is {@code 0} and {@link #TRUE} its
 * complement. Negating any reference only flips the lowest bit.</p>
 */
public final class Reference {
    public static final int FALSE = 0;
    public static final int TRUE = 1;

    private static final int NEGATION_BIT = 1;
    private static final int LITERAL_BIT = 2;
    private static final int PAYLOAD_OFFSET = 2;

    static final int MAXIMAL_PAYLOAD = (Integer.MAX_VALUE >>> PAYLOAD_OFFSET) - 1;

    private Reference() {}

    public static int not(int reference) {
        return reference ^ NEGATION_BIT;
    }

    public static int literal(int variable) {
        assert 0 <= variable && variable <= MAXIMAL_PAYLOAD;
        return (variable << PAYLOAD_OFFSET) | LITERAL_BIT;
    }

    static int internal(int slot) {
        assert 0 <= slot && slot <= MAXIMAL_PAYLOAD;
        return slot << PAYLOAD_OFFSET;
    }

    public static boolean isConstant(int reference) {
        return (reference | NEGATION_BIT) == TRUE;
    }

    public static boolean isLiteral(int reference) {
        return (reference & LITERAL_BIT) != 0;
    }

    /**
     * Whether the reference points into the node store, i.e. is neither a constant nor a literal.
     */
    public static boolean isInternal(int reference) {
        return !isLiteral(reference) && !isConstant(reference);
    }

    public static boolean isNegated(int reference) {
        return (reference & NEGATION_BIT) != 0;
    }

    /**
     * Strips the polarity bit.
     */
    public static int positive(int reference) {
        return reference & ~NEGATION_BIT;
    }

    static int negateIf(int reference, boolean negate) {
        return negate ? reference ^ NEGATION_BIT : reference;
    }

    static int slot(int reference) {
        assert !isLiteral(reference);
        return reference >>> PAYLOAD_OFFSET;
    }

    public static int literalVariable(int reference) {
        assert isLiteral(reference);
        return reference >>> PAYLOAD_OFFSET;
    }

    public static String toString(int reference) {
        if (reference == FALSE) {
            return "O";
        }
        if (reference == TRUE) {
            return "I";
        }
        String prefix = isNegated(reference) ? "!" : "";
        if (isLiteral(reference)) {
            return prefix + "#" + literalVariable(reference);
        }
        return prefix + "@" + slot(reference);
    }
}
