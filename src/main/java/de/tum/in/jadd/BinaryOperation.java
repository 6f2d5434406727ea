/*
 * This file is part of JADD.
 * Copyright (c) 2024 The JADD Authors.
 *
 * JADD is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JADD is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JADD. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jadd;

/**
 * Pointwise operations on leaf values, lifted to diagrams by {@link Add#apply(BinaryOperation, int,
 * int)}. The logical and relational operations treat every non-zero value as true and yield {@code
 * 0} or {@code 1}.
 */
public enum BinaryOperation {
    PLUS(true) {
        @Override
        public double apply(double left, double right) {
            return left + right;
        }
    },
    MINUS(false) {
        @Override
        public double apply(double left, double right) {
            return left - right;
        }
    },
    TIMES(true) {
        @Override
        public double apply(double left, double right) {
            return left * right;
        }
    },
    DIVIDE(false) {
        @Override
        public double apply(double left, double right) {
            return left / right;
        }
    },
    MINIMUM(true) {
        @Override
        public double apply(double left, double right) {
            return Math.min(left, right);
        }
    },
    MAXIMUM(true) {
        @Override
        public double apply(double left, double right) {
            return Math.max(left, right);
        }
    },
    /** Minimum where {@code 0} is neutral, i.e. zero only wins if both values are zero. */
    MINIMUM_EXCEPT_ZERO(true) {
        @Override
        public double apply(double left, double right) {
            if (left == 0.0d) {
                return right;
            }
            if (right == 0.0d) {
                return left;
            }
            return Math.min(left, right);
        }
    },
    OR(true) {
        @Override
        public double apply(double left, double right) {
            return truth(left != 0.0d || right != 0.0d);
        }
    },
    AND(true) {
        @Override
        public double apply(double left, double right) {
            return truth(left != 0.0d && right != 0.0d);
        }
    },
    LESS_THAN(false) {
        @Override
        public double apply(double left, double right) {
            return truth(left < right);
        }
    },
    LESS_OR_EQUAL(false) {
        @Override
        public double apply(double left, double right) {
            return truth(left <= right);
        }
    },
    GREATER_THAN(false) {
        @Override
        public double apply(double left, double right) {
            return truth(left > right);
        }
    },
    GREATER_OR_EQUAL(false) {
        @Override
        public double apply(double left, double right) {
            return truth(left >= right);
        }
    },
    EQUAL(true) {
        @Override
        public double apply(double left, double right) {
            return truth(left == right);
        }
    },
    NOT_EQUAL(true) {
        @Override
        public double apply(double left, double right) {
            return truth(left != right);
        }
    };

    private final boolean commutative;

    BinaryOperation(boolean commutative) {
        this.commutative = commutative;
    }

    private static double truth(boolean value) {
        return value ? 1.0d : 0.0d;
    }

    public abstract double apply(double left, double right);

    public boolean isCommutative() {
        return commutative;
    }
}
