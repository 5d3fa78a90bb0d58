/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.rlisp;

import java.util.function.DoubleBinaryOperator;
import java.util.function.LongBinaryOperator;

import com.cloudway.rlisp.LispError.NumArgs;
import com.cloudway.rlisp.LispError.TypeMismatch;
import static com.cloudway.rlisp.LispVal.*;

// @formatter:off

/**
 * Arithmetic, comparison and math primitives. Operations on exact integers
 * stay exact unless they overflow; any inexact operand makes the result
 * inexact, and any quaternion operand makes it a quaternion.
 */
@SuppressWarnings("unused")
public final class NumberPrimitives {
    private NumberPrimitives() {}

    private static Num fold(Num[] xs, Num unit, LongBinaryOperator exact, DoubleBinaryOperator inexact) {
        Num res = unit;
        for (Num x : xs) {
            res = op(res, x, exact, inexact);
        }
        return res;
    }

    // The exact operator throws ArithmeticException on overflow, in which
    // case the result is computed inexactly.
    private static Num op(Num x, Num y, LongBinaryOperator exact, DoubleBinaryOperator inexact) {
        if (x instanceof Int && y instanceof Int) {
            try {
                return Num.make(exact.applyAsLong(((Int)x).value, ((Int)y).value));
            } catch (ArithmeticException ex) {
                return Num.make(inexact.applyAsDouble(x.doubleValue(), y.doubleValue()));
            }
        } else {
            return Num.make(inexact.applyAsDouble(x.doubleValue(), y.doubleValue()));
        }
    }

    /**
     * Returns the arguments as numbers, or null if any of them is a
     * quaternion.
     */
    private static Num[] reals(LispVal[] xs) {
        Num[] res = new Num[xs.length];
        boolean mixed = false;
        for (int i = 0; i < xs.length; i++) {
            if (xs[i] instanceof Num) {
                res[i] = (Num)xs[i];
            } else if (xs[i] instanceof Quat) {
                mixed = true;
            } else {
                throw new TypeMismatch("num", xs[i]);
            }
        }
        return mixed ? null : res;
    }

    @FunctionalInterface
    private interface QuatOp {
        Quat apply(Quat x, Quat y);
    }

    private static Quat foldQuat(LispVal[] xs, int from, Quat init, QuatOp op) {
        Quat res = init;
        for (int i = from; i < xs.length; i++) {
            res = op.apply(res, Quat.of(xs[i]));
        }
        return res;
    }

    @Name("+")
    public static LispVal add(LispVal... xs) {
        Num[] ns = reals(xs);
        if (ns == null)
            return foldQuat(xs, 0, Quat.ZERO, Quat::add);
        return fold(ns, Num.make(0), Math::addExact, (a, b) -> a + b);
    }

    @Name("*")
    public static LispVal mul(LispVal... xs) {
        Num[] ns = reals(xs);
        if (ns == null)
            return foldQuat(xs, 0, Quat.ONE, Quat::mul);
        return fold(ns, Num.make(1), Math::multiplyExact, (a, b) -> a * b);
    }

    @Name("-")
    public static LispVal sub(LispVal... xs) {
        if (xs.length == 0)
            throw new NumArgs(1, 0);

        Num[] ns = reals(xs);
        if (ns == null) {
            if (xs.length == 1)
                return Quat.of(xs[0]).negate();
            return foldQuat(xs, 1, Quat.of(xs[0]), Quat::sub);
        }

        if (ns.length == 1)
            return op(Num.make(0), ns[0], Math::subtractExact, (a, b) -> a - b);

        Num res = ns[0];
        for (int i = 1; i < ns.length; i++) {
            res = op(res, ns[i], Math::subtractExact, (a, b) -> a - b);
        }
        return res;
    }

    @Name("/")
    public static LispVal div(LispVal... xs) {
        if (xs.length == 0)
            throw new NumArgs(1, 0);

        Num[] ns = reals(xs);
        if (ns == null) {
            if (xs.length == 1)
                return Quat.of(xs[0]).inverse();
            return foldQuat(xs, 1, Quat.of(xs[0]), Quat::div);
        }

        if (ns.length == 1)
            return divide(Num.make(1), ns[0]);

        Num res = ns[0];
        for (int i = 1; i < ns.length; i++) {
            res = divide(res, ns[i]);
        }
        return res;
    }

    // Exact only when the quotient is integral and representable.
    private static Num divide(Num x, Num y) {
        if (x instanceof Int && y instanceof Int) {
            long a = ((Int)x).value, b = ((Int)y).value;
            if (b != 0 && a % b == 0 && !(a == Long.MIN_VALUE && b == -1))
                return Num.make(a / b);
        }
        return Num.make(x.doubleValue() / y.doubleValue());
    }

    @Name("%")
    public static Num modulo(Num x, Num y) {
        if (x instanceof Int && y instanceof Int) {
            return Num.make(Math.floorMod(((Int)x).value, nonZero((Int)y)));
        }
        double a = x.doubleValue(), b = y.doubleValue();
        return Num.make(a - b * Math.floor(a / b));
    }

    public static Num rem(Num x, Num y) {
        if (x instanceof Int && y instanceof Int) {
            return Num.make(((Int)x).value % nonZero((Int)y));
        }
        return Num.make(x.doubleValue() % y.doubleValue());
    }

    private static long nonZero(Int y) {
        if (y.value == 0)
            throw new LispError(ErrorCode.SIGNATURE_MISMATCH, "division by zero");
        return y.value;
    }

    public static Num abs(Num x) {
        if (x instanceof Int && ((Int)x).value != Long.MIN_VALUE)
            return Num.make(Math.abs(((Int)x).value));
        return Num.make(Math.abs(x.doubleValue()));
    }

    // ---------------------------------------------------------------------

    @FunctionalInterface
    private interface Comparison {
        boolean test(double a, double b);
    }

    private static boolean chain(Num[] xs, Comparison cmp) {
        for (int i = 1; i < xs.length; i++) {
            Num a = xs[i - 1], b = xs[i];
            boolean ok;
            if (a instanceof Int && b instanceof Int) {
                ok = cmp.test(Long.compare(((Int)a).value, ((Int)b).value), 0);
            } else {
                ok = cmp.test(a.doubleValue(), b.doubleValue());
            }
            if (!ok)
                return false;
        }
        return true;
    }

    @Name("=")
    @SuppressWarnings("FloatingPointEquality")
    public static boolean numEq(Num... xs) {
        return chain(xs, (a, b) -> a == b);
    }

    @Name("<")
    public static boolean lt(Num... xs) {
        return chain(xs, (a, b) -> a < b);
    }

    @Name("<=")
    public static boolean le(Num... xs) {
        return chain(xs, (a, b) -> a <= b);
    }

    @Name(">")
    public static boolean gt(Num... xs) {
        return chain(xs, (a, b) -> a > b);
    }

    @Name(">=")
    public static boolean ge(Num... xs) {
        return chain(xs, (a, b) -> a >= b);
    }

    // ---------------------------------------------------------------------

    public static double sin(double x)  { return Math.sin(x); }
    public static double cos(double x)  { return Math.cos(x); }
    public static double tan(double x)  { return Math.tan(x); }
    public static double csc(double x)  { return 1 / Math.sin(x); }
    public static double sec(double x)  { return 1 / Math.cos(x); }
    public static double cot(double x)  { return 1 / Math.tan(x); }
    public static double asin(double x) { return Math.asin(x); }
    public static double acos(double x) { return Math.acos(x); }
    public static double atan(double x) { return Math.atan(x); }

    /**
     * The square root of a negative number is the pure quaternion
     * {@code sqrt(-x)i}.
     */
    public static LispVal sqrt(double x) {
        if (x < 0)
            return new Quat(0, Math.sqrt(-x), 0, 0);
        return Num.make(Math.sqrt(x));
    }

    public static LispVal exp(LispVal x) {
        if (x instanceof Quat)
            return ((Quat)x).exp();
        return Num.make(Math.exp(real(x)));
    }

    public static LispVal ln(LispVal x) {
        if (x instanceof Quat)
            return ((Quat)x).ln();
        return Num.make(Math.log(real(x)));
    }

    private static double real(LispVal x) {
        if (x instanceof Num)
            return ((Num)x).doubleValue();
        throw new TypeMismatch("num", x);
    }

    public static Quat quat(double a, double b, double c, double d) {
        return new Quat(a, b, c, d);
    }

    public static double pow(double x, double y) {
        return Math.pow(x, y);
    }

    // Values outside the range of an exact integer stay inexact.
    private static Num toExact(double x) {
        if (Double.isNaN(x) || x < Long.MIN_VALUE || x >= 0x1p63)
            return Num.make(x);
        return Num.make((long)x);
    }

    public static Num floor(Num x) {
        return x instanceof Int ? x : toExact(Math.floor(x.doubleValue()));
    }

    public static Num ceil(Num x) {
        return x instanceof Int ? x : toExact(Math.ceil(x.doubleValue()));
    }
}
