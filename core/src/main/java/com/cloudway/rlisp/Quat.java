/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.rlisp;

import com.cloudway.rlisp.LispError.TypeMismatch;
import static com.cloudway.rlisp.LispVal.*;

/**
 * A quaternion {@code a + bi + cj + dk} with inexact components. Real
 * numbers combined with a quaternion in arithmetic are promoted to a
 * quaternion with zero vector part.
 */
public final class Quat implements LispVal {
    public static final Quat ZERO = new Quat(0, 0, 0, 0);
    public static final Quat ONE  = new Quat(1, 0, 0, 0);

    public final double a, b, c, d;

    public Quat(double a, double b, double c, double d) {
        this.a = a;
        this.b = b;
        this.c = c;
        this.d = d;
    }

    /**
     * Promotes a number or returns a quaternion unchanged.
     *
     * @throws LispError with code 009 for any other value
     */
    public static Quat of(LispVal x) {
        if (x instanceof Quat)
            return (Quat)x;
        if (x instanceof Num)
            return new Quat(((Num)x).doubleValue(), 0, 0, 0);
        throw new TypeMismatch("num", x);
    }

    @Override
    public String typeName() {
        return "quaternion";
    }

    public double norm() {
        return Math.sqrt(a * a + b * b + c * c + d * d);
    }

    public Quat negate() {
        return new Quat(-a, -b, -c, -d);
    }

    public Quat conjugate() {
        return new Quat(a, -b, -c, -d);
    }

    public Quat scale(double k) {
        return new Quat(k * a, k * b, k * c, k * d);
    }

    public Quat inverse() {
        double t = a * a + b * b + c * c + d * d;
        return conjugate().scale(1 / t);
    }

    public Quat add(Quat that) {
        return new Quat(a + that.a, b + that.b, c + that.c, d + that.d);
    }

    public Quat sub(Quat that) {
        return new Quat(a - that.a, b - that.b, c - that.c, d - that.d);
    }

    // Hamilton product, not commutative.
    public Quat mul(Quat that) {
        double w = that.a, x = that.b, y = that.c, z = that.d;
        return new Quat(a * w - b * x - c * y - d * z,
                        a * x + b * w + c * z - d * y,
                        a * y - b * z + c * w + d * x,
                        a * z + b * y - c * x + d * w);
    }

    // Right division: this * that^-1
    public Quat div(Quat that) {
        return mul(that.inverse());
    }

    public Quat exp() {
        double v = Math.sqrt(b * b + c * c + d * d);
        double m = Math.exp(a);
        if (v == 0)
            return new Quat(m, 0, 0, 0);
        double k = m * Math.sin(v) / v;
        return new Quat(m * Math.cos(v), k * b, k * c, k * d);
    }

    public Quat ln() {
        double n = norm();
        double v = Math.sqrt(b * b + c * c + d * d);
        if (v == 0)
            return new Quat(Math.log(n), a < 0 ? Math.PI : 0, 0, 0);
        double k = Math.acos(a / n) / v;
        return new Quat(Math.log(n), k * b, k * c, k * d);
    }

    public Quat pow(Quat exponent) {
        return exponent.mul(ln()).exp();
    }

    @Override
    public String show() {
        if (Double.isNaN(a) || Double.isNaN(b) || Double.isNaN(c) || Double.isNaN(d))
            return "NaN";

        StringBuilder buf = new StringBuilder();
        component(buf, a, "");
        component(buf, b, "i");
        component(buf, c, "j");
        component(buf, d, "k");
        return buf.length() == 0 ? "0" : buf.toString();
    }

    private static void component(StringBuilder buf, double x, String unit) {
        if (x == 0)
            return;
        if (buf.length() != 0 && x > 0)
            buf.append('+');
        if (x == Math.rint(x) && !Double.isInfinite(x) && Math.abs(x) < 1e15) {
            buf.append((long)x);
        } else {
            buf.append(x);
        }
        buf.append(unit);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Quat))
            return false;
        Quat that = (Quat)obj;
        return Double.compare(a, that.a) == 0 && Double.compare(b, that.b) == 0 &&
               Double.compare(c, that.c) == 0 && Double.compare(d, that.d) == 0;
    }

    @Override
    public int hashCode() {
        int h = Double.hashCode(a);
        h = 31 * h + Double.hashCode(b);
        h = 31 * h + Double.hashCode(c);
        h = 31 * h + Double.hashCode(d);
        return h;
    }

    @Override
    public String toString() {
        return "#Quat(" + a + ", " + b + ", " + c + ", " + d + ")";
    }
}
