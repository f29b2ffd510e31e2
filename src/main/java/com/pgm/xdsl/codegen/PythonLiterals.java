package com.pgm.xdsl.codegen;

import java.util.List;

/** Formats Java values as Python literals. */
final class PythonLiterals {
    private PythonLiterals() {
    }

    static String floatLiteral(double v) {
        if (Double.isNaN(v))
            return "float('nan')";
        if (v == Double.POSITIVE_INFINITY)
            return "float('inf')";
        if (v == Double.NEGATIVE_INFINITY)
            return "float('-inf')";
        return Double.toString(v);
    }

    static String floatList(List<Double> values) {
        StringBuilder sb = new StringBuilder(values.size() * 6 + 2).append('[');
        for (int i = 0; i < values.size(); i++) {
            if (i > 0)
                sb.append(", ");
            sb.append(floatLiteral(values.get(i)));
        }
        return sb.append(']').toString();
    }
}
