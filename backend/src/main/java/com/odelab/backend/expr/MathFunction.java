package com.odelab.backend.expr;

import java.util.Arrays;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum MathFunction {
    SIN("sin", Math::sin),
    COS("cos", Math::cos),
    TAN("tan", Math::tan),
    COT("cot", v -> 1 / Math.tan(v)),
    SEC("sec", v -> 1 / Math.cos(v)),
    CSC("csc", v -> 1 / Math.sin(v)),
    EXP("exp", Math::exp),
    LN("ln", Math::log),
    LOG("log", Math::log),
    SQRT("sqrt", Math::sqrt),
    ABS("abs", Math::abs);

    private static final Map<String, MathFunction> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(MathFunction::functionName, Function.identity()));

    private final String functionName;
    private final DoubleUnaryOperator fn;

    MathFunction(String functionName, DoubleUnaryOperator fn) {
        this.functionName = functionName;
        this.fn = fn;
    }

    public String functionName() {
        return functionName;
    }

    public double apply(double arg) {
        return fn.applyAsDouble(arg);
    }

    // null when unknown
    public static MathFunction byName(String name) {
        return BY_NAME.get(name);
    }
}
