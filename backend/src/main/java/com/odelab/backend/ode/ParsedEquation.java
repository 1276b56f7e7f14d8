package com.odelab.backend.ode;

import com.odelab.backend.expr.Expr;

public record ParsedEquation(Expr rhs, String normalized) {}
