package com.odelab.backend.ode;

import com.odelab.backend.domain.EquationKind;
import com.odelab.backend.expr.Expr;

public sealed interface Classification {

    EquationKind kind();

    // dy/dx = rhs(x)
    record Direct(Expr rhs) implements Classification {
        @Override
        public EquationKind kind() {
            return EquationKind.DIRECT;
        }
    }

    // dy/dx = xPart(x) * yPart(y)
    record Separable(Expr xPart, Expr yPart) implements Classification {
        @Override
        public EquationKind kind() {
            return EquationKind.SEPARABLE;
        }
    }

    // dy/dx = a(x) * y + b(x)
    record Linear(Expr a, Expr b) implements Classification {
        @Override
        public EquationKind kind() {
            return EquationKind.LINEAR;
        }
    }

    record Unsupported() implements Classification {
        @Override
        public EquationKind kind() {
            return EquationKind.UNSUPPORTED;
        }
    }
}
