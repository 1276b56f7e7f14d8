package com.odelab.backend.expr.integrate;

import com.odelab.backend.expr.Expr;
import com.odelab.backend.expr.ExprEvaluator;
import com.odelab.backend.expr.Symbol;
import com.odelab.backend.expr.parse.ExpressionParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class IntegratorTest {

    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
            "5;                  5 * x",
            "ln(2);              ln(2) * x",
            "y;                  y * x",
            "x;                  x ^ 2 / 2",
            "x ^ 3;              x ^ 4 / 4",
            "x ^ -1;             ln(abs(x))",
            "x ^ 0.5;            x ^ 1.5 / 1.5",
            "1 / x;              ln(abs(x))",
            "1 / (x + 1);        ln(abs(x + 1))",
            "3 / (2*x + 1);      1.5 * ln(abs(2 * x + 1))",
            "x / 4;              x ^ 2 / 2 / 4",
            "-x;                 -(x ^ 2 / 2)",
            "exp(x);             exp(x)",
            "exp(2*x);           exp(2 * x) / 2",
            "sin(x);             -cos(x)",
            "cos(3*x);           sin(3 * x) / 3",
            "tan(x);             -ln(abs(cos(x)))",
            "sin(x) + x;         -cos(x) + x ^ 2 / 2",
            "2 * x;              2 * x ^ 2 / 2"
    })
    void rendersAntiderivative(String integrand, String expected) {
        Expr result = Integrator.integrate(ExpressionParser.parse(integrand), Symbol.X).orElseThrow();
        assertThat(result.render()).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "5", "x", "x ^ 3", "1 / (x + 1)", "3 / (2*x + 1)", "exp(2*x - 1)", "-sin(x / 2)",
            "cos(3*x) - 4 * x ^ -2", "tan(x + 0.5)", "x - sin(x)", "exp(-x) * 3", "7 / (1 - x)"
    })
    void derivativeOfResultMatchesIntegrand(String integrand) {
        Expr f = ExpressionParser.parse(integrand);
        Expr integral = Integrator.integrate(f, Symbol.X).orElseThrow();
        double h = 1e-5;
        for (double x : new double[] {0.3, 0.8, 1.7, 2.4}) {
            double numeric = (ExprEvaluator.evaluate(integral, x + h, 0) - ExprEvaluator.evaluate(integral, x - h, 0)) / (2 * h);
            assertThat(numeric).isCloseTo(ExprEvaluator.evaluate(f, x, 0), within(1e-5));
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "x * x", "x * sin(x)", "sqrt(x)", "exp(x ^ 2)", "(x + 1) ^ 2", "x / (x + 1)",
            "1 / x ^ 2", "sin(x) + x * x", "2 ^ x", "ln(x)", "abs(x)", "y / (x * y)"
    })
    void failsOutsideTheRuleSet(String integrand) {
        assertThat(Integrator.integrate(ExpressionParser.parse(integrand), Symbol.X)).isEmpty();
    }

    @Test
    void integratesWithRespectToTheRequestedVariable() {
        Expr result = Integrator.integrate(ExpressionParser.parse("1 / y"), Symbol.Y).orElseThrow();
        assertThat(result.render()).isEqualTo("ln(abs(y))");
        assertThat(Integrator.integrate(ExpressionParser.parse("x * y"), Symbol.Y).orElseThrow().render())
                .isEqualTo("x * y ^ 2 / 2");
    }

    @Test
    void resultIsSimplified() {
        Expr result = Integrator.integrate(ExpressionParser.parse("0 * x + 1"), Symbol.X).orElseThrow();
        assertThat(result.render()).isEqualTo("x");
    }
}
