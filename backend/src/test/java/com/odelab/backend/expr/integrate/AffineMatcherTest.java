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

class AffineMatcherTest {

    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
            "3*x + 2;        3",
            "x/2 - 1;        0.5",
            "-(x - 4);       -1",
            "2*(x + 1)*3;    6",
            "x + y;          1",
            "5 - x/4 + y*2;  -0.25",
            "x;              1",
            "-x/-2;          0.5"
    })
    void recoversSlopeAndIntercept(String text, double slope) {
        Expr node = ExpressionParser.parse(text);
        LinearForm form = AffineMatcher.match(node, Symbol.X).orElseThrow();

        assertThat(form.a()).isCloseTo(slope, within(1e-12));
        assertThat(form.b().dependsOn(Symbol.X)).isFalse();
        for (double x : new double[] {-2.5, 0, 0.7, 3}) {
            double y = 1.3;
            double expected = ExprEvaluator.evaluate(node, x, y);
            double actual = form.a() * x + ExprEvaluator.evaluate(form.b(), x, y);
            assertThat(actual).isCloseTo(expected, within(1e-9));
        }
    }

    @Test
    void constantsHaveZeroSlope() {
        LinearForm form = AffineMatcher.match(ExpressionParser.parse("sin(y) + 4"), Symbol.X).orElseThrow();
        assertThat(form.isConstant()).isTrue();
        assertThat(form.b().render()).isEqualTo("sin(y) + 4");
    }

    @Test
    void cancellingSlopeIsReportedAsZero() {
        LinearForm form = AffineMatcher.match(ExpressionParser.parse("x - x + 1"), Symbol.X).orElseThrow();
        assertThat(form.a()).isZero();
    }

    @ParameterizedTest
    @ValueSource(strings = {"x * x", "1 / x", "x ^ 2", "sin(x)", "y * x", "x / 0", "exp(x) + 1", "(x + 1) / y"})
    void rejectsNonAffineShapes(String text) {
        assertThat(AffineMatcher.match(ExpressionParser.parse(text), Symbol.X)).isEmpty();
    }
}
