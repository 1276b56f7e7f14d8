package com.odelab.backend.service;

import com.odelab.backend.config.SolverProperties;
import com.odelab.backend.domain.SolveResult;
import com.odelab.backend.domain.SolveStatus;
import com.odelab.backend.domain.TrajectoryResult;
import com.odelab.backend.expr.parse.ExpressionSyntaxException;
import com.odelab.backend.numeric.Point;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class OdeServiceTest {

    private final OdeService service = new OdeService(new SolverProperties(4, 160, 0, 1, 64));

    @Test
    void trajectoryFallsBackToConfiguredDefaults() {
        TrajectoryResult r = service.trajectory("dy/dx = y", null, null, null, null);

        assertThat(r.normalizedEquation()).isEqualTo("dy/dx = y");
        assertThat(r.x0()).isZero();
        assertThat(r.y0()).isEqualTo(1);
        assertThat(r.usedDefaults()).isTrue();
        assertThat(r.points()).hasSize(321);
        assertThat(r.window().xMin()).isCloseTo(-4, within(1e-9));
        assertThat(r.window().xMax()).isCloseTo(4, within(1e-9));
        assertThat(r.window().yMax()).isCloseTo(Math.exp(4), within(1e-4));
    }

    @Test
    void partialInitialPointStillCountsAsDefaulted() {
        TrajectoryResult r = service.trajectory("dy/dx = x", 2.0, null, 1.0, 10);

        assertThat(r.usedDefaults()).isTrue();
        assertThat(r.x0()).isEqualTo(2);
        assertThat(r.forward()).hasSize(10);
        assertThat(r.forward().get(9).x()).isCloseTo(3, within(1e-9));
        assertThat(r.backward().get(0).x()).isCloseTo(1, within(1e-9));
    }

    @Test
    void explicitInitialPoint() {
        TrajectoryResult r = service.trajectory("dy/dx = -y", 1.0, 2.0, null, null);
        assertThat(r.usedDefaults()).isFalse();
        assertThat(r.points()).contains(new Point(1, 2));
    }

    @Test
    void noWindowWithoutFinitePoints() {
        TrajectoryResult r = service.trajectory("dy/dx = y", 0.0, Double.NaN, null, null);
        assertThat(r.points()).isEmpty();
        assertThat(r.window()).isNull();
    }

    @Test
    void trajectoryRejectsUnparsableEquations() {
        assertThatThrownBy(() -> service.trajectory("y = x", null, null, null, null))
                .isInstanceOf(ExpressionSyntaxException.class)
                .hasMessage("Left-hand side must be dy/dx.");
    }

    @Test
    void overlongEquationsAreRejected() {
        String text = "dy/dx = " + "x + ".repeat(20) + "1";

        SolveResult r = service.solve(text);
        assertThat(r.status()).isEqualTo(SolveStatus.ERROR);
        assertThat(r.message()).isEqualTo("Equation is longer than 64 characters.");

        assertThatThrownBy(() -> service.trajectory(text, null, null, null, null))
                .isInstanceOf(ExpressionSyntaxException.class)
                .hasMessage("Equation is longer than 64 characters.");
    }

    @Test
    void solveDelegatesToTheSolver() {
        assertThat(service.solve("dy/dx = x*y").finalSolution()).isEqualTo("y = C · exp(x ^ 2 / 2)");
    }
}
