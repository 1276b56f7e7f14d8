package com.odelab.backend.service;

import com.odelab.backend.config.SolverProperties;
import com.odelab.backend.domain.SolveResult;
import com.odelab.backend.domain.TrajectoryResult;
import com.odelab.backend.expr.parse.ExpressionSyntaxException;
import com.odelab.backend.numeric.DerivativeFunction;
import com.odelab.backend.numeric.PlotWindow;
import com.odelab.backend.numeric.Point;
import com.odelab.backend.numeric.Trajectory;
import com.odelab.backend.numeric.TrajectorySampler;
import com.odelab.backend.ode.EquationParser;
import com.odelab.backend.ode.OdeSolver;
import com.odelab.backend.ode.ParsedEquation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class OdeService {

    private static final Logger log = LoggerFactory.getLogger(OdeService.class);

    private final SolverProperties props;

    public OdeService(SolverProperties props) {
        this.props = props;
    }

    public SolveResult solve(String equation) {
        if (tooLong(equation)) {
            return SolveResult.error(lengthMessage());
        }
        SolveResult result = OdeSolver.solve(equation);
        log.info("solve '{}' -> {}", equation, result.status().label());
        return result;
    }

    /**
     * Samples the solution through (x0, y0); nulls fall back to the configured defaults.
     *
     * @throws ExpressionSyntaxException when the equation cannot be parsed
     */
    public TrajectoryResult trajectory(String equation, Double x0, Double y0, Double span, Integer steps) {
        if (tooLong(equation)) throw new ExpressionSyntaxException(lengthMessage());

        ParsedEquation parsed = EquationParser.parse(equation);
        double x = x0 != null ? x0 : props.defaultX0();
        double y = y0 != null ? y0 : props.defaultY0();
        double s = span != null ? span : props.span();
        int n = steps != null ? steps : props.stepsPerSide();

        Trajectory t = TrajectorySampler.sample(DerivativeFunction.of(parsed.rhs()), x, y, s, n);
        List<Point> points = t.points();
        PlotWindow window = points.size() < 2 ? null : PlotWindow.covering(points);
        if (window == null) {
            log.warn("Not enough finite points to plot {} from ({}, {})", parsed.normalized(), x, y);
        }
        return new TrajectoryResult(parsed.normalized(), x, y, x0 == null || y0 == null,
                t.forward(), t.backward(), points, window);
    }

    private boolean tooLong(String equation) {
        return equation != null && equation.length() > props.maxEquationLength();
    }

    private String lengthMessage() {
        return "Equation is longer than " + props.maxEquationLength() + " characters.";
    }
}
