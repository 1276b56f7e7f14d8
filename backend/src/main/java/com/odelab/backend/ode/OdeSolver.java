package com.odelab.backend.ode;

import com.odelab.backend.domain.EquationKind;
import com.odelab.backend.domain.SolutionStep;
import com.odelab.backend.domain.SolveResult;
import com.odelab.backend.expr.Expr;
import com.odelab.backend.expr.MathFunction;
import com.odelab.backend.expr.Simplifier;
import com.odelab.backend.expr.Symbol;
import com.odelab.backend.expr.integrate.Integrator;
import com.odelab.backend.expr.parse.ExpressionSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Solves {@code dy/dx = f(x, y)} for the direct, separable and first-order
 * linear families and records the derivation as a list of steps.
 * <p>
 * {@link #solve} never throws for bad input: syntax problems and missing
 * antiderivatives come back as {@code error}, unrecognized shapes as
 * {@code unsupported}.
 */
public final class OdeSolver {

    private static final Logger log = LoggerFactory.getLogger(OdeSolver.class);

    static final String UNSUPPORTED_MESSAGE =
            "This equation is not supported yet. Try a simpler form, or a separable or first-order linear equation.";

    private OdeSolver() {}

    public static SolveResult solve(String equation) {
        ParsedEquation parsed;
        try {
            parsed = EquationParser.parse(equation);
        } catch (ExpressionSyntaxException e) {
            log.debug("Rejected equation '{}': {}", equation, e.getMessage());
            return SolveResult.error(e.getMessage());
        }

        Classification classification = OdeClassifier.classify(parsed.rhs());
        log.debug("{} classified as {}", parsed.normalized(), classification.kind().label());
        try {
            if (classification instanceof Classification.Direct d) return direct(parsed, d);
            if (classification instanceof Classification.Separable s) return separable(parsed, s);
            if (classification instanceof Classification.Linear l) return linear(parsed, l);
        } catch (UnsolvableEquationException e) {
            log.debug("No antiderivative for {}: {}", parsed.normalized(), e.getMessage());
            return SolveResult.error(e.getMessage());
        }
        return SolveResult.unsupported(parsed.normalized(), parsed.rhs(), UNSUPPORTED_MESSAGE);
    }

    // ---------------- direct ----------------

    static SolveResult direct(ParsedEquation parsed, Classification.Direct c) {
        Expr integral = Integrator.integrate(c.rhs(), Symbol.X)
                .orElseThrow(() -> new UnsolvableEquationException(
                        "The right-hand side cannot be integrated with the supported rules."));

        String solution = "y(x) = " + integral.render() + " + C";
        List<SolutionStep> steps = List.of(
                SolutionStep.of("Step 1: Identify the structure",
                        "The right-hand side depends on x only, so both sides can be integrated directly."),
                SolutionStep.of("Step 2: Integrate both sides",
                        "The left side integrates to y and the right side to the antiderivative of the x function.",
                        "∫ dy = ∫ (" + c.rhs().render() + ") dx"),
                SolutionStep.of("Step 3: General solution",
                        "Carrying out the integration gives the general solution.",
                        solution)
        );
        return SolveResult.ok(EquationKind.DIRECT, parsed.normalized(),
                "This equation depends on x only, so a single integration solves it.",
                steps, solution, parsed.rhs());
    }

    // ---------------- separable ----------------

    static SolveResult separable(ParsedEquation parsed, Classification.Separable c) {
        Expr leftIntegrand = Simplifier.div(Expr.num(1), c.yPart());
        Expr left = Integrator.integrate(leftIntegrand, Symbol.Y).orElse(null);
        Expr right = Integrator.integrate(c.xPart(), Symbol.X).orElse(null);
        if (left == null || right == null) {
            throw new UnsolvableEquationException(
                    "The integrals needed to separate the variables could not be computed.");
        }

        String xText = c.xPart().render();
        String yText = c.yPart().render();
        String implicit = left.render() + " = " + right.render() + " + C";
        String explicit = explicitForm(left, right);

        List<SolutionStep> steps = new ArrayList<>();
        steps.add(SolutionStep.of("Step 1: Recognize a separable equation",
                "The right-hand side is a product of a function of x and a function of y."));
        steps.add(SolutionStep.of("Step 2: Separate the variables",
                "Divide so that each side holds a single variable.",
                "1/(" + yText + ") dy = (" + xText + ") dx"));
        steps.add(SolutionStep.of("Step 3: Integrate both sides",
                "Integrate each side to relate x and y.",
                "∫ 1/(" + yText + ") dy = ∫ (" + xText + ") dx"));
        steps.add(SolutionStep.of("Step 4: General solution",
                "The result is written implicitly, and explicitly where the logarithm allows it.",
                implicit));
        if (explicit != null) {
            steps.add(SolutionStep.of("Step 5: Explicit solution",
                    "Exponentiating the logarithm gives y explicitly.",
                    explicit));
        }
        return SolveResult.ok(EquationKind.SEPARABLE, parsed.normalized(),
                "This equation is separable. Move the y terms to one side and the x terms to the other.",
                steps, explicit != null ? explicit : implicit, parsed.rhs());
    }

    /** {@code ln(abs(y)) = R + C} solves to {@code y = C · exp(R)}. */
    static String explicitForm(Expr left, Expr right) {
        if (left instanceof Expr.Call ln && ln.function() == MathFunction.LN
                && ln.argument() instanceof Expr.Call abs && abs.function() == MathFunction.ABS
                && abs.argument().isVar(Symbol.Y)) {
            return "y = C · exp(" + right.render() + ")";
        }
        return null;
    }

    // ---------------- linear ----------------

    static SolveResult linear(ParsedEquation parsed, Classification.Linear c) {
        Expr p = Simplifier.negate(c.a());
        Expr q = Simplifier.simplify(c.b());
        Expr integralP = Integrator.integrate(p, Symbol.X)
                .orElseThrow(() -> new UnsolvableEquationException("The integral of P(x) could not be computed."));

        Expr mu = Simplifier.call(MathFunction.EXP, integralP);
        Expr muQ = Simplifier.mul(mu, q);
        Expr integralMuQ = Integrator.integrate(muQ, Symbol.X).orElse(null);

        String muText = mu.render();
        String muQText = muQ.render();
        String solution;
        if (integralMuQ != null) {
            solution = "y(x) = (" + integralMuQ.render() + " + C) / " + muText;
        } else {
            log.debug("Leaving ∫({}) dx unevaluated for {}", muQText, parsed.normalized());
            solution = "y(x) = (1/" + muText + ") * (∫ (" + muQText + ") dx + C)";
        }

        List<SolutionStep> steps = new ArrayList<>();
        steps.add(SolutionStep.of("Step 1: Recognize a first-order linear equation",
                "Rewrite the equation in the form dy/dx + P(x) y = Q(x)."));
        steps.add(SolutionStep.of("Step 2: Determine P(x) and Q(x)",
                "P(x) is the negated coefficient of y and Q(x) is the remaining part.",
                "P(x) = " + p.render() + ", Q(x) = " + q.render()));
        steps.add(SolutionStep.of("Step 3: Integrating factor",
                "The integrating factor is μ(x) = exp(∫ P(x) dx).",
                "μ(x) = exp(" + integralP.render() + ") = " + muText));
        steps.add(SolutionStep.of("Step 4: Multiply through by μ(x)",
                "After multiplying by μ(x) the left side is the derivative of μ(x)·y.",
                "d/dx [μ(x) · y] = μ(x) · Q(x) = " + muQText));
        steps.add(SolutionStep.of("Step 5: Integrate",
                "Integrate both sides with respect to x to find μ(x)·y.",
                "μ(x) · y = ∫ (" + muQText + ") dx + C"));
        if (integralMuQ != null) {
            steps.add(SolutionStep.of("Step 6: Final solution",
                    "Dividing by μ(x) gives the solution.",
                    solution));
        } else {
            steps.add(SolutionStep.of("Step 6: General form",
                    "The remaining integral has no closed form under the supported rules, so it is left unevaluated.",
                    solution));
        }
        return SolveResult.ok(EquationKind.LINEAR, parsed.normalized(),
                "This is a first-order linear equation. Compute the integrating factor and multiply through by it.",
                steps, solution, parsed.rhs());
    }
}
