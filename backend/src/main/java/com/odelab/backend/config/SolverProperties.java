package com.odelab.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * odelab.solver.* settings.
 *
 * @param span              x distance sampled on each side of the initial point
 * @param stepsPerSide      RK4 steps on each side
 * @param defaultX0         initial x when the request has none
 * @param defaultY0         initial y when the request has none
 * @param maxEquationLength longer equation text is rejected before parsing
 */
@ConfigurationProperties(prefix = "odelab.solver")
public record SolverProperties(
        @DefaultValue("4") double span,
        @DefaultValue("160") int stepsPerSide,
        @DefaultValue("0") double defaultX0,
        @DefaultValue("1") double defaultY0,
        @DefaultValue("512") int maxEquationLength
) {}
