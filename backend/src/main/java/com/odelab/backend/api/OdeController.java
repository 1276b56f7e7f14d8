package com.odelab.backend.api;

import com.odelab.backend.api.dto.SolveRequest;
import com.odelab.backend.api.dto.TrajectoryRequest;
import com.odelab.backend.domain.SolveResult;
import com.odelab.backend.domain.TrajectoryResult;
import com.odelab.backend.service.OdeService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/ode")
public class OdeController {

    private final OdeService ode;

    public OdeController(OdeService ode) {
        this.ode = ode;
    }

    /**
     * Always 200: syntax errors and unsupported equations are reported in the body's status.
     */
    @PostMapping("/solve")
    public SolveResult solve(@Valid @RequestBody SolveRequest req) {
        return ode.solve(req.equation);
    }

    @PostMapping("/trajectory")
    public TrajectoryResult trajectory(@Valid @RequestBody TrajectoryRequest req) {
        return ode.trajectory(req.equation, req.x0, req.y0, req.span, req.steps);
    }
}
