package com.odelab.backend.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class OdeControllerTest {

    @Autowired
    MockMvc mvc;

    @Test
    void solvesDirectEquation() throws Exception {
        mvc.perform(post("/api/v1/ode/solve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"equation\":\"dy/dx = 2*x\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.classification").value("direct"))
                .andExpect(jsonPath("$.normalizedEquation").value("dy/dx = 2 * x"))
                .andExpect(jsonPath("$.finalSolution").value("y(x) = 2 * x ^ 2 / 2 + C"))
                .andExpect(jsonPath("$.steps.length()").value(3))
                .andExpect(jsonPath("$.steps[0].equationLine").doesNotExist())
                .andExpect(jsonPath("$.rhs.type").value("binary"))
                .andExpect(jsonPath("$.rhs.op").value("*"))
                .andExpect(jsonPath("$.message").doesNotExist());
    }

    @Test
    void unsupportedAndInvalidEquationsAreStillOk() throws Exception {
        mvc.perform(post("/api/v1/ode/solve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"equation\":\"dy/dx = sin(x*y)\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("unsupported"))
                .andExpect(jsonPath("$.classification").value("unsupported"))
                .andExpect(jsonPath("$.rhs.type").value("function"))
                .andExpect(jsonPath("$.message").exists());

        mvc.perform(post("/api/v1/ode/solve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"equation\":\"dy/dx = x +\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.message").value(containsString("missing an operand")))
                .andExpect(jsonPath("$.normalizedEquation").doesNotExist());
    }

    @Test
    void blankEquationIsRejected() throws Exception {
        mvc.perform(post("/api/v1/ode/solve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"equation\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.message").value(containsString("equation")));
    }

    @Test
    void missingBodyIsRejected() throws Exception {
        mvc.perform(post("/api/v1/ode/solve").contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("body_required"));
    }

    @Test
    void samplesTrajectory() throws Exception {
        mvc.perform(post("/api/v1/ode/trajectory")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"equation\":\"dy/dx = y\",\"x0\":0,\"y0\":1}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.normalizedEquation").value("dy/dx = y"))
                .andExpect(jsonPath("$.usedDefaults").value(false))
                .andExpect(jsonPath("$.points.length()").value(321))
                .andExpect(jsonPath("$.forward.length()").value(160))
                .andExpect(jsonPath("$.points[160].y").value(1.0))
                .andExpect(jsonPath("$.points[0].finite").doesNotExist())
                .andExpect(jsonPath("$.window.xMin").value(closeTo(-4.0, 1e-6)))
                .andExpect(jsonPath("$.window.xMax").value(closeTo(4.0, 1e-6)));
    }

    @Test
    void trajectoryWithBadEquationIsBadRequest() throws Exception {
        mvc.perform(post("/api/v1/ode/trajectory")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"equation\":\"y = x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.message").value("Left-hand side must be dy/dx."));
    }

    @Test
    void trajectoryValidatesStepCount() throws Exception {
        mvc.perform(post("/api/v1/ode/trajectory")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"equation\":\"dy/dx = y\",\"steps\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(containsString("steps")));
    }

    @Test
    void healthIsUp() throws Exception {
        mvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }
}
