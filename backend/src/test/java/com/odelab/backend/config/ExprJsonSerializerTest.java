package com.odelab.backend.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.odelab.backend.domain.SolveResult;
import com.odelab.backend.expr.parse.ExpressionParser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExprJsonSerializerTest {

    private final ObjectMapper om = new JacksonConfig().objectMapper();

    @Test
    void writesTaggedTree() throws Exception {
        JsonNode tree = om.readTree(om.writeValueAsString(ExpressionParser.parse("2 * sin(-x) ^ y")));

        assertThat(tree.path("type").asText()).isEqualTo("binary");
        assertThat(tree.path("op").asText()).isEqualTo("*");
        assertThat(tree.path("left").path("type").asText()).isEqualTo("number");
        assertThat(tree.path("left").path("value").asDouble()).isEqualTo(2.0);

        JsonNode pow = tree.path("right");
        assertThat(pow.path("op").asText()).isEqualTo("^");
        assertThat(pow.path("right").path("name").asText()).isEqualTo("y");

        JsonNode sin = pow.path("left");
        assertThat(sin.path("type").asText()).isEqualTo("function");
        assertThat(sin.path("name").asText()).isEqualTo("sin");
        assertThat(sin.path("argument").path("type").asText()).isEqualTo("unary");
        assertThat(sin.path("argument").path("op").asText()).isEqualTo("-");
        assertThat(sin.path("argument").path("argument").path("name").asText()).isEqualTo("x");
    }

    @Test
    void omitsAbsentResultFields() throws Exception {
        JsonNode tree = om.readTree(om.writeValueAsString(SolveResult.error("Equation is empty.")));

        assertThat(tree.path("status").asText()).isEqualTo("error");
        assertThat(tree.path("message").asText()).isEqualTo("Equation is empty.");
        assertThat(tree.has("rhs")).isFalse();
        assertThat(tree.has("steps")).isFalse();
        assertThat(tree.has("classification")).isFalse();
    }
}
