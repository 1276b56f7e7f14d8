package com.odelab.backend.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.odelab.backend.expr.Expr;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JacksonConfig {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper om = new ObjectMapper();
        // expression trees go out as tagged JSON, see ExprJsonSerializer
        SimpleModule exprModule = new SimpleModule("expr");
        exprModule.addSerializer(Expr.class, new ExprJsonSerializer());
        om.registerModule(exprModule);
        // optional result fields are omitted instead of written as null
        om.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        return om;
    }
}
