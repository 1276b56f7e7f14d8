package com.odelab.backend.api.dto;

import jakarta.validation.constraints.NotBlank;

public class SolveRequest {
    @NotBlank
    public String equation;
}
