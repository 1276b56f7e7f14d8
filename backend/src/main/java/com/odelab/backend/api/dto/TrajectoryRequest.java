package com.odelab.backend.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

public class TrajectoryRequest {
    @NotBlank
    public String equation;

    // optional; configured defaults apply when missing
    public Double x0;
    public Double y0;

    @Positive
    public Double span;

    @Min(1)
    @Max(5000)
    public Integer steps;
}
