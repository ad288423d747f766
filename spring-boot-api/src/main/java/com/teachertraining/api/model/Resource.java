package com.teachertraining.api.model;

import com.teachertraining.api.validation.HttpUrl;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

// Downloadable file attached to a module (PDF, slides...)
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Resource {
    @NotNull(message = "Resource label is required")
    private String label;

    @NotNull(message = "Resource url is required")
    @HttpUrl
    private String url;

    // Free-text tag: pdf | slides | doc | other. Not enforced.
    private String type;
}
