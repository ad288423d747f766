package com.teachertraining.api.model;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A jump point inside a module video. Embedded in {@link TrainingModule}, never stored alone.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Timestamp {
    @NotBlank(message = "Timestamp label is required")
    private String label;

    // Seconds from the start of the video
    @NotNull(message = "Timestamp time is required")
    @Min(value = 0, message = "Timestamp time must be >= 0")
    private Integer time;
}
