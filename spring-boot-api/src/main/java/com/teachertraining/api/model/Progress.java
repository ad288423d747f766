package com.teachertraining.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A user's viewing state for one module. At most one per (user_id, module_id).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Progress {

    @JsonProperty("user_id")
    @NotNull(message = "user_id is required")
    private String userId;

    // Stringified ObjectId of the module
    @JsonProperty("module_id")
    @NotNull(message = "module_id is required")
    private String moduleId;

    // Last watched position in seconds
    @JsonProperty("last_position")
    @NotNull(message = "last_position must be an integer")
    @Min(value = 0, message = "last_position must be >= 0")
    @Builder.Default
    private Integer lastPosition = 0;

    @NotNull(message = "completed must be a boolean")
    @Builder.Default
    private Boolean completed = false;
}
