package com.teachertraining.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Note {

    @JsonProperty("user_id")
    @NotNull(message = "user_id is required")
    private String userId;

    @JsonProperty("module_id")
    @NotNull(message = "module_id is required")
    private String moduleId;

    @NotNull(message = "content must be a string")
    @Builder.Default
    private String content = "";
}
