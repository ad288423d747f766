package com.teachertraining.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.teachertraining.api.validation.HttpUrl;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A training video unit. Stored in the "module" collection; the store assigns the id.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TrainingModule {

    @NotNull(message = "Module title is required")
    private String title;

    private String description;

    @JsonProperty("video_url")
    @NotNull(message = "Module video_url is required")
    @HttpUrl
    private String videoUrl;

    @JsonProperty("thumbnail_url")
    @HttpUrl
    private String thumbnailUrl;

    private String category;

    // Chronological jump points, order is kept as sent
    @NotNull(message = "Module timestamps must be a list")
    @Builder.Default
    private List<@Valid @NotNull Timestamp> timestamps = new ArrayList<>();

    @NotNull(message = "Module resources must be a list")
    @Builder.Default
    private List<@Valid @NotNull Resource> resources = new ArrayList<>();
}
