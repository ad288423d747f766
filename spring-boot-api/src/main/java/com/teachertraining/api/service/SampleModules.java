package com.teachertraining.api.service;

import com.teachertraining.api.model.Resource;
import com.teachertraining.api.model.Timestamp;
import com.teachertraining.api.model.TrainingModule;

import java.util.List;

/**
 * Demo catalogue inserted by POST /api/seed into an empty module collection.
 */
final class SampleModules {

    private static final String SAMPLE_VIDEO = "https://samplelib.com/lib/preview/mp4/sample-5s.mp4";
    private static final String DUMMY_PDF = "https://www.w3.org/WAI/ER/tests/xhtml/testfiles/resources/pdf/dummy.pdf";

    private SampleModules() {
    }

    static List<TrainingModule> all() {
        return List.of(
                TrainingModule.builder()
                        .title("Classroom Management: Routines that Work")
                        .description("Establishing smooth routines to reduce disruptions.")
                        .videoUrl(SAMPLE_VIDEO)
                        .thumbnailUrl("https://images.unsplash.com/photo-1529070538774-1843cb3265df?w=1200&q=80&auto=format&fit=crop")
                        .category("Classroom")
                        .timestamps(List.of(
                                new Timestamp("Overview", 5),
                                new Timestamp("Entry Routine", 20),
                                new Timestamp("Transitions", 40)))
                        .resources(List.of(new Resource("Routine Checklist (PDF)", DUMMY_PDF, "pdf")))
                        .build(),
                TrainingModule.builder()
                        .title("Differentiation: Tiered Tasks")
                        .description("Design assignments that meet students where they are.")
                        .videoUrl(SAMPLE_VIDEO)
                        .thumbnailUrl("https://images.unsplash.com/photo-1509062522246-3755977927d7?w=1200&q=80&auto=format&fit=crop")
                        .category("Instruction")
                        .timestamps(List.of(
                                new Timestamp("Why Tiering", 6),
                                new Timestamp("Examples", 18)))
                        .resources(List.of(new Resource("Tiered Task Templates", "https://www.africau.edu/images/default/sample.pdf", "pdf")))
                        .build(),
                TrainingModule.builder()
                        .title("Assessment: Quick Formative Checks")
                        .description("Gather real-time data to adjust instruction.")
                        .videoUrl(SAMPLE_VIDEO)
                        .thumbnailUrl("https://images.unsplash.com/photo-1523580846011-d3a5bc25702b?w=1200&q=80&auto=format&fit=crop")
                        .category("Assessment")
                        .timestamps(List.of(
                                new Timestamp("Entry Tickets", 8),
                                new Timestamp("Exit Tickets", 16)))
                        .resources(List.of(new Resource("Formative Check Bank", DUMMY_PDF, "pdf")))
                        .build());
    }
}
