package com.teachertraining.api.controller;

import com.teachertraining.api.model.DiagnosticsReport;
import com.teachertraining.api.service.DiagnosticsService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private final DiagnosticsService diagnosticsService;

    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of("message", "Teacher Training API running");
    }

    // Status page: always 200, problems are described in the body
    @GetMapping("/test")
    public DiagnosticsReport test() {
        return diagnosticsService.inspect();
    }
}
