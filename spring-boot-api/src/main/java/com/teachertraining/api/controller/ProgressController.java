package com.teachertraining.api.controller;

import com.teachertraining.api.model.Progress;
import com.teachertraining.api.service.ProgressService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/progress")
@RequiredArgsConstructor
public class ProgressController {

    private final ProgressService progressService;

    @PostMapping
    public Map<String, Object> saveProgress(@Valid @RequestBody Progress progress) {
        return progressService.saveProgress(progress);
    }

    @GetMapping
    public Map<String, Object> getProgress(@RequestParam("user_id") String userId,
                                           @RequestParam("module_id") String moduleId) {
        return progressService.getProgress(userId, moduleId);
    }
}
