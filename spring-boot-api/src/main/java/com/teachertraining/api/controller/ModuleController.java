package com.teachertraining.api.controller;

import com.teachertraining.api.model.SeedResult;
import com.teachertraining.api.model.TrainingModule;
import com.teachertraining.api.service.ModuleService;
import com.teachertraining.api.service.SeedService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class ModuleController {

    private final ModuleService moduleService;
    private final SeedService seedService;

    @PostMapping("/seed")
    public SeedResult seed() {
        return seedService.seedModules();
    }

    @PostMapping("/modules")
    public IdResponse createModule(@Valid @RequestBody TrainingModule module) {
        log.debug("Create module request: title='{}'", module.getTitle());
        return new IdResponse(moduleService.createModule(module));
    }

    @GetMapping("/modules")
    public List<Map<String, Object>> listModules(@RequestParam(required = false) Integer limit) {
        return moduleService.listModules(limit);
    }

    @GetMapping("/modules/{id}")
    public Map<String, Object> getModule(@PathVariable String id) {
        return moduleService.getModule(id);
    }

    record IdResponse(String id) {}
}
