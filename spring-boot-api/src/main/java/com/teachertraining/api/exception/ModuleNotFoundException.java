package com.teachertraining.api.exception;

import lombok.Getter;

@Getter
public class ModuleNotFoundException extends RuntimeException {

    private final String moduleId;

    public ModuleNotFoundException(String moduleId) {
        super("Module not found");
        this.moduleId = moduleId;
    }
}
