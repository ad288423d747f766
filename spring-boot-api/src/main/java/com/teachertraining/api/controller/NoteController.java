package com.teachertraining.api.controller;

import com.teachertraining.api.model.Note;
import com.teachertraining.api.service.NoteService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/notes")
@RequiredArgsConstructor
public class NoteController {

    private final NoteService noteService;

    @PostMapping
    public Map<String, Object> saveNote(@Valid @RequestBody Note note) {
        return noteService.saveNote(note);
    }

    @GetMapping
    public Map<String, Object> getNote(@RequestParam("user_id") String userId,
                                       @RequestParam("module_id") String moduleId) {
        return noteService.getNote(userId, moduleId);
    }
}
