package com.phillippitts.structurecoach.presentation.controller;

import com.phillippitts.structurecoach.presentation.dto.FrameworkResponse;
import com.phillippitts.structurecoach.service.framework.FrameworkRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only view of the registered answer frameworks.
 */
@RestController
@RequestMapping("/api/frameworks")
class FrameworkController {

    private final FrameworkRegistry registry;

    FrameworkController(FrameworkRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    ResponseEntity<List<FrameworkResponse>> list() {
        return ResponseEntity.ok(registry.all().stream().map(FrameworkResponse::from).toList());
    }

    @GetMapping("/{name}")
    ResponseEntity<FrameworkResponse> get(@PathVariable String name) {
        return ResponseEntity.ok(FrameworkResponse.from(registry.require(name)));
    }
}
