package com.geonews.api.controller;

import com.geonews.api.model.InteractionEvent;
import com.geonews.api.model.InteractionRequest;
import com.geonews.api.service.InteractionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;

@RestController
@RequestMapping("/api/v1/interactions")
@RequiredArgsConstructor
@Tag(name = "Interactions", description = "User interaction intake")
public class InteractionController {

    private final InteractionService interactionService;

    @PostMapping
    @Operation(summary = "Record interaction", description = "Append a view, click, share, bookmark or comment")
    public ResponseEntity<InteractionEvent> record(@Valid @RequestBody InteractionRequest request) throws IOException {
        return ResponseEntity.status(HttpStatus.CREATED).body(interactionService.record(request));
    }
}
