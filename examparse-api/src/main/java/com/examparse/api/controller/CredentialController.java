package com.examparse.api.controller;

import com.examparse.api.dto.request.ApiKeyRequest;
import com.examparse.core.service.ExamParsingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Runtime rotation of the model API key. Calls started after the update use the new key.
 */
@RestController
@RequestMapping("/api/v1/credentials")
@RequiredArgsConstructor
@Slf4j
public class CredentialController {

    private final ExamParsingService parsingService;

    @PutMapping("/api-key")
    public ResponseEntity<Void> updateApiKey(@Valid @RequestBody ApiKeyRequest request) {
        parsingService.updateApiKey(request.getApiKey());
        log.info("[GEMINI] API key updated through the API");
        return ResponseEntity.noContent().build();
    }
}
