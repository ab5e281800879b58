package com.adlanda.phoneadvisor.controller;

import com.adlanda.phoneadvisor.model.AskRequest;
import com.adlanda.phoneadvisor.model.AskResponse;
import com.adlanda.phoneadvisor.model.PhoneRecord;
import com.adlanda.phoneadvisor.repository.PhoneCatalog;
import com.adlanda.phoneadvisor.service.PhoneAdvisorService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for asking questions and browsing the catalog.
 */
@RestController
@RequestMapping("/api/v1")
public class AdvisorController {

    private final PhoneAdvisorService advisorService;
    private final PhoneCatalog catalog;

    public AdvisorController(PhoneAdvisorService advisorService, PhoneCatalog catalog) {
        this.advisorService = advisorService;
        this.catalog = catalog;
    }

    /**
     * Answer a question about Samsung phones.
     *
     * Supports specs ("What are the specs of Galaxy S23 Ultra?"), comparisons
     * ("Compare Galaxy S23 Ultra and S22 Ultra for photography") and recommendations
     * ("Which Samsung phone has the best battery under $1000?").
     */
    @PostMapping("/ask")
    public ResponseEntity<AskResponse> ask(@Valid @RequestBody AskRequest request) {
        return ResponseEntity.ok(new AskResponse(advisorService.answer(request.question())));
    }

    /**
     * List every phone in the catalog.
     */
    @GetMapping("/phones")
    public ResponseEntity<List<PhoneRecord>> getAllPhones() {
        return ResponseEntity.ok(catalog.listAll());
    }

    /**
     * Get one phone by model name; partial names such as "S24 Ultra" are accepted.
     */
    @GetMapping("/phones/{modelName}")
    public ResponseEntity<PhoneRecord> getPhone(@PathVariable String modelName) {
        return catalog.getByExactOrSubstringName(modelName)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new PhoneNotFoundException(modelName));
    }
}
