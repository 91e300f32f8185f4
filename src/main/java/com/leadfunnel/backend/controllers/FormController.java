package com.leadfunnel.backend.controllers;

import com.leadfunnel.backend.dto.CreateFormRequest;
import com.leadfunnel.backend.dto.FormEmbedDto;
import com.leadfunnel.backend.dto.PublicFormDto;
import com.leadfunnel.backend.dto.UpdateFormRequest;
import com.leadfunnel.backend.models.Form;
import com.leadfunnel.backend.services.FormService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class FormController {

    private final FormService formService;

    @GetMapping("/admin/forms")
    public ResponseEntity<List<Form>> getForms() {
        return ResponseEntity.ok(formService.getAllForms());
    }

    @GetMapping("/admin/forms/{formId}")
    public ResponseEntity<Form> getForm(@PathVariable Long formId) {
        return formService.getForm(formId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/admin/forms")
    public ResponseEntity<Form> createForm(@Valid @RequestBody CreateFormRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(formService.createForm(request));
    }

    @PatchMapping("/admin/forms/{formId}")
    public ResponseEntity<Form> updateForm(@PathVariable Long formId, @Valid @RequestBody UpdateFormRequest request) {
        return formService.updateForm(formId, request)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/admin/forms/{formId}")
    public ResponseEntity<Void> deleteForm(@PathVariable Long formId) {
        if (!formService.deleteForm(formId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/admin/forms/{formId}/embed")
    public ResponseEntity<FormEmbedDto> getEmbedCode(@PathVariable Long formId) {
        String baseUrl = ServletUriComponentsBuilder.fromCurrentContextPath().build().toUriString();
        return formService.getEmbedCode(formId, baseUrl)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    // Public, no admin data
    @GetMapping("/forms/{formId}")
    public ResponseEntity<PublicFormDto> getPublicForm(@PathVariable Long formId) {
        return formService.getPublicForm(formId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
