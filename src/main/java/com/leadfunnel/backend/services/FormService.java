package com.leadfunnel.backend.services;

import com.leadfunnel.backend.dto.CreateFormRequest;
import com.leadfunnel.backend.dto.FormEmbedDto;
import com.leadfunnel.backend.dto.PublicFormDto;
import com.leadfunnel.backend.dto.UpdateFormRequest;
import com.leadfunnel.backend.models.Form;
import com.leadfunnel.backend.repositories.FormRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class FormService {

    static final String FORM_PATH = "/form/";

    private final FormRepository formRepository;

    @Transactional(readOnly = true)
    public List<Form> getAllForms() {
        return formRepository.findAllByOrderByCreatedAtDesc();
    }

    @Transactional(readOnly = true)
    public Optional<Form> getForm(Long formId) {
        return formRepository.findById(formId);
    }

    @Transactional(readOnly = true)
    public Optional<PublicFormDto> getPublicForm(Long formId) {
        return formRepository.findById(formId).map(PublicFormDto::from);
    }

    public Form createForm(CreateFormRequest request) {
        Form form = Form.builder()
                .name(request.getName())
                .description(request.getDescription())
                .active(request.getActive() != null ? request.getActive() : Boolean.TRUE)
                .build();

        Form saved = formRepository.save(form);
        log.info("Created form {} '{}'", saved.getId(), saved.getName());
        return saved;
    }

    public Optional<Form> updateForm(Long formId, UpdateFormRequest request) {
        return formRepository.findById(formId).map(form -> {
            if (request.getName() != null) {
                form.setName(request.getName());
            }
            if (request.getDescription() != null) {
                form.setDescription(request.getDescription());
            }
            if (request.getActive() != null) {
                form.setActive(request.getActive());
            }
            return formRepository.save(form);
        });
    }

    public boolean deleteForm(Long formId) {
        if (!formRepository.existsById(formId)) {
            return false;
        }
        formRepository.deleteById(formId);
        log.info("Deleted form {}", formId);
        return true;
    }

    /**
     * Direct link and iframe snippet for embedding the public form.
     *
     * @param baseUrl scheme, host and context path the public form is served from
     */
    @Transactional(readOnly = true)
    public Optional<FormEmbedDto> getEmbedCode(Long formId, String baseUrl) {
        return formRepository.findById(formId).map(form -> {
            String formUrl = stripTrailingSlash(baseUrl) + FORM_PATH + form.getId();
            return FormEmbedDto.builder()
                    .embedCode("<iframe src=\"" + formUrl + "\" width=\"100%\" height=\"600px\" frameborder=\"0\"></iframe>")
                    .directLink(formUrl)
                    .build();
        });
    }

    private String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
