package com.aiinpocket.ngplus.controller;

import com.aiinpocket.ngplus.model.dto.InstantiateRequest;
import com.aiinpocket.ngplus.model.dto.TemplateRequest;
import com.aiinpocket.ngplus.model.dto.TemplateView;
import com.aiinpocket.ngplus.model.entity.Mission;
import com.aiinpocket.ngplus.service.template.TemplateService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/templates")
@RequiredArgsConstructor
public class TemplateController {

    private final TemplateService templateService;

    @GetMapping
    public List<TemplateView> list() {
        return templateService.list();
    }

    @GetMapping("/{id}")
    public TemplateView get(@PathVariable String id) {
        return templateService.get(id);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public TemplateView create(@Valid @RequestBody TemplateRequest request) {
        return templateService.createTemplate(request);
    }

    @PostMapping("/{id}/instantiate")
    @ResponseStatus(HttpStatus.CREATED)
    public List<Mission> instantiate(@PathVariable String id, @Valid @RequestBody InstantiateRequest request) {
        return templateService.instantiate(id, request.skillIds());
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String id) {
        templateService.deleteTemplate(id);
    }
}
