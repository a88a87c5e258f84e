package com.codebox.engine.api;

import com.codebox.engine.api.dto.TemplateResponse;
import com.codebox.engine.template.TemplateAccessDeniedException;
import com.codebox.engine.template.TemplateCatalog;
import com.codebox.engine.template.TemplateNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * GET /templates/{id}?requester=           - one template (404 unknown or inactive, 403 private)
 * GET /templates?requester=&category=      - templates visible to the requester
 */
@RestController
@RequestMapping("/templates")
public class TemplateController {

    private final TemplateCatalog catalog;

    public TemplateController(TemplateCatalog catalog) {
        this.catalog = catalog;
    }

    @GetMapping("/{id}")
    public TemplateResponse get(@PathVariable UUID id,
                                @RequestParam(required = false) String requester) {
        try {
            return TemplateResponse.from(catalog.fetch(id, requester));
        } catch (TemplateNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (TemplateAccessDeniedException e) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, e.getMessage());
        }
    }

    @GetMapping
    public List<TemplateResponse> list(@RequestParam(required = false) String requester,
                                       @RequestParam(required = false) String category) {
        return catalog.listVisible(requester, category).stream()
                .map(TemplateResponse::from)
                .toList();
    }
}
