package com.codebox.engine.template;

import com.codebox.engine.model.CodeTemplate;
import com.codebox.engine.repository.CodeTemplateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Read-only access to code templates with visibility enforcement.
 *
 * Inactive templates behave exactly like missing ones, so callers cannot
 * tell a retired template from an id that never existed.
 */
@Service
public class TemplateCatalog {

    private static final Logger log = LoggerFactory.getLogger(TemplateCatalog.class);

    private final CodeTemplateRepository templates;

    public TemplateCatalog(CodeTemplateRepository templates) {
        this.templates = templates;
    }

    /**
     * @throws TemplateNotFoundException     unknown or inactive id
     * @throws TemplateAccessDeniedException private template, requester is not the owner
     */
    @Transactional(readOnly = true)
    public CodeTemplate fetch(UUID templateId, String requester) {
        CodeTemplate template = templates.findById(templateId)
                .filter(CodeTemplate::isActive)
                .orElseThrow(() -> new TemplateNotFoundException(templateId));

        if (!template.isVisibleTo(requester)) {
            log.info("Denied template {} to requester {}", templateId, requester);
            throw new TemplateAccessDeniedException(templateId, requester);
        }
        return template;
    }

    /** Active templates the requester may see, optionally narrowed to one category. */
    @Transactional(readOnly = true)
    public List<CodeTemplate> listVisible(String requester, String category) {
        if (category == null || category.isBlank()) {
            return templates.findVisibleTo(requester);
        }
        return templates.findVisibleToByCategory(requester, category);
    }
}
