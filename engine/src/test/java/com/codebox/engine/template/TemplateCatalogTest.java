package com.codebox.engine.template;

import com.codebox.engine.model.CodeTemplate;
import com.codebox.engine.model.Language;
import com.codebox.engine.model.TemplateVisibility;
import com.codebox.engine.repository.CodeTemplateRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest(properties = "spring.jpa.hibernate.ddl-auto=none")
@Import(TemplateCatalog.class)
class TemplateCatalogTest {

    @Autowired CodeTemplateRepository repository;
    @Autowired TemplateCatalog        catalog;

    CodeTemplate publicLoop;
    CodeTemplate privateDraft;
    CodeTemplate retired;

    @BeforeEach
    void setUp() {
        publicLoop = template("loops", Language.GENERAL_PURPOSE, TemplateVisibility.PUBLIC, "instructor", "basics");
        privateDraft = template("draft", Language.DSL, TemplateVisibility.PRIVATE, "instructor", "basics");
        retired = template("old", Language.GENERAL_PURPOSE, TemplateVisibility.PUBLIC, "instructor", "archive");
        retired.setActive(false);
        repository.save(retired);
    }

    @Test
    void fetch_publicTemplate_visibleToAnyone() {
        assertThat(catalog.fetch(publicLoop.getId(), "student").getName()).isEqualTo("loops");
        assertThat(catalog.fetch(publicLoop.getId(), null).getName()).isEqualTo("loops");
    }

    @Test
    void fetch_privateTemplate_onlyOwner() {
        assertThat(catalog.fetch(privateDraft.getId(), "instructor").getLanguage()).isEqualTo(Language.DSL);

        assertThatThrownBy(() -> catalog.fetch(privateDraft.getId(), "student"))
                .isInstanceOf(TemplateAccessDeniedException.class);
    }

    @Test
    void fetch_inactiveOrUnknown_notFound() {
        assertThatThrownBy(() -> catalog.fetch(retired.getId(), "instructor"))
                .isInstanceOf(TemplateNotFoundException.class);
        assertThatThrownBy(() -> catalog.fetch(UUID.randomUUID(), "instructor"))
                .isInstanceOf(TemplateNotFoundException.class);
    }

    @Test
    void listVisible_respectsVisibilityActivityAndCategory() {
        assertThat(catalog.listVisible("student", null))
                .extracting(CodeTemplate::getName).containsExactly("loops");
        assertThat(catalog.listVisible("instructor", null))
                .extracting(CodeTemplate::getName).containsExactly("draft", "loops");
        assertThat(catalog.listVisible("instructor", "archive")).isEmpty();
        assertThat(catalog.listVisible("instructor", "basics")).hasSize(2);
    }

    private CodeTemplate template(String name, Language language, TemplateVisibility visibility,
                                  String owner, String category) {
        CodeTemplate t = new CodeTemplate(name, language, "print('" + name + "')", visibility, owner);
        t.setCategory(category);
        return repository.save(t);
    }
}
