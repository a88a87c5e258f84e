package com.codebox.engine.repository;

import com.codebox.engine.model.CodeTemplate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface CodeTemplateRepository extends JpaRepository<CodeTemplate, UUID> {

    /** Active templates that are public or owned by the requester, by name. */
    @Query("""
            SELECT t FROM CodeTemplate t
            WHERE t.active = true
              AND (t.visibility = com.codebox.engine.model.TemplateVisibility.PUBLIC
                   OR t.ownerId = :requester)
            ORDER BY t.name ASC
            """)
    List<CodeTemplate> findVisibleTo(@Param("requester") String requester);

    @Query("""
            SELECT t FROM CodeTemplate t
            WHERE t.active = true
              AND t.category = :category
              AND (t.visibility = com.codebox.engine.model.TemplateVisibility.PUBLIC
                   OR t.ownerId = :requester)
            ORDER BY t.name ASC
            """)
    List<CodeTemplate> findVisibleToByCategory(@Param("requester") String requester,
                                               @Param("category") String category);
}
