package com.codebox.engine.repository;

import com.codebox.engine.model.SecurityPolicyDocument;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SecurityPolicyDocumentRepository extends JpaRepository<SecurityPolicyDocument, Integer> {
}
