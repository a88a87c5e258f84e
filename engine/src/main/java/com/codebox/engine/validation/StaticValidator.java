package com.codebox.engine.validation;

import com.codebox.engine.model.ExecutionRequest;
import com.codebox.engine.policy.SecurityPolicy;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cheap pre-flight check run before any process is spawned.
 *
 * Pure function of (request, policy). Checks, in order:
 *   1. source size in UTF-8 bytes against max_source_bytes
 *   2. language against languages_enabled
 *   3. a lexical scan for forbidden imports and forbidden calls
 *
 * The scan works on raw text, not a parse tree. It also looks inside string
 * literals and comments, so {@code print("eval(x)")} is rejected. That
 * over-blocking is accepted; obfuscated equivalents (getattr tricks, string
 * building) are not caught here and are left to the sandbox.
 */
@Component
public class StaticValidator {

    // from a.b import x
    private static final Pattern FROM_IMPORT = Pattern.compile(
            "\\bfrom\\s+([A-Za-z_][\\w.]*)\\s+import\\b");

    // import a, b.c as d
    private static final Pattern PLAIN_IMPORT = Pattern.compile(
            "\\bimport\\s+([A-Za-z_][\\w.]*(?:\\s+as\\s+\\w+)?(?:\\s*,\\s*[A-Za-z_][\\w.]*(?:\\s+as\\s+\\w+)?)*)");

    // Jac: import:py a;   import:py from a { x }   import:jac a.b;
    private static final Pattern JAC_IMPORT = Pattern.compile(
            "\\bimport\\s*:\\s*\\w+\\s+(?:from\\s+)?([A-Za-z_][\\w.]*)");

    // name(   a.b.c (   a dotted identifier chain directly before an opening paren
    private static final Pattern CALL = Pattern.compile(
            "(?<![\\w.])([A-Za-z_]\\w*(?:\\s*\\.\\s*[A-Za-z_]\\w*)*)\\s*\\(");

    private static final Pattern AS_CLAUSE = Pattern.compile("\\s+as\\s+\\w+$");

    public ValidationOutcome validate(ExecutionRequest request, SecurityPolicy policy) {
        if (request.sourceBytes() > policy.maxSourceBytes()) {
            return ValidationOutcome.rejected(ValidationOutcome.Reason.SOURCE_TOO_LARGE,
                    request.sourceBytes() + " > " + policy.maxSourceBytes() + " bytes");
        }
        if (!policy.languageEnabled(request.language())) {
            return ValidationOutcome.rejected(ValidationOutcome.Reason.LANGUAGE_DISABLED,
                    request.language().wireName());
        }

        String source = request.sourceText();
        Optional<String> forbidden = findForbiddenImport(source, policy)
                .or(() -> findForbiddenCall(source, policy));
        return forbidden
                .map(name -> ValidationOutcome.rejected(ValidationOutcome.Reason.FORBIDDEN_CONSTRUCT, name))
                .orElseGet(ValidationOutcome::ok);
    }

    // ------------------------------------------------------------------
    // Imports
    // ------------------------------------------------------------------

    Optional<String> findForbiddenImport(String source, SecurityPolicy policy) {
        if (policy.forbiddenImports().isEmpty()) return Optional.empty();
        for (String module : importedModules(source)) {
            for (String entry : policy.forbiddenImports()) {
                if (module.equals(entry) || module.startsWith(entry + ".")) {
                    return Optional.of(entry);
                }
            }
        }
        return Optional.empty();
    }

    /** Every module name mentioned by an import statement, in source order per pattern. */
    static List<String> importedModules(String source) {
        List<String> modules = new ArrayList<>();

        Matcher from = FROM_IMPORT.matcher(source);
        while (from.find()) modules.add(from.group(1));

        Matcher jac = JAC_IMPORT.matcher(source);
        while (jac.find()) modules.add(jac.group(1));

        Matcher plain = PLAIN_IMPORT.matcher(source);
        while (plain.find()) {
            for (String part : plain.group(1).split(",")) {
                String name = AS_CLAUSE.matcher(part.strip()).replaceFirst("");
                if (!name.isEmpty()) modules.add(name);
            }
        }
        return modules;
    }

    // ------------------------------------------------------------------
    // Calls
    // ------------------------------------------------------------------

    Optional<String> findForbiddenCall(String source, SecurityPolicy policy) {
        if (policy.forbiddenCalls().isEmpty()) return Optional.empty();
        Matcher m = CALL.matcher(source);
        while (m.find()) {
            String callee = m.group(1).replaceAll("\\s+", "");
            for (String entry : policy.forbiddenCalls()) {
                // "eval" also matches builtins.eval(...) and obj.eval(...)
                if (callee.equals(entry) || callee.endsWith("." + entry)) {
                    return Optional.of(entry);
                }
            }
        }
        return Optional.empty();
    }
}
