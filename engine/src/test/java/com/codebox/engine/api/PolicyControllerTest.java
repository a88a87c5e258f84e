package com.codebox.engine.api;

import com.codebox.engine.config.CodeboxProperties;
import com.codebox.engine.model.Language;
import com.codebox.engine.policy.PolicyReloadResult;
import com.codebox.engine.policy.PolicyStore;
import com.codebox.engine.policy.SecurityPolicy;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(PolicyController.class)
@Import(CodeboxProperties.class)
class PolicyControllerTest {

    @Autowired MockMvc mockMvc;
    @MockitoBean PolicyStore policyStore;

    @Test
    void getPolicy_returnsActivePolicy() throws Exception {
        when(policyStore.current()).thenReturn(SecurityPolicy.defaults());

        mockMvc.perform(get("/admin/policy"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.max_wall_clock_seconds").value(30))
                .andExpect(jsonPath("$.max_output_bytes").value(1024))
                .andExpect(jsonPath("$.network_allowed").value(false));
    }

    @Test
    void putPolicy_valid_returns200AndPassesParsedPolicy() throws Exception {
        when(policyStore.reload(any())).thenAnswer(inv -> PolicyReloadResult.applied(inv.getArgument(0)));

        mockMvc.perform(put("/admin/policy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"max_wall_clock_seconds":5,"max_memory_bytes":67108864,
                                 "max_output_bytes":2048,"max_source_bytes":4096,
                                 "forbidden_imports":["os"],"forbidden_calls":["eval"],
                                 "network_allowed":false,"languages_enabled":["general_purpose"]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.applied").value(true))
                .andExpect(jsonPath("$.policy.max_wall_clock_seconds").value(5));

        ArgumentCaptor<SecurityPolicy> captor = ArgumentCaptor.forClass(SecurityPolicy.class);
        verify(policyStore).reload(captor.capture());
        assertThat(captor.getValue().languagesEnabled()).containsExactly(Language.GENERAL_PURPOSE);
        assertThat(captor.getValue().forbiddenImports()).containsExactly("os");
    }

    @Test
    void putPolicy_invalid_returns422WithErrors() throws Exception {
        when(policyStore.reload(any())).thenReturn(PolicyReloadResult.rejected(
                SecurityPolicy.defaults(), List.of("max_wall_clock_seconds must be > 0")));

        mockMvc.perform(put("/admin/policy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"max_wall_clock_seconds":0,"max_memory_bytes":1,"max_output_bytes":1,
                                 "max_source_bytes":1,"languages_enabled":["dsl"]}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.applied").value(false))
                .andExpect(jsonPath("$.errors[0]").value("max_wall_clock_seconds must be > 0"));
    }

    @Test
    void languages_listsOnlyEnabledOnes() throws Exception {
        when(policyStore.current()).thenReturn(new SecurityPolicy(30, 1024, 1024, 1024,
                Set.of(), Set.of(), false, EnumSet.of(Language.DSL)));

        mockMvc.perform(get("/languages"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].language").value("dsl"))
                .andExpect(jsonPath("$[0].alias").value("jac"))
                .andExpect(jsonPath("$[0].file_name").value("main.jac"));
    }
}
