package com.grokpm.backend.modules.leasing;

import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.grokpm.backend.global.error.ProblemException;
import com.grokpm.backend.modules.leasing.application.TenantService;
import com.grokpm.backend.modules.leasing.presentation.TenantController;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(TenantController.class)
class TenantControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TenantService tenantService;

    @Test
    void blankNameOnUpdateIsRejectedBeforeService() throws Exception {
        mockMvc.perform(put("/api/tenants/4")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"   \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
        mockMvc.perform(put("/api/tenants/4")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        verifyNoInteractions(tenantService);
    }

    @Test
    void rentBeyondColumnPrecisionIsRejected() throws Exception {
        mockMvc.perform(put("/api/tenants/4")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rent\": 99999999999.00}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        verifyNoInteractions(tenantService);
    }

    @Test
    void missingTenantIsNotFound() throws Exception {
        given(tenantService.getTenant(9L)).willThrow(ProblemException.notFound("Tenant", 9L));

        mockMvc.perform(get("/api/tenants/9"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("TENANT_NOT_FOUND"));
    }
}
