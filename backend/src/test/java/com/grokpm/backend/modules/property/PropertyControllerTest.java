package com.grokpm.backend.modules.property;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.math.BigDecimal;
import java.util.List;

import com.grokpm.backend.global.error.ProblemException;
import com.grokpm.backend.modules.property.application.PropertyAddressService;
import com.grokpm.backend.modules.property.application.PropertyService;
import com.grokpm.backend.modules.property.presentation.PropertyController;
import com.grokpm.backend.modules.property.presentation.dto.CreatePropertyRequest;
import com.grokpm.backend.modules.property.presentation.dto.PropertyResponse;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(PropertyController.class)
class PropertyControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PropertyService propertyService;

    @MockBean
    private PropertyAddressService propertyAddressService;

    @Test
    void missingPropertyRendersProblemBody() throws Exception {
        given(propertyService.getProperty(404L)).willThrow(ProblemException.notFound("Property", 404L));

        mockMvc.perform(get("/api/properties/404"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404))
                .andExpect(jsonPath("$.code").value("PROPERTY_NOT_FOUND"))
                .andExpect(jsonPath("$.type").value("https://grokpm.app/errors/property_not_found"))
                .andExpect(jsonPath("$.error").value("Property 404 not found"))
                .andExpect(jsonPath("$.instance").value("/api/properties/404"));
    }

    @Test
    void createReturnsLocationOfNewProperty() throws Exception {
        given(propertyService.createProperty(any(CreatePropertyRequest.class))).willReturn(new PropertyResponse(
                15L, "Main St Property", "Residential", "active", new BigDecimal("500000"),
                List.of(), List.of(), List.of(), List.of(), List.of(), null, null
        ));

        mockMvc.perform(post("/api/properties")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "name": "Main St Property",
                                  "type": "Residential",
                                  "status": "active",
                                  "value": 500000
                                }
                                """))
                .andExpect(status().isCreated())
                .andExpect(header().string("Location", "/api/properties/15"))
                .andExpect(jsonPath("$.id").value(15))
                .andExpect(jsonPath("$.name").value("Main St Property"));
    }

    @Test
    void blankNameIsValidationError() throws Exception {
        mockMvc.perform(post("/api/properties")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "  ", "value": -1}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        verifyNoInteractions(propertyService);
    }

    @Test
    void unreadableBodyIsMalformedRequest() throws Exception {
        mockMvc.perform(post("/api/properties")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MALFORMED_REQUEST"));
    }

    @Test
    void nonNumericIdIsMalformedRequest() throws Exception {
        mockMvc.perform(get("/api/properties/abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MALFORMED_REQUEST"));
    }

    @Test
    void deleteAnswersNoContent() throws Exception {
        mockMvc.perform(delete("/api/properties/3"))
                .andExpect(status().isNoContent());

        verify(propertyService).deleteProperty(3L);
    }

    @Test
    void deletingMissingAddressIsNotFound() throws Exception {
        willThrow(ProblemException.notFound("Address", 8L)).given(propertyAddressService).deleteAddress(8L);

        mockMvc.perform(delete("/api/properties/addresses/8"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("ADDRESS_NOT_FOUND"));
    }

    @Test
    void plainTextBodyIsUnsupportedMediaType() throws Exception {
        mockMvc.perform(post("/api/properties")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("Main St Property"))
                .andExpect(status().isUnsupportedMediaType())
                .andExpect(jsonPath("$.status").value(415))
                .andExpect(jsonPath("$.code").value("UNSUPPORTED_MEDIA_TYPE"))
                .andExpect(jsonPath("$.instance").value("/api/properties"));

        verifyNoInteractions(propertyService);
    }

    @Test
    void nullAddressOrPhotoEntryIsValidationError() throws Exception {
        mockMvc.perform(post("/api/properties")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Main St Property", "addresses": [null]}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
        mockMvc.perform(put("/api/properties/3")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"photos": [null]}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        verifyNoInteractions(propertyService);
    }

    @Test
    void blankNameOnUpdateIsValidationError() throws Exception {
        mockMvc.perform(put("/api/properties/3")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "   "}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        verifyNoInteractions(propertyService);
    }

    @Test
    void valueWiderThanColumnIsValidationError() throws Exception {
        mockMvc.perform(post("/api/properties")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Main St Property", "value": 123456789012345.00}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
        mockMvc.perform(post("/api/properties")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Main St Property", "value": 10.125}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        verifyNoInteractions(propertyService);
    }
}
