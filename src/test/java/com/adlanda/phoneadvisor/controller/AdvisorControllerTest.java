package com.adlanda.phoneadvisor.controller;

import com.adlanda.phoneadvisor.repository.PhoneCatalog;
import com.adlanda.phoneadvisor.service.PhoneAdvisorService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static com.adlanda.phoneadvisor.TestPhones.phone;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AdvisorController.class)
class AdvisorControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PhoneAdvisorService advisorService;

    @MockBean
    private PhoneCatalog catalog;

    @Test
    void ask_validRequest_returnsAnswer() throws Exception {
        when(advisorService.answer("Which phone has the best battery?"))
                .thenReturn("Best Samsung phones for battery life:");

        mockMvc.perform(post("/api/v1/ask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {"question": "Which phone has the best battery?"}
                            """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answer").value("Best Samsung phones for battery life:"));
    }

    @Test
    void ask_emptyQuestion_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/ask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {"question": ""}
                            """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message").value(containsString("Question is required")));

        verifyNoInteractions(advisorService);
    }

    @Test
    void ask_tooShortQuestion_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/ask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {"question": "hi"}
                            """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Question must be at least 3 characters"));
    }

    @Test
    void ask_missingQuestion_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/ask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void ask_serviceRejectsQuestion_returnsBadRequest() throws Exception {
        when(advisorService.answer(anyString())).thenThrow(new IllegalArgumentException("Question must not be blank"));

        mockMvc.perform(post("/api/v1/ask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {"question": "abc"}
                            """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Question must not be blank"));
    }

    @Test
    void getAllPhones_returnsCatalog() throws Exception {
        when(catalog.listAll()).thenReturn(List.of(
                phone("Samsung Galaxy S24 Ultra", "5000 mAh", "200 MP main", "12 GB", "$1299 / €1449"),
                phone("Samsung Galaxy A54 5G", "5000 mAh", "50 MP main", "8 GB", "$449 / €489")));

        mockMvc.perform(get("/api/v1/phones"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].modelName").value("Samsung Galaxy S24 Ultra"))
                .andExpect(jsonPath("$[1].price").value("$449 / €489"));
    }

    @Test
    void getPhone_partialName_returnsPhone() throws Exception {
        when(catalog.getByExactOrSubstringName("S24 Ultra")).thenReturn(Optional.of(
                phone("Samsung Galaxy S24 Ultra", "5000 mAh", "200 MP main", "12 GB", "$1299 / €1449")));

        mockMvc.perform(get("/api/v1/phones/{modelName}", "S24 Ultra"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.modelName").value("Samsung Galaxy S24 Ultra"))
                .andExpect(jsonPath("$.battery").value("5000 mAh"));
    }

    @Test
    void getPhone_unknownName_returnsNotFound() throws Exception {
        when(catalog.getByExactOrSubstringName("iPhone 15")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/phones/{modelName}", "iPhone 15"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404))
                .andExpect(jsonPath("$.error").value("Not Found"))
                .andExpect(jsonPath("$.message").value("Phone 'iPhone 15' not found"));
    }
}
