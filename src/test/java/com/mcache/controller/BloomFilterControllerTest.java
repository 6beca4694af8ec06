package com.mcache.controller;

import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.mcache.bloom.BloomFilter;
import com.mcache.exception.GlobalExceptionHandler;

class BloomFilterControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = mockMvcFor(BloomFilter.localWithEstimates(1000, 0.01));
    }

    @Test
    void addThenTest() throws Exception {
        mockMvc.perform(get("/bloom/test").param("key", "Bess"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.present").value(false));

        mockMvc.perform(post("/bloom/add").param("key", "Bess"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        mockMvc.perform(get("/bloom/test").param("key", "Bess"))
                .andExpect(jsonPath("$.present").value(true));
    }

    @Test
    void testAndAddReportsPreviousMembership() throws Exception {
        mockMvc.perform(post("/bloom/test-and-add").param("key", "Emma"))
                .andExpect(jsonPath("$.present").value(false));
        mockMvc.perform(post("/bloom/test-and-add").param("key", "Emma"))
                .andExpect(jsonPath("$.present").value(true));
    }

    @Test
    void clearResetsFilter() throws Exception {
        mockMvc.perform(post("/bloom/add").param("key", "Jane"));

        mockMvc.perform(delete("/bloom"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cleared").value(true));

        mockMvc.perform(get("/bloom/test").param("key", "Jane"))
                .andExpect(jsonPath("$.present").value(false));
    }

    @Test
    void infoShowsSizing() throws Exception {
        mockMvc.perform(get("/bloom/info"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cap").value(9586))
                .andExpect(jsonPath("$.k").value(7));
    }

    @Test
    void estimateReportsRate() throws Exception {
        mockMvc.perform(post("/bloom/estimate").param("n", "1000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.falsePositiveRate").value(lessThanOrEqualTo(0.015)));
    }

    @Test
    void negativeEstimateIsBadRequest() throws Exception {
        mockMvc.perform(post("/bloom/estimate").param("n", "-1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void missingBackendIsServiceUnavailable() throws Exception {
        MockMvc noBackend = mockMvcFor(BloomFilter.redisTemplate(1000, 4, "test:bloom", null));

        noBackend.perform(post("/bloom/add").param("key", "Bess"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.timestamp").exists());
        noBackend.perform(get("/bloom/info"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cap").value(1000));
    }

    private static MockMvc mockMvcFor(BloomFilter filter) {
        return MockMvcBuilders.standaloneSetup(new BloomFilterController(filter, Runnable::run))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }
}
