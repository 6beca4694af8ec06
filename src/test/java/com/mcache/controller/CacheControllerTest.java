package com.mcache.controller;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.mcache.cache.LocalTtlCache;
import com.mcache.cache.RedisTtlCache;
import com.mcache.exception.GlobalExceptionHandler;

class CacheControllerTest {

    private LocalTtlCache cache;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        cache = new LocalTtlCache(60);
        mockMvc = MockMvcBuilders.standaloneSetup(new CacheController(cache))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void putGetDelete() throws Exception {
        mockMvc.perform(put("/cache/name").contentType(MediaType.TEXT_PLAIN).content("Bess"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        mockMvc.perform(get("/cache/name"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.value").value("Bess"));

        mockMvc.perform(delete("/cache/name"))
                .andExpect(status().isOk());

        mockMvc.perform(get("/cache/name"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void negativeTtlIsBadRequest() throws Exception {
        mockMvc.perform(put("/cache/name").param("ttl", "-5").contentType(MediaType.TEXT_PLAIN).content("Bess"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void missingRedisIsServiceUnavailable() throws Exception {
        MockMvc noBackend = MockMvcBuilders.standaloneSetup(new CacheController(new RedisTtlCache(null, 60)))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();

        noBackend.perform(get("/cache/name"))
                .andExpect(status().isServiceUnavailable());
    }
}
