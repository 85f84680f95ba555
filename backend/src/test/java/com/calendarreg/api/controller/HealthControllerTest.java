package com.calendarreg.api.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = HealthController.class, properties = {
        "spring.application.name=calendar-reg-api",
        "calendarreg.app.version=1.4.2",
        "calendarreg.app.env=staging"
})
@Import(HealthControllerTest.FixedClock.class)
@ActiveProfiles("test")
class HealthControllerTest {

    @TestConfiguration
    static class FixedClock {
        @Bean
        Clock clock() {
            // Bangkok zone on purpose: the timestamp must still come out in UTC
            return Clock.fixed(Instant.parse("2025-06-01T05:00:00.750Z"), ZoneId.of("Asia/Bangkok"));
        }
    }

    @Autowired private MockMvc mockMvc;

    @Test
    void statusReportsOkWithUtcTimestamp() throws Exception {
        mockMvc.perform(get("/api/v1/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.timestamp").value("2025-06-01T05:00:00Z"));
    }

    @Test
    void versionReportsConfiguredBuildInfo() throws Exception {
        mockMvc.perform(get("/api/v1/version"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("calendar-reg-api"))
                .andExpect(jsonPath("$.version").value("1.4.2"))
                .andExpect(jsonPath("$.env").value("staging"));
    }
}
