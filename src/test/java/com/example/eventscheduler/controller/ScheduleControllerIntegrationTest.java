package com.example.eventscheduler.controller;

import com.example.eventscheduler.domain.enums.RecurrenceType;
import com.example.eventscheduler.domain.repository.ScheduleRepository;
import com.example.eventscheduler.dto.CreateScheduleRequest;
import com.example.eventscheduler.dto.TargetActionRequest;
import com.example.eventscheduler.dto.UpdateScheduleRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.MOCK,
        properties = {
                "spring.datasource.url=jdbc:h2:mem:api;MODE=PostgreSQL;DB_CLOSE_DELAY=-1;DATABASE_TO_LOWER=TRUE;DEFAULT_NULL_ORDERING=HIGH",
                "event-scheduler.loop-enabled=false"
        }
)
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Schedule API Integration Tests")
class ScheduleControllerIntegrationTest {

    private static final String BASE_URL = "/api/v1/schedules";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private ScheduleRepository scheduleRepository;

    @BeforeEach
    void setUp() {
        scheduleRepository.deleteAll();
    }

    private CreateScheduleRequest intervalRequest(String name) {
        return CreateScheduleRequest.builder()
                .name(name)
                .description("Integration test schedule")
                .recurrenceType(RecurrenceType.INTERVAL)
                .intervalMs(3_600_000L)
                .targetAction(TargetActionRequest.builder()
                        .url("https://hooks.example.com/" + name)
                        .headers(Map.of("X-Tenant", "acme"))
                        .payloadTemplate("{\"fireTime\":\"${fireTime}\"}")
                        .build())
                .build();
    }

    private JsonNode create(CreateScheduleRequest request) throws Exception {
        var body = mockMvc.perform(post(BASE_URL)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(body).get("data");
    }

    @Nested
    @DisplayName("Schedule Registration API")
    class RegistrationApiTests {

        @Test
        @DisplayName("Should register a schedule via API")
        void shouldRegisterSchedule() throws Exception {
            mockMvc.perform(post(BASE_URL)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(intervalRequest("hourly-sync"))))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.data.name").value("hourly-sync"))
                    .andExpect(jsonPath("$.data.state").value("ACTIVE"))
                    .andExpect(jsonPath("$.data.version").value(0))
                    .andExpect(jsonPath("$.data.targetAction.method").value("POST"))
                    .andExpect(jsonPath("$.data.targetAction.headers.X-Tenant").value("acme"))
                    .andExpect(jsonPath("$.data.nextFireAt").isNotEmpty());

            assertThat(scheduleRepository.existsByName("hourly-sync")).isTrue();
        }

        @Test
        @DisplayName("Should return 409 for a duplicate name")
        void shouldRejectDuplicateName() throws Exception {
            create(intervalRequest("dup"));

            mockMvc.perform(post(BASE_URL)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(intervalRequest("dup"))))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.success").value(false));
        }

        @Test
        @DisplayName("Should return 400 for missing required fields")
        void shouldRejectMissingFields() throws Exception {
            var request = intervalRequest("nameless");
            request.setName(null);
            request.setTargetAction(null);

            mockMvc.perform(post(BASE_URL)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(request)))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.errors", hasSize(2)));
        }

        @Test
        @DisplayName("Should return 400 for an unparseable cron expression")
        void shouldRejectBadCron() throws Exception {
            var request = intervalRequest("bad-cron");
            request.setRecurrenceType(RecurrenceType.CRON);
            request.setCronExpression("every day at nine");

            mockMvc.perform(post(BASE_URL)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(request)))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value(containsString("every day at nine")));
        }
    }

    @Nested
    @DisplayName("Schedule Retrieval API")
    class RetrievalApiTests {

        @Test
        @DisplayName("Should return 404 for an unknown schedule")
        void shouldReturnNotFound() throws Exception {
            mockMvc.perform(get(BASE_URL + "/{id}", UUID.randomUUID()))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("Should return 400 for a malformed id")
        void shouldRejectMalformedId() throws Exception {
            mockMvc.perform(get(BASE_URL + "/{id}", "not-a-uuid"))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("Should list schedules filtered by state")
        void shouldListByState() throws Exception {
            create(intervalRequest("first"));
            var second = create(intervalRequest("second"));
            mockMvc.perform(post(BASE_URL + "/{id}/pause", second.get("id").asText()))
                    .andExpect(status().isOk());

            mockMvc.perform(get(BASE_URL).param("state", "PAUSED"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.content", hasSize(1)))
                    .andExpect(jsonPath("$.data.content[0].name").value("second"));

            mockMvc.perform(get(BASE_URL))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.content", hasSize(2)));
        }
    }

    @Nested
    @DisplayName("Schedule Modification API")
    class ModificationApiTests {

        @Test
        @DisplayName("Should update a schedule and bump its version")
        void shouldUpdateSchedule() throws Exception {
            var created = create(intervalRequest("editable"));
            var update = UpdateScheduleRequest.builder()
                    .intervalMs(60_000L)
                    .expectedVersion(created.get("version").asLong())
                    .build();

            mockMvc.perform(put(BASE_URL + "/{id}", created.get("id").asText())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(update)))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.intervalMs").value(60_000))
                    .andExpect(jsonPath("$.data.version").value(1));
        }

        @Test
        @DisplayName("Should return 409 for a stale expected version")
        void shouldRejectStaleVersion() throws Exception {
            var created = create(intervalRequest("contested"));
            var update = UpdateScheduleRequest.builder().description("late edit").expectedVersion(42L).build();

            mockMvc.perform(put(BASE_URL + "/{id}", created.get("id").asText())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(update)))
                    .andExpect(status().isConflict());
        }

        @Test
        @DisplayName("Should pause, resume and reject invalid transitions")
        void shouldManageState() throws Exception {
            var id = create(intervalRequest("stateful")).get("id").asText();

            mockMvc.perform(post(BASE_URL + "/{id}/pause", id))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.state").value("PAUSED"));
            mockMvc.perform(post(BASE_URL + "/{id}/pause", id))
                    .andExpect(status().isConflict());
            mockMvc.perform(post(BASE_URL + "/{id}/resume", id))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.state").value("ACTIVE"));
            mockMvc.perform(post(BASE_URL + "/{id}/retry", id))
                    .andExpect(status().isConflict());
            mockMvc.perform(post(BASE_URL + "/{id}/disable", id))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.state").value("DISABLED"));
        }

        @Test
        @DisplayName("Should delete a schedule")
        void shouldDeleteSchedule() throws Exception {
            var id = create(intervalRequest("doomed")).get("id").asText();

            mockMvc.perform(delete(BASE_URL + "/{id}", id))
                    .andExpect(status().isOk());
            mockMvc.perform(get(BASE_URL + "/{id}", id))
                    .andExpect(status().isNotFound());
            mockMvc.perform(delete(BASE_URL + "/{id}", id))
                    .andExpect(status().isNotFound());
        }
    }
}
