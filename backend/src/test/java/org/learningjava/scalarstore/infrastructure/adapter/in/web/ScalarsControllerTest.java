package org.learningjava.scalarstore.infrastructure.adapter.in.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.scalarstore.application.usecase.LastLoggedUseCase;
import org.learningjava.scalarstore.application.usecase.LogScalarsUseCase;
import org.learningjava.scalarstore.application.usecase.QueryScalarsUseCase;
import org.learningjava.scalarstore.domain.error.BackendUnavailableException;
import org.learningjava.scalarstore.domain.error.InvalidIdentifierException;
import org.learningjava.scalarstore.domain.model.ExperimentScalars;
import org.learningjava.scalarstore.domain.model.LastLogged;
import org.learningjava.scalarstore.domain.model.LogItem;
import org.learningjava.scalarstore.domain.model.LogResult;
import org.learningjava.scalarstore.domain.model.ScalarSeries;
import org.learningjava.scalarstore.domain.model.ScalarsQuery;
import org.learningjava.scalarstore.domain.model.StepTags;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class ScalarsControllerTest {

    private LogScalarsUseCase logScalars;
    private QueryScalarsUseCase queryScalars;
    private LastLoggedUseCase lastLogged;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        logScalars = mock(LogScalarsUseCase.class);
        queryScalars = mock(QueryScalarsUseCase.class);
        lastLogged = mock(LastLoggedUseCase.class);

        ObjectMapper om = new ObjectMapper();
        om.registerModule(new JavaTimeModule());
        om.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        mvc = MockMvcBuilders
                .standaloneSetup(new ScalarsController(logScalars, queryScalars, lastLogged))
                .setControllerAdvice(new ApiExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(om))
                .build();
    }

    @Test
    void log_single_step_omits_warnings_when_none() throws Exception {
        when(logScalars.logScalar(eq("p1"), eq("e1"), eq(3L), anyMap(), anyList()))
                .thenReturn(LogResult.logged(List.of()));

        mvc.perform(post("/api/scalars/log/p1/e1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scalars\":{\"loss\":0.5},\"step\":3,\"tags\":[\"a\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("logged")))
                .andExpect(jsonPath("$.warnings").doesNotExist());

        verify(logScalars).logScalar("p1", "e1", 3L, Map.of("loss", 0.5), List.of("a"));
    }

    @Test
    void log_reports_warnings() throws Exception {
        when(logScalars.logScalar(anyString(), anyString(), anyLong(), anyMap(), any()))
                .thenReturn(LogResult.logged(List.of("Dropped scalar with empty name at step 0")));

        mvc.perform(post("/api/scalars/log/p1/e1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scalars\":{\"\":1.0,\"loss\":0.5},\"step\":0}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.warnings", hasSize(1)));
    }

    @Test
    void log_without_step_is_bad_request() throws Exception {
        mvc.perform(post("/api/scalars/log/p1/e1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scalars\":{\"loss\":0.5}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", is("BAD_REQUEST")));

        verifyNoInteractions(logScalars);
    }

    @Test
    @SuppressWarnings("unchecked")
    void log_batch_passes_every_item() throws Exception {
        when(logScalars.logScalars(anyString(), anyString(), anyList())).thenReturn(LogResult.logged(null));

        mvc.perform(post("/api/scalars/log_batch/p1/e1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scalars\":[{\"scalars\":{\"loss\":1.0},\"step\":1},"
                                + "{\"scalars\":{\"loss\":0.5,\"acc\":0.2},\"step\":2,\"tags\":[\"best\"]}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("logged")));

        ArgumentCaptor<List<LogItem>> items = ArgumentCaptor.forClass(List.class);
        verify(logScalars).logScalars(eq("p1"), eq("e1"), items.capture());
        assertEquals(2, items.getValue().size());
        assertEquals(2L, items.getValue().get(1).step());
        assertEquals(List.of("best"), items.getValue().get(1).tags());
    }

    @Test
    void get_maps_params_and_serializes_series_and_tags() throws Exception {
        var es = new ExperimentScalars("e1",
                Map.of("loss", new ScalarSeries(List.of(1L, 2L), List.of(0.9, 0.8))),
                List.of(new StepTags(1, List.of("loss"), List.of("warmup"))));
        when(queryScalars.getScalars(any())).thenReturn(List.of(es));

        mvc.perform(get("/api/scalars/get/p1")
                        .param("experimentIds", "e1", "e2")
                        .param("maxPoints", "50")
                        .param("returnTags", "true")
                        .param("startTime", "2024-01-01T00:00:00Z")
                        .param("endTime", "2024-01-02T00:00:00")
                        .accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].experimentId", is("e1")))
                .andExpect(jsonPath("$[0].scalars.loss.x", org.hamcrest.Matchers.contains(1, 2)))
                .andExpect(jsonPath("$[0].scalars.loss.y[0]", is(closeTo(0.9, 1e-9))))
                .andExpect(jsonPath("$[0].tags[0].step", is(1)))
                .andExpect(jsonPath("$[0].tags[0].scalarNames", org.hamcrest.Matchers.contains("loss")))
                .andExpect(jsonPath("$[0].tags[0].tags", org.hamcrest.Matchers.contains("warmup")));

        ArgumentCaptor<ScalarsQuery> q = ArgumentCaptor.forClass(ScalarsQuery.class);
        verify(queryScalars).getScalars(q.capture());
        assertEquals("p1", q.getValue().projectId());
        assertEquals(List.of("e1", "e2"), q.getValue().experimentIds());
        assertEquals(50, q.getValue().maxPoints());
        assertTrue(q.getValue().returnTags());
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), q.getValue().startTime());
        assertEquals(Instant.parse("2024-01-02T00:00:00Z"), q.getValue().endTime());
    }

    @Test
    void get_without_tags_omits_the_field() throws Exception {
        var es = new ExperimentScalars("e1", Map.of(), null);
        when(queryScalars.getScalars(any())).thenReturn(List.of(es));

        mvc.perform(get("/api/scalars/get/p1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].tags").doesNotExist());

        ArgumentCaptor<ScalarsQuery> q = ArgumentCaptor.forClass(ScalarsQuery.class);
        verify(queryScalars).getScalars(q.capture());
        assertTrue(q.getValue().wholeProject());
        assertNull(q.getValue().maxPoints());
    }

    @Test
    void post_get_reads_body() throws Exception {
        when(queryScalars.getScalars(any())).thenReturn(List.of());

        mvc.perform(post("/api/scalars/get/p1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"experimentIds\":[\"e1\"],\"returnTags\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));

        verify(queryScalars).getScalars(new ScalarsQuery("p1", List.of("e1"), null, true, null, null));
    }

    @Test
    void bad_timestamp_is_bad_request() throws Exception {
        mvc.perform(get("/api/scalars/get/p1").param("startTime", "yesterday"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", containsString("startTime")));
        verifyNoInteractions(queryScalars);
    }

    @Test
    void backend_outage_maps_to_503() throws Exception {
        when(queryScalars.getScalars(any()))
                .thenThrow(new BackendUnavailableException("ClickHouse query failed", new SQLException("refused")));

        mvc.perform(get("/api/scalars/get/p1"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error", is("BACKEND_UNAVAILABLE")));
    }

    @Test
    void invalid_identifier_maps_to_400() throws Exception {
        when(queryScalars.getScalars(any())).thenThrow(new InvalidIdentifierException("scalars_x y"));

        mvc.perform(get("/api/scalars/get/x y"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", is("INVALID_IDENTIFIER")));
    }

    @Test
    void last_logged_serializes_iso_instants() throws Exception {
        when(lastLogged.lastLogged("p1", List.of("e1")))
                .thenReturn(List.of(new LastLogged("e1", Instant.parse("2024-01-01T00:00:00Z"))));

        mvc.perform(get("/api/scalars/last_logged/p1").param("experimentIds", "e1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].experimentId", is("e1")))
                .andExpect(jsonPath("$[0].lastModified", is("2024-01-01T00:00:00Z")));
    }
}
