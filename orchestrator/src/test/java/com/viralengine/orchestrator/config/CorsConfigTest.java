package com.viralengine.orchestrator.config;

import com.viralengine.orchestrator.api.JobController;
import com.viralengine.orchestrator.service.JobDispatcher;
import com.viralengine.orchestrator.service.JobStatusService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * CORS rules on the job API, checked through the MVC slice.
 * Origins come from the test application.yml.
 */
@WebMvcTest(JobController.class)
class CorsConfigTest {

    @Autowired MockMvc           mockMvc;
    @MockitoBean JobDispatcher    dispatcher;
    @MockitoBean JobStatusService statusService;

    @Test
    void preflight_fromDashboardOrigin_isAllowed() throws Exception {
        mockMvc.perform(options("/jobs")
                        .header(HttpHeaders.ORIGIN, "http://localhost:3000")
                        .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "POST")
                        .header(HttpHeaders.ACCESS_CONTROL_REQUEST_HEADERS, "Content-Type"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "http://localhost:3000"))
                .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_CREDENTIALS, "true"));
    }

    @Test
    void preflight_fromUnknownOrigin_isRejected() throws Exception {
        mockMvc.perform(options("/jobs/{id}", "0b6f0c1e-2f6a-4a4e-9d59-3d7c4b1a2e11")
                        .header(HttpHeaders.ORIGIN, "http://evil.example")
                        .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "GET"))
                .andExpect(status().isForbidden())
                .andExpect(header().doesNotExist(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN));
    }

    @Test
    void simpleGet_fromSecondOrigin_carriesAllowOriginHeader() throws Exception {
        when(statusService.listAll()).thenReturn(List.of());

        mockMvc.perform(get("/jobs").header(HttpHeaders.ORIGIN, "http://localhost:3001"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "http://localhost:3001"));
    }
}
