package org.jagriti.casesearch.controllers;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.jagriti.casesearch.domain.DistrictCommission;
import org.jagriti.casesearch.domain.DistrictListing;
import org.jagriti.casesearch.domain.StateCommission;
import org.jagriti.casesearch.domain.StateListing;
import org.jagriti.casesearch.services.DirectoryService;
import org.jagriti.casesearch.services.exception.CommissionNotFoundException;

import java.util.List;

import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class DirectoryControllerTest {

    private DirectoryService service;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        service = Mockito.mock(DirectoryService.class);
        mvc = MockMvcBuilders.standaloneSetup(new DirectoryController(service))
                .setControllerAdvice(new GlobalExceptionHandler(Mockito.mock(Tracer.class)))
                .build();
    }

    @Test
    void listStates_returnsStates() throws Exception {
        when(service.listStates()).thenReturn(StateListing.of(List.of(
                new StateCommission(11290000, "KARNATAKA", true, false))));

        mvc.perform(get("/states"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_count").value(1))
                .andExpect(jsonPath("$.states[0].commission_id").value(11290000))
                .andExpect(jsonPath("$.states[0].name").value("KARNATAKA"))
                .andExpect(jsonPath("$.states[0].is_circuit_bench").value(false));
    }

    @Test
    void listCommissions_returnsDistricts() throws Exception {
        when(service.listDistrictCommissions(11290000)).thenReturn(DistrictListing.of(11290000, "KARNATAKA",
                List.of(new DistrictCommission(15290525, "Bangalore 1st & Rural Additional", true))));

        mvc.perform(get("/commissions/{stateId}", 11290000))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state_id").value(11290000))
                .andExpect(jsonPath("$.state_name").value("KARNATAKA"))
                .andExpect(jsonPath("$.commissions[0].commission_id").value(15290525))
                .andExpect(jsonPath("$.total_count").value(1));
    }

    @Test
    void listCommissions_unknownState_returns404() throws Exception {
        when(service.listDistrictCommissions(42)).thenThrow(CommissionNotFoundException.stateId(42));

        mvc.perform(get("/commissions/42"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("State with commission ID 42 not found"));
    }

    @Test
    void listCommissions_nonNumericId_returns400() throws Exception {
        mvc.perform(get("/commissions/karnataka"))
                .andExpect(status().isBadRequest());
    }
}
