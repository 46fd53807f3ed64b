package com.trialstruct.controller;

import com.trialstruct.service.structure.StructureBatchResult;
import com.trialstruct.service.structure.StructureBatchService;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class StructureControllerTest {

    @Mock
    private StructureBatchService structureBatchService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new StructureController(structureBatchService)).build();
    }

    @Test
    void shouldReportBatchCountsAndErrors() throws Exception {
        when(structureBatchService.structureProtocol("proto-1")).thenReturn(new StructureBatchResult(3, 1,
            List.of("Structure build failed for criterion crit-9: boom")));

        mockMvc.perform(post("/api/protocols/proto-1/structure"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.protocolId").value("proto-1"))
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.processed").value(3))
            .andExpect(jsonPath("$.skipped").value(1))
            .andExpect(jsonPath("$.failed").value(1))
            .andExpect(jsonPath("$.errors[0]").value("Structure build failed for criterion crit-9: boom"));
    }

    @Test
    void shouldReturn404ForUnknownProtocol() throws Exception {
        when(structureBatchService.structureProtocol("missing"))
            .thenThrow(new EntityNotFoundException("Protocol not found: missing"));

        mockMvc.perform(post("/api/protocols/missing/structure"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("Protocol not found: missing"));
    }

    @Test
    void shouldStructureOnlyRequestedCriteria() throws Exception {
        when(structureBatchService.structureCriteria("proto-1", List.of("crit-2", "crit-5")))
            .thenReturn(new StructureBatchResult(2, 0, List.of()));

        mockMvc.perform(post("/api/protocols/proto-1/structure")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"criterionIds\": [\"crit-2\", \"crit-5\"]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.processed").value(2));
    }

    @Test
    void shouldRejectEmptyOrBlankCriterionIds() throws Exception {
        mockMvc.perform(post("/api/protocols/proto-1/structure")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"criterionIds\": []}"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/protocols/proto-1/structure")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"criterionIds\": [\" \"]}"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(structureBatchService);
    }
}
