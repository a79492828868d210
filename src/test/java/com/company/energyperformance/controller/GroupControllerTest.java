package com.company.energyperformance.controller;

import com.company.energyperformance.domain.SignificantUseGroup;
import com.company.energyperformance.exception.GlobalExceptionHandler;
import com.company.energyperformance.service.GroupRegistryService;
import com.company.energyperformance.service.ReferenceDataService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class GroupControllerTest {

    @Mock
    private GroupRegistryService registryService;
    @Mock
    private ReferenceDataService referenceDataService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new GroupController(registryService, referenceDataService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void registersGroupActiveByDefault() throws Exception {
        when(registryService.register(any())).thenAnswer(invocation -> invocation.getArgument(0));

        mockMvc.perform(post("/api/v1/groups")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"groupId\":\"compressors\",\"name\":\"Compressor hall\","
                                + "\"energySourceId\":\"electricity\",\"entityIds\":[\"comp-1\",\"comp-2\"],"
                                + "\"region\":\"north\"}"))
                .andExpect(status().isCreated())
                .andExpect(header().string("Location", "/api/v1/groups/compressors"))
                .andExpect(jsonPath("$.entityIds.length()").value(2));

        ArgumentCaptor<SignificantUseGroup> registered = ArgumentCaptor.forClass(SignificantUseGroup.class);
        verify(registryService).register(registered.capture());
        assertThat(registered.getValue().getActive()).isTrue();
        assertThat(registered.getValue().getEntityIds()).containsExactly("comp-1", "comp-2");
    }

    @Test
    void rejectsGroupWithoutMembers() throws Exception {
        mockMvc.perform(post("/api/v1/groups")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"groupId\":\"compressors\",\"name\":\"Compressor hall\","
                                + "\"energySourceId\":\"electricity\",\"entityIds\":[],\"region\":\"north\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION"));

        verifyNoInteractions(registryService);
    }

    @Test
    void returnsGroupWithMembers() throws Exception {
        when(referenceDataService.getGroup("compressors")).thenReturn(SignificantUseGroup.builder()
                .groupId("compressors")
                .energySourceId("electricity")
                .entityIds(List.of("comp-1"))
                .active(true)
                .build());

        mockMvc.perform(get("/api/v1/groups/compressors"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.groupId").value("compressors"))
                .andExpect(jsonPath("$.entityIds[0]").value("comp-1"));
    }
}
