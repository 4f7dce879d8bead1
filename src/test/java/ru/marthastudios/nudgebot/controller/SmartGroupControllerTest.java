package ru.marthastudios.nudgebot.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.context.annotation.Import;
import ru.marthastudios.nudgebot.configuration.SecurityConfiguration;
import ru.marthastudios.nudgebot.dto.smartgroup.SmartGroupMemberDto;
import ru.marthastudios.nudgebot.dto.smartgroup.SmartGroupResolutionResultDto;
import ru.marthastudios.nudgebot.entity.SmartGroup;
import ru.marthastudios.nudgebot.exception.ResourceNotFoundException;
import ru.marthastudios.nudgebot.property.AiProperty;
import ru.marthastudios.nudgebot.service.SmartGroupService;

import java.util.List;

import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.user;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SmartGroupController.class)
@Import(SecurityConfiguration.class)
class SmartGroupControllerTest {
    @Autowired
    private MockMvc mockMvc;
    @MockBean
    private SmartGroupService smartGroupService;
    @MockBean
    private AiProperty aiProperty;

    @Test
    void statusReportsModeAndEndpoint() throws Exception {
        when(smartGroupService.isAiEnabled()).thenReturn(false);
        when(aiProperty.hasEndpoint()).thenReturn(true);

        mockMvc.perform(get("/api/SmartGroup/CopilotConnectedStatus"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.isEnabled").value(false))
                .andExpect(jsonPath("$.hasAIFoundryConfig").value(true));
    }

    @Test
    void everythingElseNeedsAi() throws Exception {
        when(smartGroupService.isAiEnabled()).thenReturn(false);

        mockMvc.perform(get("/api/SmartGroup/GetAll"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string("Copilot Connected mode is not enabled. Configure AI Foundry to use smart groups."));

        mockMvc.perform(post("/api/SmartGroup/ResolveMembers/group-1"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string("Copilot Connected mode is not enabled."));

        mockMvc.perform(get("/api/SmartGroup/GetUpns/group-1"))
                .andExpect(status().isBadRequest());

        verify(smartGroupService, never()).resolveSmartGroupMembers(anyString(), anyBoolean());
    }

    @Test
    void createValidatesAndUsesCaller() throws Exception {
        when(smartGroupService.isAiEnabled()).thenReturn(true);
        when(smartGroupService.createSmartGroup("Sales", "Everyone in sales", "admin@contoso.com")).thenReturn(SmartGroup.builder()
                .id("group-1")
                .name("Sales")
                .description("Everyone in sales")
                .createdByUpn("admin@contoso.com")
                .createdDate(1L)
                .build());

        mockMvc.perform(post("/api/SmartGroup/Create")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\": \"Everyone in sales\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string("Name is required"));

        mockMvc.perform(post("/api/SmartGroup/Create")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Sales\", \"description\": \" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string("Description is required"));

        mockMvc.perform(post("/api/SmartGroup/Create")
                        .with(user("admin@contoso.com"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Sales\", \"description\": \"Everyone in sales\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("group-1"));
    }

    @Test
    void missingGroupIsNotFound() throws Exception {
        when(smartGroupService.isAiEnabled()).thenReturn(true);
        when(smartGroupService.resolveSmartGroupMembers("missing", false)).thenThrow(new ResourceNotFoundException("Smart group missing not found"));

        mockMvc.perform(get("/api/SmartGroup/Get/missing"))
                .andExpect(status().isNotFound());

        mockMvc.perform(post("/api/SmartGroup/ResolveMembers/missing"))
                .andExpect(status().isNotFound())
                .andExpect(content().string("Smart group missing not found"));
    }

    @Test
    void resolveMembersPassesForceRefresh() throws Exception {
        when(smartGroupService.isAiEnabled()).thenReturn(true);
        when(smartGroupService.resolveSmartGroupMembers("group-1", true)).thenReturn(SmartGroupResolutionResultDto.builder()
                .smartGroupId("group-1")
                .smartGroupName("Sales")
                .members(List.of(SmartGroupMemberDto.builder().userPrincipalName("alice@contoso.com").confidenceScore(0.9).build()))
                .resolvedAt(5L)
                .fromCache(false)
                .build());

        mockMvc.perform(post("/api/SmartGroup/ResolveMembers/group-1").param("forceRefresh", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.smartGroupName").value("Sales"))
                .andExpect(jsonPath("$.members[0].userPrincipalName").value("alice@contoso.com"));
    }

    @Test
    void previewReturnsMembersAndCount() throws Exception {
        when(smartGroupService.isAiEnabled()).thenReturn(true);
        when(smartGroupService.previewSmartGroupMembers("Finance people", 100)).thenReturn(List.of(
                SmartGroupMemberDto.builder().userPrincipalName("bob@contoso.com").build()));

        mockMvc.perform(post("/api/SmartGroup/Preview")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\": \"Finance people\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.members[0].userPrincipalName").value("bob@contoso.com"));
    }

    @Test
    void getUpnsListsResolvedMembers() throws Exception {
        when(smartGroupService.isAiEnabled()).thenReturn(true);
        when(smartGroupService.getSmartGroupUpns("group-1")).thenReturn(List.of("alice@contoso.com", "bob@contoso.com"));

        mockMvc.perform(get("/api/SmartGroup/GetUpns/group-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2));
    }
}
