package ru.marthastudios.nudgebot.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import ru.marthastudios.nudgebot.dto.smartgroup.CopilotConnectedStatusDto;
import ru.marthastudios.nudgebot.dto.smartgroup.PreviewSmartGroupRequestDto;
import ru.marthastudios.nudgebot.dto.smartgroup.SmartGroupMemberDto;
import ru.marthastudios.nudgebot.dto.smartgroup.SmartGroupPreviewResponseDto;
import ru.marthastudios.nudgebot.dto.smartgroup.SmartGroupRequestDto;
import ru.marthastudios.nudgebot.dto.template.UpnListResponseDto;
import ru.marthastudios.nudgebot.entity.SmartGroup;
import ru.marthastudios.nudgebot.property.AiProperty;
import ru.marthastudios.nudgebot.service.SmartGroupService;
import ru.marthastudios.nudgebot.util.PrincipalUtils;

import java.security.Principal;
import java.util.List;

/**
 * Smart groups need Copilot Connected mode; every endpoint but the status check answers 400 without it.
 */
@RestController
@RequestMapping("/api/SmartGroup")
@RequiredArgsConstructor
@Slf4j
public class SmartGroupController {
    private static final String NOT_ENABLED_MESSAGE = "Copilot Connected mode is not enabled.";

    private final SmartGroupService smartGroupService;
    private final AiProperty aiProperty;

    @GetMapping("/CopilotConnectedStatus")
    public CopilotConnectedStatusDto getCopilotConnectedStatus() {
        return CopilotConnectedStatusDto.builder()
                .enabled(smartGroupService.isAiEnabled())
                .hasAiFoundryConfig(aiProperty.hasEndpoint())
                .build();
    }

    @GetMapping("/GetAll")
    public ResponseEntity<?> getAll() {
        if (!smartGroupService.isAiEnabled()) {
            return ResponseEntity.badRequest().body("Copilot Connected mode is not enabled. Configure AI Foundry to use smart groups.");
        }

        return ResponseEntity.ok(smartGroupService.getAllSmartGroups());
    }

    @GetMapping("/Get/{id}")
    public ResponseEntity<?> get(@PathVariable String id) {
        if (!smartGroupService.isAiEnabled()) {
            return ResponseEntity.badRequest().body(NOT_ENABLED_MESSAGE);
        }

        SmartGroup smartGroup = smartGroupService.getSmartGroup(id);

        if (smartGroup == null) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Smart group " + id + " not found");
        }

        return ResponseEntity.ok(smartGroup);
    }

    @PostMapping("/Create")
    public ResponseEntity<?> create(@RequestBody SmartGroupRequestDto request, Principal principal) {
        if (!smartGroupService.isAiEnabled()) {
            return ResponseEntity.badRequest().body("Copilot Connected mode is not enabled. Configure AI Foundry to use smart groups.");
        }

        String validationError = validate(request);

        if (validationError != null) {
            return ResponseEntity.badRequest().body(validationError);
        }

        return ResponseEntity.ok(smartGroupService.createSmartGroup(request.getName(), request.getDescription(),
                PrincipalUtils.getUpn(principal)));
    }

    @PutMapping("/Update/{id}")
    public ResponseEntity<?> update(@PathVariable String id, @RequestBody SmartGroupRequestDto request) {
        if (!smartGroupService.isAiEnabled()) {
            return ResponseEntity.badRequest().body(NOT_ENABLED_MESSAGE);
        }

        String validationError = validate(request);

        if (validationError != null) {
            return ResponseEntity.badRequest().body(validationError);
        }

        return ResponseEntity.ok(smartGroupService.updateSmartGroup(id, request.getName(), request.getDescription()));
    }

    @DeleteMapping("/Delete/{id}")
    public ResponseEntity<?> delete(@PathVariable String id) {
        if (!smartGroupService.isAiEnabled()) {
            return ResponseEntity.badRequest().body(NOT_ENABLED_MESSAGE);
        }

        smartGroupService.deleteSmartGroup(id);

        return ResponseEntity.ok().build();
    }

    @PostMapping("/ResolveMembers/{id}")
    public ResponseEntity<?> resolveMembers(@PathVariable String id,
                                            @RequestParam(value = "forceRefresh", defaultValue = "false") boolean forceRefresh) {
        if (!smartGroupService.isAiEnabled()) {
            return ResponseEntity.badRequest().body(NOT_ENABLED_MESSAGE);
        }

        return ResponseEntity.ok(smartGroupService.resolveSmartGroupMembers(id, forceRefresh));
    }

    @PostMapping("/Preview")
    public ResponseEntity<?> preview(@RequestBody PreviewSmartGroupRequestDto request) {
        if (!smartGroupService.isAiEnabled()) {
            return ResponseEntity.badRequest().body(NOT_ENABLED_MESSAGE);
        }

        if (request.getDescription() == null || request.getDescription().isBlank()) {
            return ResponseEntity.badRequest().body("Description is required");
        }

        List<SmartGroupMemberDto> members = smartGroupService.previewSmartGroupMembers(request.getDescription(), request.getMaxUsers());

        return ResponseEntity.ok(new SmartGroupPreviewResponseDto(members, members.size()));
    }

    @GetMapping("/GetUpns/{id}")
    public ResponseEntity<?> getUpns(@PathVariable String id) {
        if (!smartGroupService.isAiEnabled()) {
            return ResponseEntity.badRequest().body(NOT_ENABLED_MESSAGE);
        }

        return ResponseEntity.ok(new UpnListResponseDto(smartGroupService.getSmartGroupUpns(id)));
    }

    private static String validate(SmartGroupRequestDto request) {
        if (request.getName() == null || request.getName().isBlank()) {
            return "Name is required";
        }

        if (request.getDescription() == null || request.getDescription().isBlank()) {
            return "Description is required";
        }

        return null;
    }
}
