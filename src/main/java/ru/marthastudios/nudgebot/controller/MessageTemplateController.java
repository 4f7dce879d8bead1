package ru.marthastudios.nudgebot.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import ru.marthastudios.nudgebot.dto.template.TemplateJsonResponseDto;
import ru.marthastudios.nudgebot.dto.template.TemplateRequestDto;
import ru.marthastudios.nudgebot.entity.MessageBatch;
import ru.marthastudios.nudgebot.entity.MessageLog;
import ru.marthastudios.nudgebot.entity.MessageTemplate;
import ru.marthastudios.nudgebot.service.MessageTemplateService;
import ru.marthastudios.nudgebot.util.PrincipalUtils;

import java.security.Principal;
import java.util.List;

@RestController
@RequestMapping("/api/MessageTemplate")
@RequiredArgsConstructor
@Slf4j
public class MessageTemplateController {
    private final MessageTemplateService messageTemplateService;

    @GetMapping("/GetAll")
    public List<MessageTemplate> getAll() {
        return messageTemplateService.getAllTemplates();
    }

    @GetMapping("/Get/{id}")
    public ResponseEntity<MessageTemplate> get(@PathVariable String id) {
        MessageTemplate template = messageTemplateService.getTemplate(id);

        if (template == null) {
            return ResponseEntity.notFound().build();
        }

        return ResponseEntity.ok(template);
    }

    @GetMapping("/GetJson/{id}")
    public TemplateJsonResponseDto getJson(@PathVariable String id) {
        return new TemplateJsonResponseDto(messageTemplateService.getTemplateJson(id));
    }

    @PostMapping("/Create")
    public ResponseEntity<?> create(@RequestBody TemplateRequestDto request, Principal principal) {
        if (isInvalid(request)) {
            return ResponseEntity.badRequest().body("TemplateName and JsonPayload are required");
        }

        MessageTemplate template = messageTemplateService.createTemplate(request.getTemplateName(), request.getJsonPayload(),
                PrincipalUtils.getUpn(principal));

        log.info("Created template {} from /api/MessageTemplate/Create", template.getId());

        return ResponseEntity.ok(template);
    }

    @PutMapping("/Update/{id}")
    public ResponseEntity<?> update(@PathVariable String id, @RequestBody TemplateRequestDto request) {
        if (isInvalid(request)) {
            return ResponseEntity.badRequest().body("TemplateName and JsonPayload are required");
        }

        return ResponseEntity.ok(messageTemplateService.updateTemplate(id, request.getTemplateName(), request.getJsonPayload()));
    }

    @DeleteMapping("/Delete/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        messageTemplateService.deleteTemplate(id);

        return ResponseEntity.ok().build();
    }

    @GetMapping("/GetLogs")
    public List<MessageLog> getLogs() {
        return messageTemplateService.getAllMessageLogs();
    }

    @GetMapping("/GetLogsByTemplate/{templateId}")
    public List<MessageLog> getLogsByTemplate(@PathVariable String templateId) {
        return messageTemplateService.getMessageLogsByTemplate(templateId);
    }

    @GetMapping("/GetBatches")
    public List<MessageBatch> getBatches() {
        return messageTemplateService.getAllBatches();
    }

    @GetMapping("/GetBatch/{id}")
    public ResponseEntity<MessageBatch> getBatch(@PathVariable String id) {
        MessageBatch batch = messageTemplateService.getBatch(id);

        if (batch == null) {
            return ResponseEntity.notFound().build();
        }

        return ResponseEntity.ok(batch);
    }

    @GetMapping("/GetLogsByBatch/{batchId}")
    public List<MessageLog> getLogsByBatch(@PathVariable String batchId) {
        return messageTemplateService.getMessageLogsByBatch(batchId);
    }

    @DeleteMapping("/DeleteBatch/{id}")
    public ResponseEntity<Void> deleteBatch(@PathVariable String id) {
        messageTemplateService.deleteBatch(id);

        return ResponseEntity.ok().build();
    }

    private static boolean isInvalid(TemplateRequestDto request) {
        return request.getTemplateName() == null || request.getTemplateName().isBlank()
                || request.getJsonPayload() == null || request.getJsonPayload().isBlank();
    }
}
