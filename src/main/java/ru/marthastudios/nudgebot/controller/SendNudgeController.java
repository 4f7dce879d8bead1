package ru.marthastudios.nudgebot.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import ru.marthastudios.nudgebot.dto.template.CreateBatchAndSendRequestDto;
import ru.marthastudios.nudgebot.dto.template.CreateBatchAndSendResponseDto;
import ru.marthastudios.nudgebot.dto.template.UpdateLogStatusRequestDto;
import ru.marthastudios.nudgebot.dto.template.UpnListResponseDto;
import ru.marthastudios.nudgebot.entity.MessageBatch;
import ru.marthastudios.nudgebot.entity.MessageLog;
import ru.marthastudios.nudgebot.enums.MessageLogStatus;
import ru.marthastudios.nudgebot.service.MessageTemplateService;
import ru.marthastudios.nudgebot.util.PrincipalUtils;
import ru.marthastudios.nudgebot.util.UpnFileParserUtil;

import java.io.IOException;
import java.io.InputStream;
import java.security.Principal;
import java.util.List;

@RestController
@RequestMapping("/api/SendNudge")
@RequiredArgsConstructor
@Slf4j
public class SendNudgeController {
    private final MessageTemplateService messageTemplateService;

    @PostMapping("/ParseFile")
    public ResponseEntity<?> parseFile(@RequestParam(value = "file", required = false) MultipartFile file) {
        if (file == null || file.isEmpty()) {
            return ResponseEntity.badRequest().body("No file uploaded");
        }

        try (InputStream inputStream = file.getInputStream()) {
            List<String> upns = UpnFileParserUtil.parseUpns(inputStream);

            log.info("Parsed {} UPNs from file {}", upns.size(), file.getOriginalFilename());

            return ResponseEntity.ok(new UpnListResponseDto(upns));
        } catch (IOException e) {
            log.error("Error parsing file", e);

            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body("Error parsing file");
        }
    }

    @PostMapping("/CreateBatchAndSend")
    public ResponseEntity<?> createBatchAndSend(@RequestBody CreateBatchAndSendRequestDto request, Principal principal) {
        if (request.getBatchName() == null || request.getBatchName().isBlank()) {
            return ResponseEntity.badRequest().body("BatchName is required");
        }

        if (request.getTemplateId() == null || request.getTemplateId().isBlank()) {
            return ResponseEntity.badRequest().body("TemplateId is required");
        }

        if (request.getRecipientUpns() == null || request.getRecipientUpns().isEmpty()) {
            return ResponseEntity.badRequest().body("At least one recipient UPN is required");
        }

        if (messageTemplateService.getTemplate(request.getTemplateId()) == null) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Template " + request.getTemplateId() + " not found");
        }

        MessageBatch batch = messageTemplateService.createBatch(request.getBatchName(), request.getTemplateId(),
                PrincipalUtils.getUpn(principal));

        List<MessageLog> logs = messageTemplateService.logBatchMessages(batch.getId(), request.getRecipientUpns());

        log.info("Created batch {} with {} messages", batch.getId(), logs.size());

        return ResponseEntity.ok(CreateBatchAndSendResponseDto.builder()
                .batch(batch)
                .messageCount(logs.size())
                .logs(logs)
                .build());
    }

    @PutMapping("/UpdateLogStatus/{logId}")
    public ResponseEntity<?> updateLogStatus(@PathVariable String logId, @RequestBody UpdateLogStatusRequestDto request) {
        if (request.getStatus() == null || request.getStatus().isBlank()) {
            return ResponseEntity.badRequest().body("Status is required");
        }

        MessageLogStatus status = MessageLogStatus.fromValue(request.getStatus());

        messageTemplateService.updateMessageLogStatus(logId, status, request.getLastError());

        log.info("Updated message log {} to status {}", logId, status);

        return ResponseEntity.ok().build();
    }
}
