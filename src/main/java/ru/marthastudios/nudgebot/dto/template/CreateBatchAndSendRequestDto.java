package ru.marthastudios.nudgebot.dto.template;

import lombok.*;

import java.util.List;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@Builder
public class CreateBatchAndSendRequestDto {
    private String batchName;
    private String templateId;
    private List<String> recipientUpns;
}
