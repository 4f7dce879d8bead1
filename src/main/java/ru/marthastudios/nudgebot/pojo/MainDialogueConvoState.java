package ru.marthastudios.nudgebot.pojo;

import lombok.*;
import ru.marthastudios.nudgebot.dto.ai.ChatRequestDto;

import java.util.List;
import java.util.UUID;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class MainDialogueConvoState {
    @Builder.Default
    private String randomStateVal = UUID.randomUUID().toString();
    private String lastNudgeContext;
    private List<ChatRequestDto.Message> conversationHistory;
}
