package ru.marthastudios.nudgebot.dto.template;

import lombok.*;
import ru.marthastudios.nudgebot.entity.MessageBatch;
import ru.marthastudios.nudgebot.entity.MessageLog;

import java.util.List;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@Builder
public class CreateBatchAndSendResponseDto {
    private MessageBatch batch;
    private int messageCount;
    private List<MessageLog> logs;
}
