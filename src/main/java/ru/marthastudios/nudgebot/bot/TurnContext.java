package ru.marthastudios.nudgebot.bot;

import lombok.Getter;
import ru.marthastudios.nudgebot.api.BotFrameworkApi;
import ru.marthastudios.nudgebot.dto.botframework.ActivityDto;
import ru.marthastudios.nudgebot.dto.botframework.ActivityTypes;
import ru.marthastudios.nudgebot.dto.botframework.AttachmentDto;
import ru.marthastudios.nudgebot.dto.botframework.ResourceResponseDto;

import java.util.List;

/**
 * One inbound activity and the means to answer in its conversation.
 */
@Getter
public class TurnContext {
    private final ActivityDto activity;
    private final BotFrameworkApi botFrameworkApi;

    public TurnContext(ActivityDto activity, BotFrameworkApi botFrameworkApi) {
        this.activity = activity;
        this.botFrameworkApi = botFrameworkApi;
    }

    /**
     * Addresses the outgoing activity to the sender of the incoming one and posts it.
     */
    public ResourceResponseDto sendActivity(ActivityDto outgoing) {
        outgoing.setChannelId(activity.getChannelId());
        outgoing.setServiceUrl(activity.getServiceUrl());
        outgoing.setConversation(activity.getConversation());
        outgoing.setFrom(activity.getRecipient());
        outgoing.setRecipient(activity.getFrom());

        if (outgoing.getType() == null) {
            outgoing.setType(ActivityTypes.MESSAGE);
        }

        if (activity.getId() != null && outgoing.getReplyToId() == null) {
            outgoing.setReplyToId(activity.getId());
        }

        return botFrameworkApi.sendToConversation(activity.getServiceUrl(), activity.getConversation().getId(), outgoing);
    }

    public ResourceResponseDto sendText(String text) {
        return sendActivity(ActivityDto.builder()
                .type(ActivityTypes.MESSAGE)
                .text(text)
                .build());
    }

    public ResourceResponseDto sendAttachment(AttachmentDto attachment) {
        return sendActivity(ActivityDto.builder()
                .type(ActivityTypes.MESSAGE)
                .attachments(List.of(attachment))
                .build());
    }

    public ResourceResponseDto sendTrace(String name, Object value, String valueType, String label) {
        return sendActivity(ActivityDto.builder()
                .type(ActivityTypes.TRACE)
                .name(name)
                .value(value)
                .valueType(valueType)
                .label(label)
                .build());
    }
}
