package ru.marthastudios.nudgebot.dto.botframework;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.util.List;

/**
 * Bot Framework activity as exchanged with the connector service. Only the fields the bot reads or
 * writes are mapped.
 */
@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ActivityDto {
    private String type;
    private String id;
    private String serviceUrl;
    private String channelId;
    private ChannelAccountDto from;
    private ChannelAccountDto recipient;
    private ConversationAccountDto conversation;
    private String replyToId;
    private String text;
    private String speak;
    private String inputHint;
    private List<AttachmentDto> attachments;
    private List<ChannelAccountDto> membersAdded;
    private String name;
    private String label;
    private String valueType;
    private Object value;
}
