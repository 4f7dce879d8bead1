package ru.marthastudios.nudgebot.api;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import ru.marthastudios.nudgebot.dto.ai.ChatRequestDto;
import ru.marthastudios.nudgebot.dto.ai.ChatResponseDto;
import ru.marthastudios.nudgebot.property.AiProperty;

@Component
@RequiredArgsConstructor
@Slf4j
public class AiFoundryApi {
    private final RestTemplate restTemplate;
    private final AiProperty aiProperty;

    public ChatResponseDto createChatCompletion(ChatRequestDto chatRequestDto){
        HttpHeaders headers = new HttpHeaders();

        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("api-key", aiProperty.getApiKey());

        HttpEntity<ChatRequestDto> requestEntity = new HttpEntity<>(chatRequestDto, headers);

        ResponseEntity<ChatResponseDto> chatResponseDtoResponseEntity = restTemplate.postForEntity(buildChatCompletionUrl(), requestEntity, ChatResponseDto.class);

        return chatResponseDtoResponseEntity.getBody();
    }

    /**
     * Returns the text of the first choice, or null when the model returned nothing.
     */
    public String createChatCompletionText(ChatRequestDto chatRequestDto) {
        ChatResponseDto chatResponseDto = createChatCompletion(chatRequestDto);

        if (chatResponseDto == null || chatResponseDto.getChoices() == null || chatResponseDto.getChoices().isEmpty()) {
            return null;
        }

        if (chatResponseDto.getUsage() != null) {
            log.debug("Completion {} used {} prompt and {} completion tokens", chatResponseDto.getId(),
                    chatResponseDto.getUsage().getPromptTokens(), chatResponseDto.getUsage().getCompletionTokens());
        }

        ChatResponseDto.Choice choice = chatResponseDto.getChoices().get(0);

        if (ChatResponseDto.FINISH_REASON_LENGTH.equals(choice.getFinishReason())) {
            log.warn("Completion {} was cut off at max_tokens={}", chatResponseDto.getId(), chatRequestDto.getMaxTokens());
        }

        return choice.getMessage() != null ? choice.getMessage().getContent() : null;
    }

    private String buildChatCompletionUrl() {
        String endpoint = aiProperty.getEndpoint();

        if (endpoint.endsWith("/")) {
            endpoint = endpoint.substring(0, endpoint.length() - 1);
        }

        return endpoint + "/openai/deployments/" + aiProperty.getDeploymentName()
                + "/chat/completions?api-version=" + aiProperty.getApiVersion();
    }
}
