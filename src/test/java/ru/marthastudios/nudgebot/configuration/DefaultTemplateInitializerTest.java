package ru.marthastudios.nudgebot.configuration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import ru.marthastudios.nudgebot.service.MessageTemplateService;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class DefaultTemplateInitializerTest {
    private MessageTemplateService messageTemplateService;
    private DefaultTemplateInitializer initializer;

    @BeforeEach
    void setUp() {
        messageTemplateService = mock(MessageTemplateService.class);
        initializer = new DefaultTemplateInitializer(messageTemplateService);
    }

    @Test
    void seedsDefaultTemplatesIntoEmptyStore() throws Exception {
        when(messageTemplateService.getTemplateCount()).thenReturn(0L);

        initializer.init();

        ArgumentCaptor<String> names = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> payloads = ArgumentCaptor.forClass(String.class);

        verify(messageTemplateService, times(4)).createTemplate(names.capture(), payloads.capture(),
                eq(DefaultTemplateInitializer.SYSTEM_CREATOR));

        assertEquals(List.copyOf(DefaultTemplateInitializer.DEFAULT_TEMPLATES.keySet()), names.getAllValues());

        ObjectMapper objectMapper = new ObjectMapper();

        for (String payload : payloads.getAllValues()) {
            JsonNode card = objectMapper.readTree(payload);

            assertEquals("AdaptiveCard", card.path("type").asText());
        }
    }

    @Test
    void existingTemplatesAreLeftAlone() {
        when(messageTemplateService.getTemplateCount()).thenReturn(2L);

        initializer.init();

        verify(messageTemplateService, never()).createTemplate(anyString(), anyString(), anyString());
    }

    @Test
    void storageErrorsDoNotStopStartup() {
        when(messageTemplateService.getTemplateCount()).thenThrow(new IllegalStateException("database down"));

        assertDoesNotThrow(() -> initializer.init());
    }
}
