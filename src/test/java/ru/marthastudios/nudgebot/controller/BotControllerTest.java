package ru.marthastudios.nudgebot.controller;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import ru.marthastudios.nudgebot.configuration.SecurityConfiguration;
import ru.marthastudios.nudgebot.dto.botframework.ActivityDto;
import ru.marthastudios.nudgebot.service.TeamsBotService;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(BotController.class)
@Import(SecurityConfiguration.class)
class BotControllerTest {
    private static final String SERVICE_URL = "https://smba.trafficmanager.net/emea/";
    private static final String ACTIVITY = "{\"type\": \"message\", \"text\": \"hello\", \"channelId\": \"msteams\","
            + " \"serviceUrl\": \"%s\","
            + " \"from\": {\"id\": \"29:alice\", \"aadObjectId\": \"aad-alice\"},"
            + " \"conversation\": {\"id\": \"conversation-1\"}, \"entities\": []}";

    @Autowired
    private MockMvc mockMvc;
    @MockBean
    private TeamsBotService teamsBotService;

    @Test
    void signedActivityIsHandedToBot() throws Exception {
        mockMvc.perform(post("/api/messages")
                        .with(jwt().jwt(token -> token.claim(BotController.SERVICE_URL_CLAIM, SERVICE_URL)))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(String.format(ACTIVITY, SERVICE_URL)))
                .andExpect(status().isOk());

        ArgumentCaptor<ActivityDto> captor = ArgumentCaptor.forClass(ActivityDto.class);

        verify(teamsBotService).onTurn(captor.capture());

        assertEquals("hello", captor.getValue().getText());
        assertEquals("aad-alice", captor.getValue().getFrom().getAadObjectId());
    }

    @Test
    void unsignedActivityIsRejected() throws Exception {
        mockMvc.perform(post("/api/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(String.format(ACTIVITY, "https://attacker.example")))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(teamsBotService);
    }

    @Test
    void invalidBearerTokenIsRejected() throws Exception {
        mockMvc.perform(post("/api/messages")
                        .header("Authorization", "Bearer not-a-jwt")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(String.format(ACTIVITY, SERVICE_URL)))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(teamsBotService);
    }

    @Test
    void activityForAnotherServiceUrlIsRejected() throws Exception {
        mockMvc.perform(post("/api/messages")
                        .with(jwt().jwt(token -> token.claim(BotController.SERVICE_URL_CLAIM, SERVICE_URL)))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(String.format(ACTIVITY, "https://attacker.example")))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(teamsBotService);
    }
}
