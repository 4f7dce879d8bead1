package ru.marthastudios.nudgebot.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import ru.marthastudios.nudgebot.configuration.SecurityConfiguration;
import ru.marthastudios.nudgebot.dto.botframework.ActivityDto;
import ru.marthastudios.nudgebot.service.TeamsBotService;

/**
 * Bot Framework channel endpoint. Turn errors are handled inside the turn, so the channel always gets 200
 * once the activity is accepted.
 */
@RestController
@RequestMapping(SecurityConfiguration.BOT_ENDPOINT)
@RequiredArgsConstructor
@Slf4j
public class BotController {
    static final String SERVICE_URL_CLAIM = "serviceurl";

    private final TeamsBotService teamsBotService;

    @PostMapping
    public ResponseEntity<Void> handleActivity(@AuthenticationPrincipal Jwt token, @RequestBody ActivityDto activity) {
        String tokenServiceUrl = token != null ? token.getClaimAsString(SERVICE_URL_CLAIM) : null;

        if (tokenServiceUrl == null || !tokenServiceUrl.equalsIgnoreCase(activity.getServiceUrl())) {
            log.warn("Rejected {} activity: serviceUrl {} does not match the token", activity.getType(),
                    activity.getServiceUrl());

            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }

        log.info("Received {} activity from /api/messages", activity.getType());

        teamsBotService.onTurn(activity);

        return ResponseEntity.ok().build();
    }
}
