package ru.marthastudios.nudgebot.property;

import lombok.Getter;
import lombok.Setter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
@Getter
@Setter
public class BotProperty {
    @Value("${bot.app-id}")
    private String appId;

    @Value("${bot.app-secret}")
    private String appSecret;

    /**
     * Empty for multi-tenant bot registrations.
     */
    @Value("${bot.tenant-id:}")
    private String tenantId;

    @Value("${bot.name:Bot}")
    private String name;

    @Value("${bot.app-catalog-team-app-id:}")
    private String appCatalogTeamAppId;

    @Value("${bot.verbose-errors:false}")
    private boolean verboseErrors;
}
