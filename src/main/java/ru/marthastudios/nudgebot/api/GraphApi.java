package ru.marthastudios.nudgebot.api;

import com.microsoft.graph.models.DirectoryObject;
import com.microsoft.graph.models.User;
import com.microsoft.graph.models.UserCollectionResponse;
import com.microsoft.graph.models.UserScopeTeamsAppInstallation;
import com.microsoft.graph.models.UserScopeTeamsAppInstallationCollectionResponse;
import com.microsoft.graph.serviceclient.GraphServiceClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper over the Graph SDK calls the bot needs, so services can be tested without the fluent client.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GraphApi {
    private static final String TEAMS_APP_BIND_URL = "https://graph.microsoft.com/v1.0/appCatalogs/teamsApps/";
    private static final String ENABLED_MEMBERS_FILTER = "accountEnabled eq true and userType eq 'Member'";
    private static final int MAX_PAGE_SIZE = 999;

    static final String[] ENRICHED_USER_PROPERTIES = {
            "id", "userPrincipalName", "displayName", "givenName", "surname", "mail", "department", "jobTitle",
            "officeLocation", "city", "country", "state", "companyName", "employeeType"
    };

    private final GraphServiceClient graphServiceClient;

    public User getUser(String idOrUpn) {
        return graphServiceClient.users().byUserId(idOrUpn).get(requestConfiguration -> {
            requestConfiguration.queryParameters.select = new String[] {"id", "userPrincipalName"};
        });
    }

    /**
     * Returns the user's manager, or null when none is assigned or it is not a user.
     */
    public User getManager(String idOrUpn) {
        DirectoryObject manager = graphServiceClient.users().byUserId(idOrUpn).manager().get();

        return manager instanceof User ? (User) manager : null;
    }

    public int getTotalUserCount() {
        Integer count = graphServiceClient.users().count().get(requestConfiguration -> {
            requestConfiguration.headers.add("ConsistencyLevel", "eventual");
        });

        return count != null ? count : 0;
    }

    /**
     * Pages through enabled member accounts until {@code maxUsers} have been collected.
     */
    public List<User> getEnabledMemberUsers(int maxUsers) {
        List<User> users = new ArrayList<>();

        UserCollectionResponse response = graphServiceClient.users().get(requestConfiguration -> {
            requestConfiguration.queryParameters.select = ENRICHED_USER_PROPERTIES;
            requestConfiguration.queryParameters.top = Math.min(maxUsers, MAX_PAGE_SIZE);
            requestConfiguration.queryParameters.filter = ENABLED_MEMBERS_FILTER;
            requestConfiguration.queryParameters.count = true;
            requestConfiguration.headers.add("ConsistencyLevel", "eventual");
        });

        while (response != null && response.getValue() != null) {
            for (User user : response.getValue()) {
                if (users.size() >= maxUsers) {
                    return users;
                }

                users.add(user);
            }

            if (response.getOdataNextLink() == null || response.getOdataNextLink().isEmpty()) {
                break;
            }

            response = graphServiceClient.users().withUrl(response.getOdataNextLink()).get();
        }

        return users;
    }

    public void installAppForUser(String userId, String teamsCatalogAppId) {
        UserScopeTeamsAppInstallation installation = new UserScopeTeamsAppInstallation();
        Map<String, Object> additionalData = new HashMap<>();

        additionalData.put("teamsApp@odata.bind", TEAMS_APP_BIND_URL + teamsCatalogAppId);
        installation.setAdditionalData(additionalData);

        graphServiceClient.users().byUserId(userId).teamwork().installedApps().post(installation);

        log.info("Installed Teams app {} for user {}", teamsCatalogAppId, userId);
    }

    /**
     * Returns the installation id of the app for the user, or null when it is not installed.
     */
    public String getInstalledAppId(String userId, String teamsCatalogAppId) {
        UserScopeTeamsAppInstallationCollectionResponse response = graphServiceClient.users().byUserId(userId)
                .teamwork().installedApps().get(requestConfiguration -> {
                    requestConfiguration.queryParameters.expand = new String[] {"teamsAppDefinition"};
                    requestConfiguration.queryParameters.filter = "teamsApp/id eq '" + teamsCatalogAppId + "'";
                });

        if (response == null || response.getValue() == null || response.getValue().isEmpty()) {
            return null;
        }

        return response.getValue().get(0).getId();
    }

    /**
     * Reading the installation's chat makes Teams send the bot a fresh conversationUpdate activity.
     */
    public void getInstalledAppChat(String userId, String installationId) {
        graphServiceClient.users().byUserId(userId).teamwork().installedApps()
                .byUserScopeTeamsAppInstallationId(installationId).chat().get();
    }
}
