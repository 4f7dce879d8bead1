package ru.marthastudios.nudgebot.service;

import com.microsoft.graph.models.User;
import com.microsoft.kiota.ApiException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.marthastudios.nudgebot.api.GraphApi;
import ru.marthastudios.nudgebot.pojo.EnrichedUserInfo;

import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class GraphUserService {
    public static final int DEFAULT_MAX_USERS = 999;

    private final GraphApi graphApi;

    public List<EnrichedUserInfo> getAllUsersWithMetadata() {
        return getAllUsersWithMetadata(DEFAULT_MAX_USERS);
    }

    public List<EnrichedUserInfo> getAllUsersWithMetadata(int maxUsers) {
        log.info("Fetching up to {} users with extended metadata from Graph", maxUsers);

        List<EnrichedUserInfo> users = new ArrayList<>();

        for (User user : graphApi.getEnabledMemberUsers(maxUsers)) {
            if (user.getUserPrincipalName() != null) {
                users.add(mapToEnrichedUser(user));
            }
        }

        log.info("Retrieved {} users with metadata from Graph", users.size());

        enrichUsersWithManagers(users);

        return users;
    }

    /**
     * Users whose manager cannot be read keep a null manager.
     */
    public void enrichUsersWithManagers(List<EnrichedUserInfo> users) {
        log.info("Enriching {} users with manager information", users.size());

        int found = 0;

        for (EnrichedUserInfo user : users) {
            try {
                User manager = graphApi.getManager(user.getUserPrincipalName());

                if (manager != null) {
                    user.setManagerDisplayName(manager.getDisplayName());
                    found++;
                }
            } catch (ApiException e) {
                log.debug("No manager available for {}: {}", user.getUserPrincipalName(), e.getMessage());
            }
        }

        log.info("Manager enrichment completed, {} of {} users have a manager", found, users.size());
    }

    static EnrichedUserInfo mapToEnrichedUser(User user) {
        return EnrichedUserInfo.builder()
                .id(user.getId())
                .userPrincipalName(user.getUserPrincipalName())
                .displayName(user.getDisplayName())
                .givenName(user.getGivenName())
                .surname(user.getSurname())
                .mail(user.getMail())
                .department(user.getDepartment())
                .jobTitle(user.getJobTitle())
                .officeLocation(user.getOfficeLocation())
                .city(user.getCity())
                .country(user.getCountry())
                .state(user.getState())
                .companyName(user.getCompanyName())
                .employeeType(user.getEmployeeType())
                .build();
    }
}
