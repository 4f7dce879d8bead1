package ru.marthastudios.nudgebot.pojo;

import lombok.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Directory user with the profile fields the AI model matches smart group descriptions against.
 */
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class EnrichedUserInfo {
    private String id;
    private String userPrincipalName;
    private String displayName;
    private String givenName;
    private String surname;
    private String mail;
    private String department;
    private String jobTitle;
    private String officeLocation;
    private String city;
    private String country;
    private String state;
    private String companyName;
    private String managerDisplayName;
    private String employeeType;

    public String toAiSummary() {
        List<String> parts = new ArrayList<>();

        parts.add("UPN: " + userPrincipalName);
        parts.add("Name: " + (displayName != null ? displayName : "Unknown"));

        addPart(parts, "Job Title", jobTitle);
        addPart(parts, "Department", department);
        addPart(parts, "Office", officeLocation);
        addPart(parts, "City", city);
        addPart(parts, "State", state);
        addPart(parts, "Country", country);
        addPart(parts, "Company", companyName);
        addPart(parts, "Manager", managerDisplayName);
        addPart(parts, "Employee Type", employeeType);

        return String.join(" | ", parts);
    }

    private static void addPart(List<String> parts, String label, String value) {
        if (value != null && !value.isEmpty()) {
            parts.add(label + ": " + value);
        }
    }
}
