package ru.marthastudios.nudgebot.util;

import java.security.Principal;

public class PrincipalUtils {
    public static final String UNKNOWN_UPN = "unknown";

    public static String getUpn(Principal principal) {
        if (principal == null || principal.getName() == null || principal.getName().isBlank()) {
            return UNKNOWN_UPN;
        }

        return principal.getName();
    }
}
