package ru.marthastudios.nudgebot.util;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public class UpnFileParserUtil {
    /**
     * Reads one UPN per non-blank line; for CSV input only the first column is used.
     */
    public static List<String> parseUpns(InputStream inputStream) throws IOException {
        List<String> upns = new ArrayList<>();

        try (BufferedReader reader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
            String line;

            while ((line = reader.readLine()) != null) {
                String trimmedLine = line.trim();

                if (trimmedLine.isEmpty()) {
                    continue;
                }

                String upn = trimmedLine.split(",")[0].trim();

                if (!upn.isEmpty()) {
                    upns.add(upn);
                }
            }
        }

        return upns;
    }
}
