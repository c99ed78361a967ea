package com.offy.competition.service;

import com.offy.competition.exception.ValidationException;
import com.offy.competition.model.TargetApp;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Canonical app labels accepted for screen time logs and challenge targets.
 */
@Component
public class AppCatalog {

    public static final String TOTAL = "Total";

    /** Accepted on input as an alias for {@link TargetApp#ALL_SENTINEL}. */
    public static final String LEGACY_TOTAL_TARGET = "__TOTAL__";

    private static final List<String> ALLOWED_APPS = List.of(
        TOTAL,
        "YouTube",
        "TikTok",
        "Instagram",
        "Safari",
        "Chrome",
        "Messages",
        "Mail",
        "Other"
    );

    public List<String> allowedApps() {
        return ALLOWED_APPS;
    }

    /**
     * Case-insensitive lookup of the canonical label. Blank means the user is logging a total.
     */
    public String canonicalize(String rawName) {
        if (rawName == null || rawName.trim().isEmpty()) {
            return TOTAL;
        }

        String candidate = rawName.trim();
        for (String allowed : ALLOWED_APPS) {
            if (allowed.equalsIgnoreCase(candidate)) {
                return allowed;
            }
        }
        throw new ValidationException("App name must be one of: " + String.join(", ", ALLOWED_APPS));
    }

    public TargetApp parseTarget(String rawTarget) {
        if (rawTarget == null || rawTarget.trim().isEmpty()) {
            throw new ValidationException("Target app is required");
        }

        String candidate = rawTarget.trim();
        if (TargetApp.ALL_SENTINEL.equalsIgnoreCase(candidate) || LEGACY_TOTAL_TARGET.equals(candidate)) {
            return TargetApp.all();
        }
        return TargetApp.specific(canonicalize(candidate));
    }
}
