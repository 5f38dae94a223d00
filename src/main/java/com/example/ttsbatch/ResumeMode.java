package com.example.ttsbatch;

import java.util.Locale;

public enum ResumeMode {
    /** Continue from the manifest, or from produced artifacts when there is none. */
    AUTO,
    /** Ignore earlier progress and start a new manifest. */
    FRESH;

    public static ResumeMode parse(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown resumeMode: " + value, ex);
        }
    }
}
