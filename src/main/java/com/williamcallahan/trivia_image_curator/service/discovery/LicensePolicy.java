package com.williamcallahan.trivia_image_curator.service.discovery;

import java.util.List;
import java.util.Locale;

/**
 * Decides whether a Commons license short-name is open enough to reuse.
 * A license is permissive when its lower-cased text contains any allow-list entry.
 */
public final class LicensePolicy {

    public static final List<String> ALLOW_LIST = List.of("public domain", "pd-", "cc0", "cc by");

    private LicensePolicy() {
    }

    public static boolean isPermissive(String licenseText) {
        if (licenseText == null || licenseText.isEmpty()) {
            return false;
        }
        String normalized = licenseText.toLowerCase(Locale.ROOT);
        for (String allowed : ALLOW_LIST) {
            if (normalized.contains(allowed)) {
                return true;
            }
        }
        return false;
    }
}
