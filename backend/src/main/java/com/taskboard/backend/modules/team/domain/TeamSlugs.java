package com.taskboard.backend.modules.team.domain;

import java.text.Normalizer;
import java.util.Locale;

public final class TeamSlugs {

    public static final String PATTERN = "^[a-z0-9]+(?:-[a-z0-9]+)*$";
    public static final int MAX_LENGTH = 100;
    private static final String FALLBACK = "team";

    private TeamSlugs() {
    }

    /**
     * "Acme Corp!" becomes "acme-corp".
     */
    public static String fromName(String name) {
        if (name == null) {
            return FALLBACK;
        }
        String ascii = Normalizer.normalize(name, Normalizer.Form.NFKD).replaceAll("\\p{M}+", "");
        String slug = ascii.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-+)|(-+$)", "");
        if (slug.length() > MAX_LENGTH) {
            slug = slug.substring(0, MAX_LENGTH).replaceAll("-+$", "");
        }
        return slug.isEmpty() ? FALLBACK : slug;
    }
}
