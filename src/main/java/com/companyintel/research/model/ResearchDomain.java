package com.companyintel.research.model;

import java.util.Locale;

/**
 * The fixed set of research domains a request is decomposed into.
 */
public enum ResearchDomain {
    PAST("past", "Company History and Background"),
    FUTURE("future", "Future Prospects and Strategy"),
    CULTURE("culture", "Company Culture and Work Environment");

    private final String key;
    private final String heading;

    ResearchDomain(String key, String heading) {
        this.key = key;
        this.heading = heading;
    }

    public String key() {
        return key;
    }

    public String heading() {
        return heading;
    }

    public static ResearchDomain fromKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Research domain key is required.");
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (ResearchDomain domain : values()) {
            if (domain.key.equals(normalized)) {
                return domain;
            }
        }
        throw new IllegalArgumentException("Unknown research domain: " + key);
    }
}
