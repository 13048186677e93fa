package com.example.ficregistry.crypto;

import com.example.ficregistry.models.PersonColumn;
import com.example.ficregistry.models.PersonRecord;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Display masking for sensitive values: the first and last two characters survive,
 * anything of four characters or fewer is masked whole.
 */
public final class Masking {

    public static final String MASK = "****";

    private Masking() {
    }

    public static String mask(String value) {
        if (value == null || value.isBlank()) {
            return "";
        }
        if (value.length() <= 4) {
            return MASK;
        }
        return value.substring(0, 2) + MASK + value.substring(value.length() - 2);
    }

    /**
     * Column key to display value for every column, sensitive ones masked, plus the
     * qualification description.
     */
    public static Map<String, String> maskedView(PersonRecord person) {
        Map<String, String> view = new LinkedHashMap<>();
        for (PersonColumn column : PersonColumn.values()) {
            String value = person.value(column);
            view.put(column.key(), column.isSensitive() ? mask(value) : (value == null ? "" : value));
        }
        view.put("qualification_description", person.qualificationDescription());
        return view;
    }
}
