package com.koni.historyinjector.domain.model;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Helpers for Home Assistant style entity ids ({@code domain.object_id}).
 */
public final class EntityIds {

    // lowercase letters, digits and single underscores, no leading/trailing underscore in either part
    private static final Pattern VALID_ENTITY_ID =
            Pattern.compile("^(?!.+__)(?!_)[\\da-z_]+(?<!_)\\.(?!_)[\\da-z_]+(?<!_)$");

    private EntityIds() {
    }

    public static boolean isValid(String entityId) {
        return entityId != null && VALID_ENTITY_ID.matcher(entityId).matches();
    }

    public static String domain(String entityId) {
        return entityId.substring(0, entityId.indexOf('.'));
    }

    public static String objectId(String entityId) {
        return entityId.substring(entityId.indexOf('.') + 1);
    }

    /**
     * Derives a display name from the object id, e.g. {@code bedroom_temperature} becomes
     * {@code Bedroom Temperature}.
     */
    public static String defaultFriendlyName(String entityId) {
        String[] words = objectId(entityId).split("_");
        StringBuilder name = new StringBuilder();
        for (String word : words) {
            if (word.isEmpty()) {
                continue;
            }
            if (name.length() > 0) {
                name.append(' ');
            }
            name.append(word.substring(0, 1).toUpperCase(Locale.ROOT)).append(word.substring(1));
        }
        return name.toString();
    }
}
