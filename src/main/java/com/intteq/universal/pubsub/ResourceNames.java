package com.intteq.universal.pubsub;

import com.intteq.universal.pubsub.exception.PubSubConfigurationException;

import java.util.regex.Pattern;

/**
 * Naming rules shared by topics and subscriptions.
 *
 * <p>Names are kebab-case: lowercase letters, digits and hyphens, starting with a
 * letter and ending with a letter or digit, at most 63 characters long.
 */
public final class ResourceNames {

    public static final int MAX_LENGTH = 63;

    private static final Pattern NAME = Pattern.compile("^[a-z]([a-z0-9-]{0,61}[a-z0-9])?$");

    private ResourceNames() {
    }

    public static boolean isValid(String name) {
        return name != null && NAME.matcher(name).matches();
    }

    /**
     * Validates a name and raises a configuration error describing the offending value.
     *
     * @param kind  "topic" or "subscription", used in the error message
     * @param name  the name to check
     * @throws PubSubConfigurationException if the name does not follow the naming rules
     */
    public static void requireValid(String kind, String name) {
        if (!isValid(name)) {
            throw new PubSubConfigurationException(
                    "invalid " + kind + " name '" + name + "': must be kebab-case, start with a letter, "
                            + "end with a letter or digit and be at most " + MAX_LENGTH + " characters long");
        }
    }
}
