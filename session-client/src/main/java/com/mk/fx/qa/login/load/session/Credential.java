package com.mk.fx.qa.login.load.session;

import java.util.Objects;

/**
 * Username/password pair used for one login attempt. The password is never included in {@link
 * #toString()}, so credentials can be logged safely.
 *
 * @param username the account name typed into the {@code #username} field
 * @param password the secret typed into the {@code #password} field
 */
public record Credential(String username, String password) {

    public Credential {
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(password, "password");
    }

    /**
     * Parses a {@code username:password} pair. Only the first colon separates the two parts, so
     * passwords may themselves contain colons.
     *
     * @param value the raw pair
     * @return the parsed credential
     * @throws IllegalArgumentException if the value is blank or has no colon
     */
    public static Credential parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Credential must be provided as username:password");
        }
        var separator = value.indexOf(':');
        if (separator < 0) {
            throw new IllegalArgumentException(
                    "Credential '" + value + "' must be provided as username:password");
        }
        return new Credential(value.substring(0, separator), value.substring(separator + 1));
    }

    @Override
    public String toString() {
        return "Credential[username=" + username + "]";
    }
}
