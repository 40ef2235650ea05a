package io.tessera.core.signal;

import java.util.regex.Pattern;

/// Allow-list validation for identifiers interpolated into store keys.
///
/// Identifiers are 1 to 64 characters drawn from letters, digits, `-` and `_`.
/// Anything else, including `:` and `*`, could address or glob across another
/// coordinator's keys.
public final class SafeIds {

    /// Safe identifier pattern.
    static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private SafeIds() {}

    /// Checks whether the value is a safe identifier.
    ///
    /// @param value the string to check, may be null
    /// @return `true` if the value matches the safe-ID pattern
    public static boolean isSafe(String value) {
        return value != null && SAFE_ID.matcher(value).matches();
    }

    /// Returns the value if safe, otherwise throws.
    ///
    /// @param value the identifier, may be null
    /// @param field parameter name used in the error message, not null
    /// @return `value`, never null
    /// @throws ValidationException if the value is null or unsafe
    public static String requireSafe(String value, String field) {
        if (!isSafe(value)) {
            throw ValidationException.unsafeId(field);
        }
        return value;
    }
}
