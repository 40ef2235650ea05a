package io.tessera.core.signal;

import java.io.Serial;

/// Thrown when an identifier fails the safe-character allow-list.
///
/// Raised before the identifier is interpolated into a store key, so a rejected
/// value never reaches the shared store.
public class ValidationException extends RuntimeException {

    @Serial private static final long serialVersionUID = 7311946412867305288L;

    private final String field;

    /// Creates a validation exception.
    ///
    /// @param field name of the rejected parameter, not null
    /// @param message the error message
    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    /// Returns the name of the parameter that failed validation.
    ///
    /// @return field name, never null
    public String getField() {
        return field;
    }

    /// Creates an exception for a value outside the safe-ID pattern.
    ///
    /// @param field the parameter name
    /// @return new exception
    public static ValidationException unsafeId(String field) {
        return new ValidationException(
                field,
                "Invalid "
                        + field
                        + ": must be 1-64 characters of letters, digits, '-' or '_'");
    }
}
