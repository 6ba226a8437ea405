package de.bsommerfeld.labreport.core.domain;

import com.google.common.base.Strings;
import de.bsommerfeld.labreport.core.error.ValidationException;

/** Presence checks shared by the input field records. */
final class Fields {

    private Fields() {
    }

    static void require(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Missing required field: " + name);
        }
    }

    static String orEmpty(String value) {
        return Strings.nullToEmpty(value);
    }
}
