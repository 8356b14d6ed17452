package com.dbseed.orchestration.model;

import com.dbseed.configuration.properties.constant.DbSeedConstants;
import com.dbseed.orchestration.exception.InvalidIdentifierException;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Database identifier which is safe to be interpolated into statement text. Can only be created through {@link #of(String)}.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class SqlIdentifier {
    private final String value;

    public static SqlIdentifier of(String value) throws InvalidIdentifierException {
        if (!isValid(value)) {
            throw new InvalidIdentifierException("Invalid database identifier '" + value + "'. Allowed are 1 to 128 latin letters, digits, '_' and '-'.");
        }
        return new SqlIdentifier(value);
    }

    public static boolean isValid(String value) {
        return value != null && DbSeedConstants.DATABASE_NAME_PATTERN.matcher(value).matches();
    }

    /**
     * @return identifier in square brackets, ready to be used in statements
     */
    public String quoted() {
        return "[" + value + "]";
    }

    @Override
    public String toString() {
        return value;
    }
}
