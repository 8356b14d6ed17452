package com.dbseed.configuration.properties.constant;

import java.util.regex.Pattern;

public class DbSeedConstants {

    public static final String DATABASE_SEEDED_READINESS_CHECK = "database-seeded";

    public static final String MDC_DATABASE_KEY = "database";

    public static final String ADMINISTRATIVE_DATABASE_NAME = "master";

    // identifiers are interpolated into statements, so only a safe subset is allowed
    public static final Pattern DATABASE_NAME_PATTERN = Pattern.compile("[A-Za-z0-9_-]{1,128}");
    public static final Pattern BACKUP_FILE_NAME_PATTERN = Pattern.compile("[A-Za-z0-9._-]{1,255}");

    private DbSeedConstants() {
    }
}
