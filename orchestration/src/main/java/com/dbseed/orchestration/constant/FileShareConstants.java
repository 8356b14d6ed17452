package com.dbseed.orchestration.constant;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

public class FileShareConstants {

    public static final String HEADER_DATE = "x-ms-date";
    public static final String HEADER_VERSION = "x-ms-version";
    public static final String HEADER_AUTHORIZATION = "Authorization";

    public static final String SHARED_KEY_SCHEME = "SharedKey";
    public static final String SIGNATURE_ALGORITHM = "HmacSHA256";

    // Content-Encoding, Content-Language, Content-Length, Content-MD5, Content-Type, Date,
    // If-Modified-Since, If-Match, If-None-Match, If-Unmodified-Since, Range
    public static final int STANDARD_HEADERS_PLACEHOLDERS_COUNT = 11;

    public static final DateTimeFormatter RFC_1123_FORMATTER = DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.US).withZone(ZoneOffset.UTC);

    public static final String TEMPORARY_FILE_SUFFIX = ".part";

    private FileShareConstants() {
    }
}
