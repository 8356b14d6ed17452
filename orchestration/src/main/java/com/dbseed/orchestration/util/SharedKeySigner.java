package com.dbseed.orchestration.util;

import com.dbseed.orchestration.constant.FileShareConstants;
import com.dbseed.orchestration.exception.InvalidCredentialException;
import org.apache.commons.lang3.StringUtils;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Base64;

/**
 * Shared Key authorization for file share read requests.
 * See <a href="https://learn.microsoft.com/en-us/rest/api/storageservices/authorize-with-shared-key">Authorize with Shared Key</a>.
 */
public class SharedKeySigner {

    public static String createStringToSign(String method, String date, String protocolVersion, String canonicalizedResource) {
        StringBuilder builder = new StringBuilder(method).append('\n');
        for (int i = 0; i < FileShareConstants.STANDARD_HEADERS_PLACEHOLDERS_COUNT; i++) {
            builder.append('\n');
        }

        return builder
                .append(FileShareConstants.HEADER_DATE).append(':').append(date).append('\n')
                .append(FileShareConstants.HEADER_VERSION).append(':').append(protocolVersion).append('\n')
                .append(canonicalizedResource)
                .toString();
    }

    /**
     * Computes base64 encoded HMAC-SHA256 of the string to sign.
     *
     * @param stringToSign    canonical request representation
     * @param base64SigningKey account key, base64 encoded
     * @return signature
     * @throws InvalidCredentialException if key is absent or is not valid base64
     */
    public static String sign(String stringToSign, String base64SigningKey) throws InvalidCredentialException {
        if (StringUtils.isBlank(base64SigningKey)) {
            throw new InvalidCredentialException("Signing key is absent.");
        }

        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(base64SigningKey.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidCredentialException("Signing key is not valid base64.", e);
        }

        if (keyBytes.length == 0) {
            throw new InvalidCredentialException("Signing key is empty.");
        }

        try {
            Mac mac = Mac.getInstance(FileShareConstants.SIGNATURE_ALGORITHM);
            mac.init(new SecretKeySpec(keyBytes, FileShareConstants.SIGNATURE_ALGORITHM));
            return Base64.getEncoder().encodeToString(mac.doFinal(stringToSign.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new InvalidCredentialException("Failed to compute request signature.", e);
        }
    }

    /**
     * @return value for Authorization header of GET request
     */
    public static String createGetAuthorizationHeader(String account, String canonicalizedResource, String date, String protocolVersion, String base64SigningKey) {
        String stringToSign = createStringToSign("GET", date, protocolVersion, canonicalizedResource);
        return FileShareConstants.SHARED_KEY_SCHEME + " " + account + ":" + sign(stringToSign, base64SigningKey);
    }

    private SharedKeySigner() {
    }
}
