package com.dbseed.orchestration.util;

import com.dbseed.orchestration.exception.InvalidCredentialException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SharedKeySignerTest {

    private static final String KEY = "ZGItc2VlZC10ZXN0LXNpZ25pbmcta2V5LTAxMjM0NTY=";
    private static final String DATE = "Mon, 01 Jan 2024 00:00:00 GMT";
    private static final String VERSION = "2021-08-06";
    private static final String RESOURCE = "/myaccount/backups/db/backup.bak";

    @Test
    void shouldBuildStringToSignWithEmptyStandardHeaders() {
        String stringToSign = SharedKeySigner.createStringToSign("GET", DATE, VERSION, RESOURCE);

        assertEquals(
                "GET\n\n\n\n\n\n\n\n\n\n\n\nx-ms-date:" + DATE + "\nx-ms-version:" + VERSION + "\n" + RESOURCE,
                stringToSign
        );
    }

    @Test
    void shouldProduceKnownSignature() {
        String stringToSign = SharedKeySigner.createStringToSign("GET", DATE, VERSION, RESOURCE);

        assertEquals("szHxF2svy8rO5fT3/rUUbGniZWwov10hBHUEwNCK+Ck=", SharedKeySigner.sign(stringToSign, KEY));
    }

    @Test
    void shouldProduceSameSignatureForSameInputs() {
        String first = SharedKeySigner.createGetAuthorizationHeader("myaccount", RESOURCE, DATE, VERSION, KEY);
        String second = SharedKeySigner.createGetAuthorizationHeader("myaccount", RESOURCE, DATE, VERSION, KEY);

        assertEquals(first, second);
    }

    @Test
    void shouldCreateSharedKeyAuthorizationHeader() {
        String header = SharedKeySigner.createGetAuthorizationHeader("myaccount", RESOURCE, DATE, VERSION, KEY);

        assertEquals("SharedKey myaccount:szHxF2svy8rO5fT3/rUUbGniZWwov10hBHUEwNCK+Ck=", header);
    }

    @Test
    void shouldChangeSignatureWhenDateChanges() {
        String original = SharedKeySigner.createGetAuthorizationHeader("myaccount", RESOURCE, DATE, VERSION, KEY);
        String other = SharedKeySigner.createGetAuthorizationHeader("myaccount", RESOURCE, "Tue, 02 Jan 2024 00:00:00 GMT", VERSION, KEY);

        assertTrue(!original.equals(other));
    }

    @Test
    void shouldRejectBlankKey() {
        assertThrows(InvalidCredentialException.class, () -> SharedKeySigner.sign("GET", " "));
        assertThrows(InvalidCredentialException.class, () -> SharedKeySigner.sign("GET", null));
    }

    @Test
    void shouldRejectKeyWhichIsNotBase64() {
        assertThrows(InvalidCredentialException.class, () -> SharedKeySigner.sign("GET", "not base64 at all!"));
    }
}
