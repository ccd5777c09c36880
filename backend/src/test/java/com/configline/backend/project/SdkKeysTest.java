package com.configline.backend.project;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class SdkKeysTest {

    @Test
    void bearerToken_extractsKeyCaseInsensitively() {
        assertEquals("sdk_123", SdkKeys.bearerToken("Bearer sdk_123"));
        assertEquals("sdk_123", SdkKeys.bearerToken("  bearer   sdk_123 "));
        assertNull(SdkKeys.bearerToken("Basic abc"));
        assertNull(SdkKeys.bearerToken("Bearer "));
        assertNull(SdkKeys.bearerToken(null));
    }

    @Test
    void hash_isStableHex() {
        assertEquals(64, SdkKeys.hash("k").length());
        assertEquals(SdkKeys.hash("k"), SdkKeys.hash("k"));
    }
}
