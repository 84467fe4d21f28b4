package com.arkive.store.audit;

import com.arkive.store.audit.AuditHasher.ChainLink;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AuditHasherTest {

    private static final ChainLink LINK = new ChainLink("id-1", "u1", "alice", "LOGIN", "SYSTEM", null, null, "{}",
            "2024-03-01T10:15:30.123Z", true, AuditHasher.GENESIS_HASH);

    @Test
    void genesisIsSixtyFourZeros() {
        assertEquals(64, AuditHasher.GENESIS_HASH.length());
        assertTrue(AuditHasher.GENESIS_HASH.chars().allMatch(c -> c == '0'));
    }

    @Test
    void digestIsStableLowercaseHex() {
        String digest = AuditHasher.digest(LINK);

        assertEquals(digest, AuditHasher.digest(LINK));
        assertTrue(digest.matches("[0-9a-f]{64}"));
    }

    @Test
    void everyFieldFeedsTheDigest() {
        String original = AuditHasher.digest(LINK);

        assertNotEquals(original, AuditHasher.digest(new ChainLink("id-2", "u1", "alice", "LOGIN", "SYSTEM", null, null, "{}",
                "2024-03-01T10:15:30.123Z", true, AuditHasher.GENESIS_HASH)));
        assertNotEquals(original, AuditHasher.digest(new ChainLink("id-1", "u1", "alice", "LOGIN", "SYSTEM", null, null, "{}",
                "2024-03-01T10:15:30.123Z", false, AuditHasher.GENESIS_HASH)));
        assertNotEquals(original, AuditHasher.digest(new ChainLink("id-1", "u1", "alice", "LOGIN", "SYSTEM", null, null, "{\"a\":1}",
                "2024-03-01T10:15:30.123Z", true, AuditHasher.GENESIS_HASH)));
        assertNotEquals(original, AuditHasher.digest(new ChainLink("id-1", "u1", "alice", "LOGIN", "SYSTEM", null, null, "{}",
                "2024-03-01T10:15:30.124Z", true, AuditHasher.GENESIS_HASH)));
        assertNotEquals(original, AuditHasher.digest(new ChainLink("id-1", "u1", "alice", "LOGIN", "SYSTEM", null, null, "{}",
                "2024-03-01T10:15:30.123Z", true, "1".repeat(64))));
    }

    @Test
    void metadataKeysAreSortedAtEveryLevel() throws Exception {
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("z", 1);
        nested.put("c", "x");
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("ip_address", "10.0.0.1");
        metadata.put("details", nested);

        String json = AuditHasher.canonicalMetadata(metadata);

        assertEquals("{\"details\":{\"c\":\"x\",\"z\":1},\"ip_address\":\"10.0.0.1\"}", json);
        assertEquals("{}", AuditHasher.canonicalMetadata(null));
        assertEquals(metadata, AuditHasher.readMetadata(json));
    }
}
