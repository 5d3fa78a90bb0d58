/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.rlisp;

import com.google.common.collect.ImmutableMap;
import org.junit.After;
import org.junit.Test;
import static org.junit.Assert.*;

public class ConfigTest {
    private static final String KEY = "rlisp.test.value";

    @After
    public void clearProperty() {
        System.clearProperty(KEY);
    }

    @Test
    public void defaultsComeFromTheResource() {
        Config config = Config.getDefault();
        assertEquals(1024, config.getInt(Config.STRUCT_CAPACITY, 0));
        assertTrue(config.getBoolean(Config.PRELUDE, false));
        assertEquals("> ", config.get(Config.PROMPT, "?"));
        assertEquals(SignaturePolicy.NOMINAL, config.getSignaturePolicy());
    }

    @Test
    public void typedAccessors() {
        Config config = new Config(ImmutableMap.of(KEY, "12", "flag", "true", "bad", "twelve"));
        assertEquals(12, config.getInt(KEY, 0));
        assertEquals(7, config.getInt("bad", 7));
        assertEquals(7, config.getInt("missing", 7));
        assertTrue(config.getBoolean("flag", false));
        assertFalse(config.get("missing").isPresent());
    }

    @Test
    public void systemPropertiesWin() {
        Config config = new Config(ImmutableMap.of(KEY, "12"));
        System.setProperty(KEY, "34");
        assertEquals(34, config.getInt(KEY, 0));
    }

    @Test
    public void withReplacesOneKey() {
        Config base = new Config(ImmutableMap.of(KEY, "1"));
        Config changed = base.with(KEY, "2");
        assertEquals("1", base.get(KEY, null));
        assertEquals("2", changed.get(KEY, null));
    }

    @Test
    public void signaturePolicy() {
        Config config = new Config(ImmutableMap.of());
        assertEquals(SignaturePolicy.STRUCTURAL,
                     config.with(Config.SIGNATURE_POLICY, "Structural").getSignaturePolicy());
        assertEquals(SignaturePolicy.NOMINAL,
                     config.with(Config.SIGNATURE_POLICY, "unknown").getSignaturePolicy());
    }
}
