/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.rlisp;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.base.Ascii;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Ints;
import static java.util.Objects.requireNonNull;

/**
 * Interpreter settings. Defaults come from the classpath resource
 * {@code /META-INF/rlisp/rlisp.properties}; a JVM system property with the
 * same key always wins.
 */
public class Config
{
    private static final Logger logger = Logger.getLogger(Config.class.getName());

    public static final String STRUCT_CAPACITY  = "rlisp.struct.capacity";
    public static final String SIGNATURE_POLICY = "rlisp.signature.policy";
    public static final String PRELUDE          = "rlisp.prelude";
    public static final String PROMPT           = "rlisp.prompt";

    public static final int DEFAULT_STRUCT_CAPACITY = 1024;

    private static final String RESOURCE = "/META-INF/rlisp/rlisp.properties";

    private static final class DefaultHolder {
        static final Config INSTANCE = new Config(loadResource(RESOURCE));
    }

    private final ImmutableMap<String, String> conf;

    public static Config getDefault() {
        return DefaultHolder.INSTANCE;
    }

    public Config(Map<String, String> conf) {
        this.conf = ImmutableMap.copyOf(conf);
    }

    private static Map<String, String> loadResource(String name) {
        Map<String, String> map = new HashMap<>();
        try (InputStream in = Config.class.getResourceAsStream(name)) {
            if (in == null) {
                logger.warning("configuration resource not found: " + name);
            } else {
                Properties props = new Properties();
                props.load(in);
                for (String key : props.stringPropertyNames()) {
                    map.put(key, props.getProperty(key));
                }
            }
        } catch (IOException ex) {
            logger.log(Level.WARNING, "cannot read configuration resource " + name, ex);
        }
        return map;
    }

    /**
     * Returns a copy of this configuration with one key replaced.
     */
    public Config with(String name, String value) {
        Map<String, String> copy = new HashMap<>(conf);
        copy.put(requireNonNull(name), requireNonNull(value));
        return new Config(copy);
    }

    public Optional<String> get(String name) {
        Optional<String> val = Optional.ofNullable(System.getProperty(name));
        return val.isPresent() ? val : Optional.ofNullable(conf.get(name));
    }

    public String get(String name, String deflt) {
        return get(name).orElse(deflt);
    }

    public boolean getBoolean(String name, boolean deflt) {
        return get(name).map(Boolean::valueOf).orElse(deflt);
    }

    public int getInt(String name, int deflt) {
        return get(name).map(String::trim).map(Ints::tryParse).orElse(deflt);
    }

    public SignaturePolicy getSignaturePolicy() {
        String name = get(SIGNATURE_POLICY, "nominal").trim();
        try {
            return SignaturePolicy.valueOf(Ascii.toUpperCase(name));
        } catch (IllegalArgumentException ex) {
            logger.warning("unknown signature policy '" + name + "', using nominal");
            return SignaturePolicy.NOMINAL;
        }
    }

    public String toString() {
        return MoreObjects.toStringHelper(this).add("conf", conf).toString();
    }
}
