package com.axlabs.neo.yieldshares;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Reads the platform configuration from {@code yieldshares.properties} on the classpath. With a profile set, the
 * properties of {@code [profile].yieldshares.properties} override the defaults.
 */
public class Config {

    private static final String PROPS_FILE = "yieldshares.properties";
    private static String profile;
    private static Properties props;

    public static synchronized void setProfile(String name) {
        profile = name;
        props = null;
    }

    public static synchronized String getProperty(String name) {
        if (props == null) {
            Properties loaded = load(PROPS_FILE, new Properties());
            if (profile != null) {
                loaded = load(profile + "." + PROPS_FILE, loaded);
            }
            props = loaded;
        }
        return props.getProperty(name);
    }

    public static int getIntProperty(String name) {
        return Integer.parseInt(getRequiredProperty(name).trim());
    }

    public static long getLongProperty(String name) {
        return Long.parseLong(getRequiredProperty(name).trim());
    }

    public static boolean getBooleanProperty(String name) {
        String value = getProperty(name);
        return value != null && Boolean.parseBoolean(value.trim());
    }

    private static String getRequiredProperty(String name) {
        String value = getProperty(name);
        if (value == null) {
            throw new IllegalStateException("Missing configuration property " + name);
        }
        return value;
    }

    private static Properties load(String file, Properties defaults) {
        Properties p = new Properties();
        p.putAll(defaults);
        try (InputStream in = Config.class.getClassLoader().getResourceAsStream(file)) {
            if (in == null) {
                throw new IllegalStateException("Configuration file " + file + " not found");
            }
            p.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read configuration file " + file, e);
        }
        return p;
    }
}
