package com.p14n.eventbroker.data;

import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import com.p14n.eventbroker.util.Conversions;

/**
 * Broker configuration values.
 *
 * @param name             broker name
 * @param threadNameFormat delivery thread name format, or null for the default
 */
public record ConfigData(String name, String threadNameFormat) implements BrokerConfig {

    public ConfigData {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("name cannot be null or empty");
        }
    }

    public ConfigData(String name) {
        this(name, null);
    }

    @Override
    public String threadNameFormat() {
        return threadNameFormat != null ? threadNameFormat : BrokerConfig.super.threadNameFormat();
    }

    /**
     * Reads the configuration from properties whose keys start with the given
     * prefix, e.g. {@code broker.name} and {@code broker.thread-name-format} for
     * the prefix {@code broker.}.
     *
     * @param props  the properties to read
     * @param prefix the key prefix
     * @return the configuration
     * @throws IllegalArgumentException if no name is configured
     */
    public static ConfigData fromProperties(Properties props, String prefix) {
        Map<String, Object> all = new HashMap<>();
        for (String key : props.stringPropertyNames()) {
            all.put(key, props.getProperty(key));
        }
        Map<String, Object> cfg = Conversions.subconfig(all, prefix);
        return new ConfigData((String) cfg.get("name"), (String) cfg.get("thread-name-format"));
    }
}
