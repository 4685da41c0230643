package com.conveyal.ithim;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileReader;
import java.io.InputStream;
import java.io.Reader;
import java.util.Arrays;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Shared functionality for classes that load properties containing configuration information and expose these options
 * via the Config interfaces of the model components.
 *
 * Some validation may be performed here, but any interpretation or conditional logic should be provided in the
 * components themselves.
 *
 * Default values for every key are shipped in a properties file on the classpath, so it's easy to see an exhaustive
 * list of all parameters. Those defaults are overlaid with any user-supplied file, then with environment variables and
 * system properties. After this layering, every key is required.
 */
public class ConfigBase {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigBase.class);

    public static final String ITHIM_PROPERTY_PREFIX = "ithim-";

    // All access to these should be through the *Prop methods.
    private final Properties properties;

    protected final Set<String> keysWithErrors = new TreeSet<>();

    /**
     * Prepare to load config from the given properties, overriding from environment variables and system properties.
     * In the latter two sources, the keys may be in upper or lower case and use dashes, underscores, or dots as
     * separators. System properties can be set on the JVM command line with -D options. The usual config file keys
     * must be prefixed with "ithim", e.g. ITHIM_SAMPLE_SIZE=50000 or java -Dithim.sample.size=50000.
     * Precedence of configuration sources is: system properties > environment variables > config file.
     */
    protected ConfigBase (Properties properties) {
        this.properties = properties;
        setPropertiesFromMap(System.getenv(), "environment variable");
        setPropertiesFromMap(System.getProperties(), "system properties");
    }

    /** Static convenience method to uniformly load files into properties and catch errors. */
    protected static Properties propsFromFile (String filename) {
        try (Reader propsReader = new FileReader(filename)) {
            Properties properties = new Properties();
            properties.load(propsReader);
            return properties;
        } catch (Exception e) {
            throw new ConfigurationException("Could not load configuration properties from " + filename, e);
        }
    }

    /** Load properties from a resource on the classpath, relative to the given class. */
    protected static Properties propsFromResource (Class<?> relativeTo, String resourceName) {
        try (InputStream stream = relativeTo.getResourceAsStream(resourceName)) {
            if (stream == null) {
                throw new ConfigurationException("Configuration resource not found on classpath: " + resourceName);
            }
            Properties properties = new Properties();
            properties.load(stream);
            return properties;
        } catch (ConfigurationException e) {
            throw e;
        } catch (Exception e) {
            throw new ConfigurationException("Could not load configuration resource " + resourceName, e);
        }
    }

    // Always use the following *Prop methods to read properties. This will catch and log missing keys or parse
    // exceptions, allowing config loading to continue and reporting as many problems as possible at once.

    // Catches and records missing values,
    // so methods that wrap this and parse into non-String types can just ignore null values.
    protected String strProp (String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            LOG.error("Missing configuration option {}", key);
            keysWithErrors.add(key);
        }
        return value == null ? null : value.trim();
    }

    protected int intProp (String key) {
        String val = strProp(key);
        if (val != null) {
            try {
                return Integer.parseInt(val);
            } catch (NumberFormatException nfe) {
                LOG.error("Value of configuration option '{}' could not be parsed as an integer: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return 0;
    }

    protected long longProp (String key) {
        String val = strProp(key);
        if (val != null) {
            try {
                return Long.parseLong(val);
            } catch (NumberFormatException nfe) {
                LOG.error("Value of configuration option '{}' could not be parsed as a long integer: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return 0;
    }

    protected double doubleProp (String key) {
        String val = strProp(key);
        if (val != null) {
            try {
                return Double.parseDouble(val);
            } catch (NumberFormatException nfe) {
                LOG.error("Value of configuration option '{}' could not be parsed as a number: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return Double.NaN;
    }

    /** A comma separated list of numbers. Returns an empty array when the value is missing or malformed. */
    protected double[] doubleArrayProp (String key) {
        String val = strProp(key);
        if (val != null) {
            try {
                return Arrays.stream(val.split("\\s*,\\s*")).mapToDouble(Double::parseDouble).toArray();
            } catch (NumberFormatException nfe) {
                LOG.error("Value of configuration option '{}' could not be parsed as a list of numbers: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return new double[0];
    }

    /** Record a value that was parsed successfully but is not acceptable. */
    protected void invalid (String key, String requirement) {
        LOG.error("Configuration option '{}' {}: {}", key, requirement, properties.getProperty(key));
        keysWithErrors.add(key);
    }

    /** Call this after reading all properties to enforce the presence and validity of all configuration options. */
    protected void throwIfErrors () {
        if (!keysWithErrors.isEmpty()) {
            throw new ConfigurationException("Missing or invalid configuration properties: " +
                    String.join(", ", keysWithErrors));
        }
    }

    /**
     * Overwrite configuration options supplied in the config file with environment variables and system properties
     * (e.g. supplied on the JVM command line). Case and separators are normalized to conform to both properties and
     * environment variable conventions. Properties are Object-Object Maps so key and value are cast to String.
     */
    private void setPropertiesFromMap (Map<?, ?> map, String sourceDescription) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            // Normalize to String type, all lower case, all dash separators.
            String key = ((String)entry.getKey()).toLowerCase().replaceAll("[\\._-]", "-");
            String value = ((String)entry.getValue());
            if (key.startsWith(ITHIM_PROPERTY_PREFIX)) {
                // Strip off prefix to get the key that would be used in our config file.
                key = key.substring(ITHIM_PROPERTY_PREFIX.length());
                String existingKey = properties.getProperty(key);
                if (existingKey != null) {
                    LOG.info("Overwriting existing config key {} to '{}' from {}.", key, value, sourceDescription);
                } else {
                    LOG.info("Setting configuration key {} to '{}' from {}.", key, value, sourceDescription);
                }
                properties.setProperty(key, value);
            }
        }
    }

}
