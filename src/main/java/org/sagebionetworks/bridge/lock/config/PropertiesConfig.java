package org.sagebionetworks.bridge.lock.config;

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;
import java.util.function.UnaryOperator;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.support.PropertiesLoaderUtils;
import org.springframework.util.PropertyPlaceholderHelper;

/**
 * Config backed by Java properties.
 * <p>
 * Values are layered, each layer overwriting the previous one:
 * <ol>
 * <li>the config template on the classpath, holding every entry with a default or dummy value,</li>
 * <li>the optional local config file, usually in the user's home directory,</li>
 * <li>entries of the template prefixed with the current environment, such as "dev.lock.store.dsn",</li>
 * <li>environment variables (upper case, dots replaced by underscores),</li>
 * <li>system properties.</li>
 * </ol>
 * Values may refer to other entries with ${...} placeholders.
 */
public class PropertiesConfig implements Config {

    private static final PropertyPlaceholderHelper RESOLVER = new PropertyPlaceholderHelper("${", "}");

    /** Environment used when the config does not name one. */
    public static final Environment DEFAULT_ENV = Environment.LOCAL;

    static final String ENV_KEY = "lock.env";

    // Comma surrounded by optional whitespace
    private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults();

    private static final UnaryOperator<String> ENV_READER = name -> {
        final String envName = name.toUpperCase().replace('.', '_');
        try {
            return System.getenv(envName);
        } catch (SecurityException e) {
            throw new ConfigReadException(envName, e);
        }
    };

    private static final UnaryOperator<String> SYS_READER = name -> {
        try {
            return System.getProperty(name);
        } catch (SecurityException e) {
            throw new ConfigReadException(name, e);
        }
    };

    private final Environment environment;
    private final Properties properties;

    /**
     * Loads config from a template on the classpath.
     *
     * @param configTemplate
     *            Classpath location of the template, for instance "conf/lock.conf".
     */
    public PropertiesConfig(final String configTemplate) throws IOException {
        this(configTemplate, null);
    }

    /**
     * Loads config from a template on the classpath and a local config file.
     *
     * @param configTemplate
     *            Classpath location of the template.
     * @param localConfig
     *            Path to the local config file. Ignored if null or missing.
     */
    public PropertiesConfig(final String configTemplate, final Path localConfig) throws IOException {
        this(PropertiesLoaderUtils.loadProperties(new ClassPathResource(checkNotNull(configTemplate))), localConfig);
    }

    public PropertiesConfig(final Properties template, final Path localConfig) throws IOException {
        checkNotNull(template);
        final Properties merged = new Properties();
        merged.putAll(template);
        if (localConfig != null && Files.exists(localConfig)) {
            try (Reader reader = Files.newBufferedReader(localConfig, StandardCharsets.UTF_8)) {
                merged.load(reader);
            }
        }
        environment = readEnvironment(merged);
        properties = collapse(merged, environment.name().toLowerCase());
    }

    @Override
    public Environment getEnvironment() {
        return environment;
    }

    @Override
    public String get(final String key) {
        checkNotNull(key);
        final String value = properties.getProperty(key);
        return value == null ? null : RESOLVER.replacePlaceholders(value, properties);
    }

    @Override
    public int getInt(final String key) {
        return Integer.parseInt(get(key));
    }

    @Override
    public int getInt(final String key, final int defaultValue) {
        final String value = get(key);
        return Strings.isNullOrEmpty(value) ? defaultValue : Integer.parseInt(value);
    }

    @Override
    public List<String> getList(final String key) {
        final String value = get(key);
        return value == null ? List.of() : LIST_SPLITTER.splitToList(value);
    }

    private static Environment readEnvironment(final Properties properties) {
        String envName = SYS_READER.apply(ENV_KEY);
        if (envName == null) {
            envName = ENV_READER.apply(ENV_KEY);
        }
        if (envName == null) {
            envName = properties.getProperty(ENV_KEY);
        }
        if (Strings.isNullOrEmpty(envName)) {
            return DEFAULT_ENV;
        }
        for (Environment env : Environment.values()) {
            if (env.name().equalsIgnoreCase(envName)) {
                return env;
            }
        }
        throw new InvalidEnvironmentException(envName);
    }

    /**
     * Collapses the properties into the entries relevant to the current environment. Entries bound to another
     * environment are dropped.
     */
    private static Properties collapse(final Properties properties, final String envName) {
        final String envPrefix = envName + ".";
        final Properties collapsed = new Properties();
        for (final String key : properties.stringPropertyNames()) {
            if (!isEnvironmentSpecific(key)) {
                collapsed.setProperty(key, properties.getProperty(key));
            }
        }
        for (final String key : properties.stringPropertyNames()) {
            if (key.startsWith(envPrefix)) {
                collapsed.setProperty(key.substring(envPrefix.length()), properties.getProperty(key));
            }
        }
        for (final String key : properties.stringPropertyNames()) {
            String value = SYS_READER.apply(key);
            if (value == null) {
                value = ENV_READER.apply(key);
            }
            if (value != null) {
                collapsed.setProperty(key.startsWith(envPrefix) ? key.substring(envPrefix.length()) : key, value);
            }
        }
        return collapsed;
    }

    private static boolean isEnvironmentSpecific(final String key) {
        for (Environment env : Environment.values()) {
            if (key.startsWith(env.name().toLowerCase() + ".")) {
                return true;
            }
        }
        return false;
    }
}
