package org.kmerweaver.utils.config;

import com.google.common.annotations.VisibleForTesting;
import htsjdk.samtools.util.Log;
import org.aeonbits.owner.Config;
import org.aeonbits.owner.ConfigCache;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.kmerweaver.exceptions.KmerWeaverException;
import org.kmerweaver.exceptions.UserException;
import org.kmerweaver.utils.ClassUtils;
import org.kmerweaver.utils.LoggingUtils;
import org.kmerweaver.utils.Utils;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A singleton class to act as a user interface for loading configuration files from {@link org.aeonbits.owner}.
 * This class wraps functionality in the {@link org.aeonbits.owner} configuration utilities to be a more
 * KmerWeaver-specific interface.
 */
public final class ConfigFactory {

    private static final Logger logger = LogManager.getLogger(ConfigFactory.class);

    //=======================================
    // Singleton members / methods:
    private static final ConfigFactory instance;

    static {
        instance = new ConfigFactory();
    }

    /**
     * @return An instance of this {@link ConfigFactory}, which can be used to create a configuration.
     */
    public static ConfigFactory getInstance() {
        return instance;
    }

    // This class is a singleton, so no public construction.
    private ConfigFactory() {}

    //=======================================

    /**
     * A regex to use to look for variables in the Sources annotation
     */
    private static final Pattern sourcesAnnotationPathVariablePattern = Pattern.compile("\\$\\{(.*)}");

    /**
     * Value to set each variable for configuration file paths when the variable
     * has not been set in either Java System properties or environment properties.
     */
    @VisibleForTesting
    static final String NO_PATH_VARIABLE_VALUE = "/dev/null";

    /**
     * A set to keep track of the classes we've already resolved for configuration path purposes:
     */
    private final Set<Class<? extends Config>> alreadyResolvedPathVariables = new HashSet<>();

    // =================================================================================================================

    /**
     * Sets each of the given {@code filenameProperties} that is not defined in the environment, the system
     * properties or the {@link org.aeonbits.owner.ConfigFactory} properties to an empty file path, so the owner
     * library falls through to the next configuration source.
     */
    @VisibleForTesting
    void checkFileNamePropertyExistenceAndSetConfigFactoryProperties(final List<String> filenameProperties) {
        final Properties systemProperties = System.getProperties();
        final Map<String, String> environmentProperties = System.getenv();

        for (final String property : filenameProperties) {

            if ( environmentProperties.containsKey(property) ) {
                logger.debug("Config path variable found in Environment Properties: " + property + "=" + environmentProperties.get(property) + " - will search for config here.");
            }
            else if ( systemProperties.containsKey(property) ) {
                logger.debug("Config path variable found in System Properties: " + property + "=" + systemProperties.get(property) + " - will search for config here.");
            }
            else if ( org.aeonbits.owner.ConfigFactory.getProperties().containsKey(property) ) {
                logger.debug("Config path variable found in Config Factory Properties(probably from the command-line): " + property + "=" + org.aeonbits.owner.ConfigFactory.getProperty(property) + " - will search for config here.");
            }
            else {
                logger.debug("Config path variable not found: " + property +
                        " - setting value to default empty variable: " + NO_PATH_VARIABLE_VALUE);
                org.aeonbits.owner.ConfigFactory.setProperty(property, NO_PATH_VARIABLE_VALUE);
            }
        }
    }

    /**
     * Get a list of the config file variables from the given {@link Config} class.
     * @param configClass A configuration class from which to extract variable names in its {@link org.aeonbits.owner.Config.Sources}.
     * @return A list of variables in the {@link org.aeonbits.owner.Config.Sources} of the given {@code configClass}
     */
    @VisibleForTesting
    <T extends Config> List<String> getSourcesAnnotationPathVariables(final Class<? extends T> configClass) {

        final List<String> configPathVariableNames = new ArrayList<>();

        final Config.Sources annotation = configClass.getAnnotation(Config.Sources.class);

        if ( annotation != null ) {
            for (final String val : annotation.value()) {

                final Matcher m = sourcesAnnotationPathVariablePattern.matcher(val);
                if (m.find()) {
                    configPathVariableNames.add(m.group(1));
                }
            }
        }

        return configPathVariableNames;
    }

    /**
     * Injects the given properties into the System Properties, validating each one after it is set.
     * Properties that already exist in the system are NOT overridden.
     * @param properties A {@link Map} of key, value pairs of properties to add to the System Properties.
     */
    @VisibleForTesting
    void injectToSystemProperties(final Map<String, String> properties) {

        final Properties systemProperties = System.getProperties();

        for ( final Map.Entry<String, String> entry : properties.entrySet() ) {

            if ( systemProperties.containsKey(entry.getKey()) ) {
                logger.debug("System property already exists.  Not overriding: " + entry.getKey());
                continue;
            }

            System.setProperty(entry.getKey(), entry.getValue());

            final String propertyValueThatWasSet = System.getProperty(entry.getKey());
            if (propertyValueThatWasSet == null) {
                throw new KmerWeaverException("Unable to set System Property (" + entry.getKey() + "=" + entry.getValue() + ")!");
            }

            if (!propertyValueThatWasSet.equals(entry.getValue())) {
                throw new KmerWeaverException("System Property corrupted (" + entry.getKey() + "!=" + entry.getValue() + " -> " + propertyValueThatWasSet + ")!");
            }
        }
    }

    // =================================================================================================================

    /**
     * Quick way to get the KmerWeaver configuration.
     * @return The KmerWeaver Configuration.
     */
    public KmerWeaverConfig getKmerWeaverConfig() {
        return getOrCreate( KmerWeaverConfig.class );
    }

    /**
     * Wrapper around {@link org.aeonbits.owner.ConfigFactory#create(Class, Map[])} which will ensure that
     * path variables specified in {@link org.aeonbits.owner.Config.Sources} annotations are resolved prior
     * to creation.
     *
     * @param clazz   the interface extending from {@link Config} that you want to instantiate.
     * @param imports additional variables to be used to resolve the properties.
     * @param <T>     type of the interface.
     * @return an object implementing the given interface, which maps methods to property values.
     */
    public <T extends Config> T create(final Class<? extends T> clazz, final Map<?, ?>... imports) {

        Utils.nonNull(clazz);

        resolvePathVariables(clazz);

        return org.aeonbits.owner.ConfigFactory.create(clazz, imports);
    }

    /**
     * Wrapper around {@link ConfigCache#getOrCreate(Class, Map[])} which will ensure that
     * path variables specified in {@link org.aeonbits.owner.Config.Sources} annotations are resolved prior
     * to creation.
     *
     * @param clazz     the interface extending from {@link Config} that you want to instantiate.
     * @param imports   additional variables to be used to resolve the properties.
     * @param <T>       type of the interface.
     * @return          an object implementing the given interface, that can be taken from the cache,
     *                  which maps methods to property values.
     */
    public <T extends Config> T getOrCreate(final Class<? extends T> clazz, final Map<?, ?>... imports) {

        Utils.nonNull(clazz);

        resolvePathVariables(clazz);

        return ConfigCache.getOrCreate(clazz, imports);
    }

    private synchronized <T extends Config> void resolvePathVariables(final Class<? extends T> clazz) {
        if ( !alreadyResolvedPathVariables.contains(clazz) ) {
            checkFileNamePropertyExistenceAndSetConfigFactoryProperties(
                    getSourcesAnnotationPathVariables(clazz)
            );

            alreadyResolvedPathVariables.add(clazz);
        }
    }

    /**
     * Get the configuration file name from the given arguments.
     *
     * NOTE: Does NOT validate that the resulting string is a valid configuration file.
     *
     * @param args Command-line arguments passed to this program.
     * @param configFileOption The command-line option indicating that the config file is next
     * @return The name of the configuration file for this program or {@code null}.
     */
    public static String getConfigFilenameFromArgs( final String[] args, final String configFileOption ) {

        Utils.nonNull(args);
        Utils.nonNull(configFileOption);

        String configFileName = null;

        for ( int i = 0 ; i < args.length ; ++i ) {
            if (args[i].equals(configFileOption)) {

                if ( ((i+1) < args.length) && (!args[i+1].startsWith("-")) ) {
                    configFileName = args[i+1];
                    break;
                }
                else {
                    // Option was provided, but no file was specified.
                    throw new UserException.BadInput("ERROR: Configuration file not given after config file option specified: " + configFileOption);
                }
            }
        }

        return configFileName;
    }

    /**
     * Get the configuration filename from the command-line (if it exists) and create a {@link KmerWeaverConfig}
     * for it. Also sets system-level properties from the configuration.
     * @param argList The list of arguments from which to read the config file.
     * @param configFileOption The command-line option specifying the main configuration file.
     */
    public synchronized void initializeConfigurationsFromCommandLineArgs(final String[] argList,
                                                                         final String configFileOption) {
        initializeConfigurationsFromCommandLineArgs(
                argList,
                configFileOption,
                KmerWeaverConfig.class
        );
    }

    /**
     * Get the configuration filename from the command-line (if it exists) and create a configuration of the given
     * type for it. Also sets system-level properties from the configuration.
     * @param argList The list of arguments from which to read the config file.
     * @param configFileOption The command-line option specifying the main configuration file.
     * @param configClass The class of the configuration file to instantiate.
     */
    public synchronized <T extends Config> void initializeConfigurationsFromCommandLineArgs(final String[] argList,
                                                                                            final String configFileOption,
                                                                                            final Class<? extends T> configClass) {
        Utils.nonNull(argList);
        Utils.nonNull(configFileOption);
        Utils.nonNull(configClass);

        final String configFileName = getConfigFilenameFromArgs( argList, configFileOption );

        final T configuration = getOrCreateConfigFromFile(configFileName, configClass);

        injectSystemPropertiesFromConfig( configuration );
    }

    @VisibleForTesting
    synchronized <T extends Config> T getOrCreateConfigFromFile(final String configFileName, final Class<? extends T> configClass) {
        if ( configFileName != null ){
            org.aeonbits.owner.ConfigFactory.setProperty( KmerWeaverConfig.CONFIG_FILE_VARIABLE_FILE_NAME, configFileName );
        }
        return ConfigFactory.getInstance().getOrCreate(configClass);
    }

    @VisibleForTesting
    synchronized <T extends Config> T createConfigFromFile(final String configFileName, final Class<? extends T> configClass) {
        if ( configFileName != null ){
            org.aeonbits.owner.ConfigFactory.setProperty( KmerWeaverConfig.CONFIG_FILE_VARIABLE_FILE_NAME, configFileName );
        }
        return ConfigFactory.getInstance().create(configClass);
    }

    /**
     * Injects system properties from the given configuration.
     * System properties are specified by the presence of the {@link SystemProperty} annotation.
     * This will NOT override properties that already exist in the system.
     * @param config The {@link Config} object from which to inject system properties.
     */
    public synchronized <T extends Config> void injectSystemPropertiesFromConfig(final T config) {
        Utils.nonNull(config);
        injectToSystemProperties(getSystemPropertiesFromConfig(config));
    }

    /**
     * Logs all the parameters in the given {@link Config} object at {@link Level#DEBUG}
     * @param config A {@link Config} object from which to log all parameters and values.
     * @param <T> any {@link Config} type to use to log all configuration information.
     */
    public static <T extends Config> void logConfigFields(final T config) {
        logConfigFields(config, Log.LogLevel.DEBUG);
    }

    /**
     * Gets all system properties from the given {@link Config}-derived object.
     * System properties are denoted via the presence of the {@link SystemProperty} annotation.
     */
    @VisibleForTesting
    static <T extends Config> LinkedHashMap<String, String> getSystemPropertiesFromConfig(final T config) {

        Utils.nonNull(config);

        final LinkedHashMap<String, String> properties = new LinkedHashMap<>();

        for ( final Map.Entry<String, Object> entry : getConfigMap(config, true).entrySet() ) {
            properties.put(entry.getKey(), String.valueOf(entry.getValue()));
        }

        return properties;
    }

    /**
     * Logs all the parameters in the given {@link Config} object at the given {@link Log.LogLevel}
     * @param config A {@link Config} object from which to log all parameters and values.
     * @param logLevel The log {@link htsjdk.samtools.util.Log.LogLevel} at which to log the data in {@code config}
     * @param <T> any {@link Config} type to use to log all configuration information.
     */
    public static <T extends Config> void logConfigFields(final T config, final Log.LogLevel logLevel) {

        Utils.nonNull(config);
        Utils.nonNull(logLevel);

        final Level level = LoggingUtils.levelToLog4jLevel(logLevel);

        if ( !logger.isEnabled(level) ) {
            return;
        }

        logger.log(level, "Configuration file values: ");
        for ( final Map.Entry<String, Object> entry : getConfigMap(config, false).entrySet() ) {
            logger.log(level, "\t" + entry.getKey() + " = " + entry.getValue());
        }
    }

    @VisibleForTesting
    static <T extends Config> LinkedHashMap<String, Object> getConfigMap( final T config, final boolean onlySystemProperties ) {
        final LinkedHashMap<String, Object> configMap = new LinkedHashMap<>();

        // The proxy implements our configuration interface; only its methods that belong to a Config
        // sub-interface describe configuration parameters.
        for ( final Class<?> classInterface : ClassUtils.getClassesOfType(Config.class, Arrays.asList(config.getClass().getInterfaces())) ) {

            for (final Method propertyMethod : classInterface.getDeclaredMethods()) {

                String propertyName = propertyMethod.getName();

                final Config.Key key = propertyMethod.getAnnotation(Config.Key.class);
                if (key != null) {
                    propertyName = key.value();
                }

                try {
                    if ( onlySystemProperties ) {
                        if ( propertyMethod.isAnnotationPresent(SystemProperty.class) ) {
                            configMap.put(propertyName, propertyMethod.invoke(config));
                        }
                    }
                    else {
                        configMap.put(propertyName, propertyMethod.invoke(config));
                    }
                } catch (final IllegalAccessException ex) {
                    throw new KmerWeaverException("Could not access the config getter: " +
                            config.getClass().getSimpleName() + "." +
                            propertyMethod.getName(), ex);

                } catch (final InvocationTargetException ex) {
                    throw new KmerWeaverException("Could not invoke the config getter: " +
                            config.getClass().getSimpleName() + "." +
                            propertyMethod.getName(), ex);
                }
            }
        }

        return configMap;
    }
}
