package org.kmerweaver.cmdline;

import com.google.common.annotations.VisibleForTesting;
import htsjdk.samtools.metrics.Header;
import htsjdk.samtools.metrics.MetricBase;
import htsjdk.samtools.metrics.MetricsFile;
import htsjdk.samtools.metrics.StringHeader;
import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.barclay.argparser.*;
import org.kmerweaver.utils.LoggingUtils;
import org.kmerweaver.utils.Utils;
import org.kmerweaver.utils.config.ConfigFactory;
import org.kmerweaver.utils.runtime.RuntimeUtils;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.text.DecimalFormat;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.*;
import java.util.jar.Attributes;
import java.util.jar.Manifest;
import java.util.stream.Collectors;

/**
 * Abstract class to facilitate writing command-line programs.
 *
 * To use:
 *
 * 1. Extend this class with a concrete class that has data members annotated with @Argument, @PositionalArguments
 * and/or @ArgumentCollection annotations.
 *
 * 2. If there is any custom command-line validation, override customCommandLineValidation().  When this method is
 * called, the command line has been parsed and set into the data members of the concrete class.
 *
 * 3. Implement a method doWork().  This is called after successful command-line processing.
 * The doWork() method may return null or a result object (they are not interpreted by the toolkit and passed onto the caller).
 * doWork() may throw unchecked exceptions, which are NOT caught and passed onto the VM.
 *
 */
public abstract class CommandLineProgram {

    // Logger is a protected instance variable here to output the correct class name
    // with concrete sub-classes of CommandLineProgram.
    protected final Logger logger = LogManager.getLogger(this.getClass());

    @ArgumentCollection(doc="Special Arguments that have meaning to the argument parsing system.  " +
            "It is unlikely these will ever need to be accessed by the command line program")
    public SpecialArgumentsCollection specialArgumentsCollection = new SpecialArgumentsCollection();

    @Argument(fullName = StandardArgumentDefinitions.VERBOSITY_NAME, shortName = StandardArgumentDefinitions.VERBOSITY_NAME, doc = "Control verbosity of logging.", common = true, optional = true)
    public Log.LogLevel VERBOSITY = Log.LogLevel.INFO;

    @Argument(fullName = StandardArgumentDefinitions.QUIET_NAME, doc = "Whether to suppress job-summary info on System.err.", common=true)
    public Boolean QUIET = false;

    // Parsed out in Main before any program is instantiated, since program defaults may
    // be read from the configuration. Declared here so it is documented and accepted.
    @Argument(fullName = StandardArgumentDefinitions.KMERWEAVER_CONFIG_FILE_OPTION,
              doc = "A configuration file to use with KmerWeaver.",
                common = true,
                optional = true)
    public String KMERWEAVER_CONFIG_FILE = null;

    private CommandLineParser commandLineParser;

    private final List<Header> defaultHeaders = new ArrayList<>();

    /**
     * The reconstructed commandline used to run this program. Used for logging
     * and debugging.
     */
    private String commandLine;

    /**
     * Perform initialization/setup after command-line argument parsing but before doWork() is invoked.
     * Default implementation does nothing.
     */
    protected void onStartup() {}

    /**
     * Do the work after command line has been parsed. RuntimeException may be
     * thrown by this method, and are reported appropriately.
     * @return the return value or null is there is none.
     */
    protected abstract Object doWork();

    /**
     * Perform cleanup after doWork() is finished. Always executes even if an exception is thrown during the run.
     * Default implementation does nothing.
     */
    protected void onShutdown() {}

    /**
     * Template method that runs the startup hook, doWork and then the shutdown hook.
     */
    public final Object runTool(){
        try {
            logger.debug("Initializing " + getClass().getSimpleName());
            onStartup();
            return doWork();
        } finally {
            logger.debug("Shutting down " + getClass().getSimpleName());
            onShutdown();
        }
    }

    public Object instanceMainPostParseArgs() {
        // Build the default headers
        final ZonedDateTime startDateTime = ZonedDateTime.now();
        this.defaultHeaders.add(new StringHeader(commandLine));
        this.defaultHeaders.add(new StringHeader("Started on: " + Utils.getDateTimeForDisplay(startDateTime)));

        LoggingUtils.setLoggingLevel(VERBOSITY);  // propagate the VERBOSITY level to logging frameworks

        if (!QUIET) {
            printStartupMessage(startDateTime);
        }

        try {
            return runTool();
        } finally {
            // Emit the time even if program throws
            if (!QUIET) {
                final ZonedDateTime endDateTime = ZonedDateTime.now();
                final double elapsedMinutes = (Duration.between(startDateTime, endDateTime).toMillis()) / (1000d * 60d);
                final String elapsedString  = new DecimalFormat("#,##0.00").format(elapsedMinutes);
                System.err.println("[" + Utils.getDateTimeForDisplay(endDateTime) + "] " +
                        getClass().getName() + " done. Elapsed time: " + elapsedString + " minutes.");
                System.err.println("Runtime.totalMemory()=" + Runtime.getRuntime().totalMemory());
            }
        }
    }

    public Object instanceMain(final String[] argv) {
        if (!parseArgs(argv)) {
            //an information only argument like help or version was specified, just exit
            return 0;
        }
        return instanceMainPostParseArgs();
    }

    /**
     * Put any custom command-line validation in an override of this method.
     * Any arguments set by command-line parser can be validated.
     * @return null if command line is valid.  If command line is invalid, returns an array of error message
     * to be written to the appropriate place.
     * @throws CommandLineException if command line is invalid and handling as exception is preferred.
     */
    protected String[] customCommandLineValidation() {
        return null;
    }

    /**
     * Parse arguments and initialize any values annotated with {@link Argument}
     * @return true if program should be executed, false if an information only argument like {@link SpecialArgumentsCollection#HELP_FULLNAME} was specified
     * @throws CommandLineException if command line validation fails
     */
    protected final boolean parseArgs(final String[] argv) {

        final boolean ret = getCommandLineParser().parseArguments(System.err, argv);
        commandLine = getCommandLineParser().getCommandLine();
        if (!ret) {
            return false;
        }
        final String[] customErrorMessages = customCommandLineValidation();
        if (customErrorMessages != null) {
            throw new CommandLineException("Command Line Validation failed:" + Arrays.stream(customErrorMessages).collect(
                    Collectors.joining(", ")));
        }
        return true;

    }

    /** Gets a MetricsFile with default headers already written into it. */
    protected <A extends MetricBase,B extends Comparable<?>> MetricsFile<A,B> getMetricsFile() {
        final MetricsFile<A,B> file = new MetricsFile<>();
        for (final Header h : this.defaultHeaders) {
            file.addHeader(h);
        }

        return file;
    }

    /**
     * Prints a user-friendly message on startup with some information about who we are and the
     * runtime environment.
     *
     * May be overridden by subclasses to provide a custom implementation if desired.
     *
     * @param startDateTime Startup date/time
     */
    protected void printStartupMessage(final ZonedDateTime startDateTime) {
        logger.info(Utils.dupChar('-', 60));
        logger.info(String.format("%s v%s", getToolkitName(), getVersion()));
        logger.info(String.format("Executing as %s@%s on %s v%s %s",
                System.getProperty("user.name"), getHostName(),
                System.getProperty("os.name"), System.getProperty("os.version"), System.getProperty("os.arch")));
        logger.info(String.format("Java runtime: %s v%s",
                System.getProperty("java.vm.name"), System.getProperty("java.runtime.version")));
        logger.info("Start Date/Time: " + Utils.getDateTimeForDisplay(startDateTime));
        logger.info(Utils.dupChar('-', 60));

        printLibraryVersions();

        printSettings();
    }

    private static String getHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (final UnknownHostException e) {
            return "unknown-host";
        }
    }

    /**
     * @return The name of this toolkit. The default implementation uses "Implementation-Title" from the
     *         jar manifest, or (if that's not available) the package name.
     */
    protected String getToolkitName() {
        return RuntimeUtils.getToolkitName(this.getClass());
    }

    /**
     * @return the version of this tool. It is the version stored in the manifest of the jarfile
     *          by default, or "Unavailable" if that's not available.
     */
    public String getVersion() {
       return RuntimeUtils.getVersion(this.getClass());
    }

    /**
     * Output versions of important dependencies to the logger.
     */
    protected void printLibraryVersions() {
        final Manifest manifest = RuntimeUtils.getManifest(this.getClass());
        if( manifest != null ){
                final Attributes manifestAttributes = manifest.getMainAttributes();
                final String htsjdkVersion = manifestAttributes.getValue("htsjdk-Version");
                logger.info("HTSJDK Version: " + (htsjdkVersion != null ? htsjdkVersion : "unknown"));
        }
    }

    /**
     * Output a curated set of important settings to the logger.
     *
     * May be overridden by subclasses to specify a different set of settings to output.
     */
    protected void printSettings() {
        ConfigFactory.logConfigFields(ConfigFactory.getInstance().getKmerWeaverConfig(), Log.LogLevel.DEBUG);
    }

    /**
     * @return the commandline used to run this program, will be null if arguments have not yet been parsed
     */
    public final String getCommandLine() {
        return commandLine;
    }

    /**
     * @return get usage and help information for this command line program if it is available
     *
     */
    public final String getUsage(){
        return getCommandLineParser().usage(true, specialArgumentsCollection.SHOW_HIDDEN);
    }

    /**
     * @return this programs CommandLineParser.  If one is not initialized yet this will initialize it.
     */
    @VisibleForTesting
    public final CommandLineParser getCommandLineParser() {
        if( commandLineParser == null) {
            commandLineParser = new CommandLineArgumentParser(this, Collections.emptyList(), Collections.emptySet());
        }
        return commandLineParser;
    }
}
