package org.kmerweaver.cmdline;

/**
 * A set of String constants in which the name of the constant (minus the _SHORT_NAME suffix)
 * is the standard long Option name, and the value of the constant is the standard shortName.
 */
public final class StandardArgumentDefinitions {

    private StandardArgumentDefinitions(){}

    public static final String OUTPUT_DIRECTORY_LONG_NAME = "output-directory";
    public static final String KMER_DELIMITER_LONG_NAME = "kmer-delimiter";
    public static final String LENIENT_LONG_NAME = "lenient";
    public static final String VERBOSITY_NAME = "verbosity";
    public static final String METRICS_FILE_LONG_NAME = "metrics-file";
    public static final String GRAPH_OUTPUT_LONG_NAME = "graph-output";

    public static final String OUTPUT_DIRECTORY_SHORT_NAME = "O";
    public static final String KMER_DELIMITER_SHORT_NAME = "D";
    public static final String LENIENT_SHORT_NAME = "LE";
    public static final String METRICS_FILE_SHORT_NAME = "M";
    public static final String GRAPH_OUTPUT_SHORT_NAME = "graph";

    /**
     * The option specifying a main configuration file.
     * This is used in {@link org.kmerweaver.Main} to control which config file is loaded.
     */
    public static final String KMERWEAVER_CONFIG_FILE_OPTION = "kmerweaver-config-file";

    public static final String QUIET_NAME = "QUIET";
}
