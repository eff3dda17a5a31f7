package org.kmerweaver.utils.config;

import org.aeonbits.owner.Accessible;
import org.aeonbits.owner.Mutable;
import org.aeonbits.owner.Config.LoadPolicy;
import org.aeonbits.owner.Config.LoadType;
import org.aeonbits.owner.Config.Sources;

/**
 * Configuration file for KmerWeaver options.
 * All specified {@code Sources} will be loaded.
 * The {@link LoadPolicy} is set to {@link LoadType#MERGE}: an option missing from the first source is sought in
 * each following source in declaration order, falling back to the value given by @DefaultValue.
 *
 * The load order is:
 *        1)   "file:${" + KmerWeaverConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
 *        2)   "classpath:${" + KmerWeaverConfig.CONFIG_FILE_VARIABLE_CLASS_PATH + "}",
 *        3)   "file:KmerWeaverConfig.properties",
 *        4)   "classpath:org/kmerweaver/utils/config/KmerWeaverConfig.properties"
 *        5)   hard-coded values specified by @DefaultValue
 */
@LoadPolicy(LoadType.MERGE)
@Sources({
        "file:${" + KmerWeaverConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
        "classpath:${" + KmerWeaverConfig.CONFIG_FILE_VARIABLE_CLASS_PATH + "}",
        "file:KmerWeaverConfig.properties",
        "classpath:org/kmerweaver/utils/config/KmerWeaverConfig.properties"
})
public interface KmerWeaverConfig extends Mutable, Accessible {

    /**
     * Name of the configuration file variable used in the {@link Sources} annotation to locate a configuration
     * file on disk.
     */
    String CONFIG_FILE_VARIABLE_FILE_NAME = "KmerWeaverConfig.pathToKmerWeaverConfig";

    /**
     * Name of the configuration file variable used in the {@link Sources} annotation to locate a configuration
     * file on the class path.
     */
    String CONFIG_FILE_VARIABLE_CLASS_PATH = "KmerWeaverConfig.classPathToKmerWeaverConfig";

    // ----------------------------------------------------------
    // Miscellaneous Options:
    // ----------------------------------------------------------

    @SystemProperty
    @Key("kmerweaver_stacktrace_on_user_exception")
    @DefaultValue("false")
    boolean kmerweaver_stacktrace_on_user_exception();

    // ----------------------------------------------------------
    // K-mer input Options:
    // ----------------------------------------------------------

    /**
     * Separator between k-mers in an input file, used when the tool is not given one explicitly.
     */
    @Key("kmer_delimiter")
    @DefaultValue(",")
    String kmer_delimiter();

    /**
     * Whether whitespace around each individual k-mer is removed after splitting.
     */
    @Key("trim_kmer_whitespace")
    @DefaultValue("false")
    boolean trim_kmer_whitespace();
}
