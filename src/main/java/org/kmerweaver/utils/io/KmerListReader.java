package org.kmerweaver.utils.io;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.kmerweaver.exceptions.UserException;
import org.kmerweaver.utils.Utils;
import org.kmerweaver.utils.config.ConfigFactory;
import org.kmerweaver.utils.config.KmerWeaverConfig;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Reads a list of k-mers separated by a delimiter from a text file, gzipped if its name ends with ".gz".
 *
 * The whole file is read at once and trimmed of surrounding whitespace before it is split, so a trailing
 * newline does not create a token. Every token between delimiters is kept, empty ones included, so that a
 * doubled delimiter is reported by k-mer validation instead of being silently dropped. A file holding only
 * whitespace yields no k-mers.
 */
public final class KmerListReader {
    private static final Logger logger = LogManager.getLogger(KmerListReader.class);

    private final String delimiter;
    private final boolean trimEachKmer;

    /**
     * Creates a reader using the delimiter and trimming behavior from the {@link KmerWeaverConfig}.
     */
    public KmerListReader() {
        this(ConfigFactory.getInstance().getKmerWeaverConfig());
    }

    public KmerListReader(final KmerWeaverConfig config) {
        this(Utils.nonNull(config, "config").kmer_delimiter(), config.trim_kmer_whitespace());
    }

    /**
     * @param delimiter separator between k-mers; may not be empty
     * @param trimEachKmer whether to also strip whitespace around each k-mer after splitting
     */
    public KmerListReader(final String delimiter, final boolean trimEachKmer) {
        this.delimiter = Utils.nonEmpty(delimiter, "The k-mer delimiter may not be empty");
        this.trimEachKmer = trimEachKmer;
    }

    public String getDelimiter() {
        return delimiter;
    }

    public boolean isTrimEachKmer() {
        return trimEachKmer;
    }

    /**
     * @throws UserException.CouldNotReadInputFile if the file doesn't exist or can't be read
     */
    public List<String> readKmers(final Path path) {
        IOUtils.assertFileIsReadable(path);
        final String content;
        try ( final Reader reader = IOUtils.makeReaderMaybeGzipped(path) ) {
            content = org.apache.commons.io.IOUtils.toString(reader);
        } catch ( final IOException e ) {
            throw new UserException.CouldNotReadInputFile(path, e);
        }
        final List<String> kmers = parseKmers(content);
        logger.info(String.format("Read %d k-mers from %s", kmers.size(), path));
        return kmers;
    }

    /**
     * Splits {@code content} into k-mers.
     */
    public List<String> parseKmers(final String content) {
        Utils.nonNull(content, "content");
        final String trimmed = content.trim();
        if ( trimmed.isEmpty() ) {
            return Collections.emptyList();
        }
        final List<String> kmers = new ArrayList<>(
                Arrays.asList(StringUtils.splitByWholeSeparatorPreserveAllTokens(trimmed, delimiter)));
        if ( trimEachKmer ) {
            kmers.replaceAll(String::trim);
        }
        return kmers;
    }
}
