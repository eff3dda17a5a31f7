package org.kmerweaver.utils.io;

import htsjdk.samtools.util.BlockCompressedInputStream;
import org.apache.commons.io.FileUtils;
import org.kmerweaver.exceptions.UserException;
import org.kmerweaver.utils.Utils;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;

public final class IOUtils {

    private IOUtils(){}

    /**
     * Creates a temp directory with the given prefix.
     *
     * The directory and any contents will be automatically deleted at shutdown.
     *
     * @param prefix       Prefix for the directory name.
     * @return The created temporary directory.
     */
    public static File createTempDir(String prefix) {
        try {
            final File tmpDir = Files.createTempDirectory(prefix).normalize().toFile();
            FileUtils.forceDeleteOnExit(tmpDir);
            return tmpDir;
        } catch (final IOException | SecurityException e) {
            throw new UserException.BadTempDir(e.getMessage(), e);
        }
    }

    /**
     * Writes content to a temp file and returns the path to the temporary file.
     *
     * @param content   to write.
     * @param prefix    Prefix for the temp file.
     * @param suffix    Suffix for the temp file.
     * @return the path to the temp file.
     */
    public static File writeTempFile(String content, String prefix, String suffix) {
        try {
            final File tempFile = File.createTempFile(prefix, suffix).toPath().normalize().toFile();
            tempFile.deleteOnExit();
            FileUtils.writeStringToFile(tempFile, content, StandardCharsets.UTF_8);
            return tempFile;
        } catch (IOException e) {
            throw new UserException.BadTempDir(e.getMessage(), e);
        }
    }

    /**
     * makes a reader for a path, unzipping if the file's name ends with '.gz'
     * @param path the file to read
     * @return a reader over the (possibly decompressed) contents
     */
    public static Reader makeReaderMaybeGzipped(Path path) throws IOException {
        final InputStream in = new BufferedInputStream(Files.newInputStream(path));
        // toString because path.endsWith only checks whole path components, not substrings.
        return makeReaderMaybeGzipped(in, path.toString().endsWith(".gz"));
    }

    /**
     * makes a reader for an inputStream wrapping it in an appropriate unzipper if necessary
     * @param zipped is this stream zipped
     */
    public static Reader makeReaderMaybeGzipped(InputStream in, boolean zipped) throws IOException {
        if (zipped) {
            return new InputStreamReader(makeZippedInputStream(in), StandardCharsets.UTF_8);
        } else {
            return new InputStreamReader(in, StandardCharsets.UTF_8);
        }
    }

    /**
     * creates an input stream from a zipped stream
     * @return tries to create a block gzipped input stream and if it's not block gzipped it produces to a gzipped stream instead
     * @throws java.util.zip.ZipException if !in.markSupported()
     */
    public static InputStream makeZippedInputStream(InputStream in) throws IOException {
        Utils.nonNull(in);
        if (BlockCompressedInputStream.isValidFile(in)) {
            return new BlockCompressedInputStream(in);
        } else {
            return new GZIPInputStream(in);
        }
    }

    /**
     * Checks that a path is a regular, readable file.
     *
     * @throws UserException.CouldNotReadInputFile if it does not exist, is not a regular file or cannot be read
     */
    public static void assertFileIsReadable(final Path path) {
        Utils.nonNull(path);

        if ( ! Files.exists(path) ) {
            throw new UserException.CouldNotReadInputFile(path, "It doesn't exist.");
        }
        if ( ! Files.isRegularFile(path) ) {
            throw new UserException.CouldNotReadInputFile(path, "It isn't a regular file");
        }
        if ( ! Files.isReadable(path) ) {
            throw new UserException.CouldNotReadInputFile(path, "It is not readable, check the file permissions");
        }
    }

    /**
     * Writes {@code content} to {@code path} exactly as given, replacing any existing file. Parent directories are
     * created if necessary.
     *
     * @throws UserException.CouldNotCreateOutputFile if the file cannot be written
     */
    public static void writeStringToPath(final Path path, final String content) {
        Utils.nonNull(path);
        Utils.nonNull(content);
        try {
            FileUtils.writeStringToFile(path.toFile(), content, StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(path, e);
        }
    }
}
