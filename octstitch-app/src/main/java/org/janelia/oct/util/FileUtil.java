package org.janelia.oct.util;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.janelia.oct.json.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared file management utilities.
 *
 * @author Eric Trautman
 */
public class FileUtil {

    public static final FileUtil DEFAULT_INSTANCE = new FileUtil();

    /** Suffix of files that are still being written. */
    public static final String IN_PROGRESS_SUFFIX = ".tmp";

    private final int bufferSize;

    public FileUtil() {
        this.bufferSize = DEFAULT_BUFFER_SIZE;
    }

    public Reader getExtensionBasedReader(final String fullPathName)
            throws IOException {

        final InputStream inputStream;

        if (fullPathName.endsWith(".gz")) {
            inputStream = new GZIPInputStream(new FileInputStream(fullPathName));
        } else {
            inputStream = new BufferedInputStream(new FileInputStream(fullPathName), bufferSize);
        }

        return new InputStreamReader(inputStream, StandardCharsets.UTF_8);
    }

    public Writer getExtensionBasedWriter(final String fullPathName)
            throws IOException {

        final OutputStream outputStream;

        if (fullPathName.endsWith(".gz")) {
            outputStream = new GZIPOutputStream(new FileOutputStream(fullPathName));
        } else {
            outputStream = new BufferedOutputStream(new FileOutputStream(fullPathName), bufferSize);
        }

        return new OutputStreamWriter(outputStream, StandardCharsets.UTF_8);
    }

    public static void saveJsonFile(final String path,
                                    final Object data)
            throws IOException {
        saveJsonFile(path, data, JsonUtils.MAPPER);
    }

    /**
     * Writes the data to a temporary sibling file and then moves it into place
     * so that readers never see a partially written file.
     */
    public static void saveJsonFile(final String path,
                                    final Object data,
                                    final ObjectMapper mapper)
            throws IOException {

        final Path toPath = new File(path).toPath().toAbsolutePath();
        final Path inProgressPath = toPath.resolveSibling(toPath.getFileName() + IN_PROGRESS_SUFFIX);

        try (final Writer writer = DEFAULT_INSTANCE.getExtensionBasedWriter(inProgressPath.toString())) {
            mapper.writeValue(writer, data);
        } catch (final Throwable t) {
            throw new IOException("failed to write " + inProgressPath, t);
        }

        Files.move(inProgressPath, toPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

        LOG.debug("saveJsonFile: exit, wrote data to {}", toPath);
    }

    public static void ensureWritableDirectory(final File directory) {
        // try twice to work around concurrent access issues
        if (! directory.exists()) {
            if (! directory.mkdirs()) {
                if (! directory.exists()) {
                    // last try
                    if (! directory.mkdirs()) {
                        if (! directory.exists()) {
                            throw new IllegalArgumentException("failed to create " + directory);
                        }
                    }
                }
            }
        }
        if (! directory.canWrite()) {
            throw new IllegalArgumentException("not allowed to write to " + directory);
        }
    }

    public static boolean deleteRecursive(final File file) {

        boolean deleteSuccessful = true;

        if (file.isDirectory()){
            final File[] files = file.listFiles();
            if (files != null) {
                for (final File f : files) {
                    deleteSuccessful = deleteSuccessful && deleteRecursive(f);
                }
            }
        }

        if (file.delete()) {
            LOG.info("deleted " + file.getAbsolutePath());
        } else {
            LOG.warn("failed to delete " + file.getAbsolutePath());
            deleteSuccessful = false;
        }

        return deleteSuccessful;
    }

    private static final Logger LOG = LoggerFactory.getLogger(FileUtil.class);

    private static final int DEFAULT_BUFFER_SIZE = 65536;

}
