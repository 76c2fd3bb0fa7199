package teranet.mapdev.layout.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Utility class for validating and reading the files handed to the engine.
 * Provides reusable checks for layout, mapping and instance document paths.
 */
public class InputFileUtil {

    private static final char BOM = '\uFEFF';

    private InputFileUtil() {
        // Private constructor to prevent instantiation
    }

    /**
     * Validates that the path is set, exists, is a regular file and is not empty.
     *
     * @param path the file to validate
     * @throws IllegalArgumentException if any check fails
     */
    public static void validateFileNotEmpty(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("File is not provided");
        }
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("File does not exist or is not a regular file: " + path);
        }
        try {
            if (Files.size(path) == 0) {
                throw new IllegalArgumentException("File is empty: " + path);
            }
        } catch (IOException e) {
            throw new IllegalArgumentException("File cannot be read: " + path, e);
        }
    }

    /**
     * Validates that the file has one of the allowed extensions.
     * Supports files without extensions (pass empty string "" in allowedExtensions).
     *
     * @param path              the file to validate
     * @param allowedExtensions allowed extensions without dot, e.g. "xml", "txt"
     * @throws IllegalArgumentException if the extension is not allowed
     */
    public static void validateFileExtension(Path path, String... allowedExtensions) {
        if (path == null || path.getFileName() == null) {
            throw new IllegalArgumentException("Invalid filename");
        }
        String filename = path.getFileName().toString();
        String lowerCaseFilename = filename.toLowerCase();

        int lastDotIndex = filename.lastIndexOf('.');
        boolean hasNoExtension = lastDotIndex <= 0 || lastDotIndex == filename.length() - 1;

        boolean isValid = Arrays.stream(allowedExtensions)
                .anyMatch(ext -> {
                    if (ext == null || ext.trim().isEmpty()) {
                        return hasNoExtension;
                    }
                    return lowerCaseFilename.endsWith("." + ext.toLowerCase());
                });

        if (!isValid) {
            String allowedTypes = Arrays.stream(allowedExtensions)
                    .map(ext -> (ext == null || ext.trim().isEmpty()) ? "(no extension)" : ext.toUpperCase())
                    .reduce((a, b) -> a + ", " + b)
                    .orElse("unknown");
            throw new IllegalArgumentException(
                    String.format("Invalid file type. Expected %s file but received '%s'.", allowedTypes, filename));
        }
    }

    /**
     * Validates the file and reads it as UTF-8, dropping a leading byte order mark.
     *
     * @param path              the file to read
     * @param allowedExtensions allowed extensions, or none to accept any
     * @return the file content
     * @throws IOException if the file cannot be read
     */
    public static String readUtf8(Path path, String... allowedExtensions) throws IOException {
        validateFileNotEmpty(path);
        if (allowedExtensions.length > 0) {
            validateFileExtension(path, allowedExtensions);
        }
        return stripBom(Files.readString(path, StandardCharsets.UTF_8));
    }

    /**
     * @return the content without a leading UTF-8 byte order mark
     */
    public static String stripBom(String content) {
        if (content != null && !content.isEmpty() && content.charAt(0) == BOM) {
            return content.substring(1);
        }
        return content;
    }
}
