package com.actionplan.taskimport.util;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import org.apache.poi.openxml4j.opc.OPCPackage;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.util.IOUtils;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

/**
 * Secure utilities for workbook handling.
 * Provides protection against disguised files, zip bombs and formula injection.
 */
public final class SecureExcelUtils {

    // Maximum size for byte array allocation (200 MB)
    private static final int MAX_BYTE_ARRAY_SIZE = 200_000_000;

    // XLSX magic bytes (ZIP format: PK)
    private static final byte[] XLSX_MAGIC = {0x50, 0x4B, 0x03, 0x04};

    static {
        // Configure Apache POI security limits globally
        IOUtils.setByteArrayMaxOverride(MAX_BYTE_ARRAY_SIZE);
    }

    private SecureExcelUtils() {
        // Utility class
    }

    /**
     * Opens an in-memory .xlsx workbook with security protections enabled.
     * POI's zip handling rejects archives whose inflate ratio looks like a zip bomb.
     *
     * @param bytes the complete workbook content
     * @return a Workbook instance; the caller closes it
     * @throws IOException if the content cannot be parsed as a workbook
     * @throws SecurityException if the content is not a zip container
     */
    public static Workbook openWorkbook(byte[] bytes) throws IOException {
        validateContent(bytes);

        try {
            OPCPackage pkg = OPCPackage.open(new ByteArrayInputStream(bytes));
            return new XSSFWorkbook(pkg);
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException("Failed to open XLSX content securely: " + e.getMessage(), e);
        }
    }

    /**
     * Validates that the content starts with the zip signature every .xlsx file carries.
     *
     * @param bytes the content to validate
     * @throws SecurityException if the content is too small or does not match the XLSX format
     */
    public static void validateContent(byte[] bytes) {
        if (bytes == null || bytes.length < XLSX_MAGIC.length) {
            throw new SecurityException("File is too small to be a valid Excel file");
        }
        if (!matchesMagicBytes(bytes, XLSX_MAGIC)) {
            throw new SecurityException(
                "File content does not match XLSX format. " +
                "The file may be corrupted or disguised.");
        }
    }

    /**
     * Sanitizes a filename to prevent path traversal attacks.
     * Removes directory components and dangerous characters.
     *
     * @param originalFilename the original filename from user input
     * @return a sanitized filename safe for display and logging
     * @throws IllegalArgumentException if the filename is null, empty, or not an .xlsx name
     */
    public static String sanitizeFilename(String originalFilename) {
        if (originalFilename == null || originalFilename.isBlank()) {
            throw new IllegalArgumentException("Filename cannot be null or empty");
        }

        String filename = originalFilename;

        // Handle both Unix and Windows path separators
        int lastSlash = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        if (lastSlash >= 0) {
            filename = filename.substring(lastSlash + 1);
        }

        // Remove null bytes and other control characters
        filename = filename.replaceAll("[\\x00-\\x1F\\x7F]", "");

        // Allow only alphanumeric (including Latin accented letters), dots, hyphens, underscores and spaces
        filename = filename.replaceAll("[^a-zA-Z0-9.\\-_\\s\\u00C0-\\u00FF]", "_");

        // Prevent multiple consecutive dots (e.g., ".." for path traversal)
        filename = filename.replaceAll("\\.{2,}", ".");

        // Remove leading/trailing dots and spaces
        filename = filename.replaceAll("^[.\\s]+|[.\\s]+$", "");

        if (filename.isBlank()) {
            throw new IllegalArgumentException("Filename is invalid after sanitization");
        }

        if (!filename.toLowerCase().endsWith(".xlsx")) {
            throw new IllegalArgumentException("Invalid file extension. Only .xlsx files are supported");
        }

        return filename;
    }

    /**
     * Whether Excel would interpret a cell starting with this value as a formula.
     * Such cells must be written with a quote-prefixed style so they stay plain text.
     *
     * @param value the cell text
     * @return true if the first character can start a formula
     */
    public static boolean needsFormulaGuard(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }

        char firstChar = value.charAt(0);
        return firstChar == '=' || firstChar == '+' || firstChar == '-' ||
            firstChar == '@' || firstChar == '\t' || firstChar == '\r' || firstChar == '\n';
    }

    private static boolean matchesMagicBytes(byte[] header, byte[] magic) {
        if (header.length < magic.length) {
            return false;
        }
        for (int i = 0; i < magic.length; i++) {
            if (header[i] != magic[i]) {
                return false;
            }
        }
        return true;
    }
}
