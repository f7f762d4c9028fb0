package com.eyelevel.invoicetransformer.service.file;

import org.apache.commons.io.FilenameUtils;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * The file naming conventions shared with downstream systems. These names are matched by other
 * tooling and must not change.
 */
public final class InvoiceFileNames {

    public static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    /**
     * Suffix of an output document that has been written but not yet promoted.
     */
    public static final String PART_SUFFIX = ".part";

    private InvoiceFileNames() {
    }

    public static String timestamp(final LocalDateTime time) {
        return TIMESTAMP.format(time);
    }

    /**
     * {@code {base}_Transformed_{timestamp}.xml}
     */
    public static String outputName(final String sourceFileName, final String timestamp) {
        return FilenameUtils.getBaseName(sourceFileName) + "_Transformed_" + timestamp + ".xml";
    }

    /**
     * {@code {base}_{timestamp}{ext}}
     */
    public static String archiveName(final String sourceFileName, final String timestamp) {
        return FilenameUtils.getBaseName(sourceFileName) + "_" + timestamp + dottedExtension(sourceFileName);
    }

    /**
     * {@code {base}_{timestamp}_ERROR{ext}}
     */
    public static String errorName(final String sourceFileName, final String timestamp) {
        return FilenameUtils.getBaseName(sourceFileName) + "_" + timestamp + "_ERROR" + dottedExtension(sourceFileName);
    }

    /**
     * The diagnostic text file written next to a quarantined file: same base name, {@code .txt}.
     */
    public static String sidecarName(final String errorFileName) {
        return FilenameUtils.getBaseName(errorFileName) + ".txt";
    }

    private static String dottedExtension(final String fileName) {
        final String extension = FilenameUtils.getExtension(fileName);
        return extension.isEmpty() ? "" : "." + extension;
    }
}
