package com.defaultrisk.infrastructure.dataset;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Tabular file formats accepted for upload, recognised by file extension.
 */
public enum DatasetFormat {

    CSV(Set.of(".csv")),
    EXCEL(Set.of(".xlsx", ".xls"));

    private final Set<String> extensions;

    DatasetFormat(Set<String> extensions) {
        this.extensions = extensions;
    }

    public static Optional<DatasetFormat> fromFilename(String filename) {
        String extension = extensionOf(filename);
        return Arrays.stream(values())
                .filter(f -> f.extensions.contains(extension))
                .findFirst();
    }

    static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        int dot = filename.lastIndexOf('.');
        return dot < 0 ? "" : filename.substring(dot).toLowerCase(Locale.ROOT);
    }
}
