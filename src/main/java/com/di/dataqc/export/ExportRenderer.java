package com.di.dataqc.export;

/**
 * Renders {@link ExportData} into a downloadable document.
 */
public interface ExportRenderer {

    /** Format id used in the export path, e.g. {@code csv}. */
    String format();

    String contentType();

    String fileExtension();

    byte[] render(ExportData data);
}
