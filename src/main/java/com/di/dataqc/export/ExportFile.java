package com.di.dataqc.export;

/**
 * A rendered export ready for download.
 */
public record ExportFile(String filename, String contentType, byte[] content) {
}
