package com.di.dataqc.controller.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response for POST /api/data/upload: one entry per file, successful or not.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadResponse {

    /** True when at least one file was loaded. */
    private boolean success;
    private List<FileResult> sources;
    private int totalFiles;
    private int successfulCount;
    private int failedCount;

    public static UploadResponse of(List<FileResult> results) {
        int successful = (int) results.stream().filter(FileResult::isSuccess).count();
        return UploadResponse.builder()
                .success(successful > 0)
                .sources(results)
                .totalFiles(results.size())
                .successfulCount(successful)
                .failedCount(results.size() - successful)
                .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FileResult {
        private String filename;
        private boolean success;
        /** Set when {@code success} is false. */
        private String error;
        /** Set when {@code success} is true. */
        private SourceSummary source;

        public static FileResult failed(String filename, String error) {
            return FileResult.builder().filename(filename).success(false).error(error).build();
        }

        public static FileResult loaded(String filename, SourceSummary source) {
            return FileResult.builder().filename(filename).success(true).source(source).build();
        }
    }
}
