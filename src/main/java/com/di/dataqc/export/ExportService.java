package com.di.dataqc.export;

import com.di.dataqc.aspect.LogOperation;
import com.di.dataqc.exception.RuleConfigurationException;
import com.di.dataqc.store.ResultStore;
import com.di.dataqc.store.StoredResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Looks up a stored result, shapes it and renders it in the requested format.
 */
@Slf4j
@Service
public class ExportService {

    private final ResultStore resultStore;
    private final ExportShaper shaper;
    private final Map<String, ExportRenderer> renderers = new TreeMap<>();

    public ExportService(ResultStore resultStore, ExportShaper shaper, List<ExportRenderer> renderers) {
        this.resultStore = resultStore;
        this.shaper = shaper;
        for (ExportRenderer renderer : renderers) {
            if (this.renderers.put(renderer.format(), renderer) != null) {
                throw new IllegalStateException("Duplicate export format: " + renderer.format());
            }
        }
        log.info("[EXPORT] Formats available: {}", this.renderers.keySet());
    }

    @LogOperation(eventType = "EXPORT", parameterNames = {"format", "resultId", "includeFailedRows"})
    public ExportFile export(String format, String resultId, boolean includeFailedRows) {
        ExportRenderer renderer = renderers.get(format == null ? "" : format.trim().toLowerCase(Locale.ROOT));
        if (renderer == null) {
            throw new RuleConfigurationException(String.format(
                    "Unsupported export format: %s. Supported: %s", format, renderers.keySet()));
        }
        if (resultId == null || resultId.isBlank()) {
            throw new RuleConfigurationException("result_id is required");
        }
        StoredResult result = resultStore.getRequired(resultId);
        ExportData data = shaper.shape(result, includeFailedRows);
        byte[] content = renderer.render(data);
        String filename = "qc_results_" + resultId.substring(0, Math.min(8, resultId.length()))
                + "." + renderer.fileExtension();
        log.info("[EXPORT] Rendered {} result {} as {} ({} bytes)", result.getType().id(), resultId,
                renderer.format(), content.length);
        return new ExportFile(filename, renderer.contentType(), content);
    }

    public List<String> formats() {
        return List.copyOf(renderers.keySet());
    }
}
