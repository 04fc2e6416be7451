package com.di.dataqc.controller;

import com.di.dataqc.compare.ComparisonOptions;
import com.di.dataqc.compare.ComparisonResult;
import com.di.dataqc.compare.DatasetComparator;
import com.di.dataqc.controller.dto.CalculateRequest;
import com.di.dataqc.controller.dto.CompareRequest;
import com.di.dataqc.controller.dto.ReconcileRequest;
import com.di.dataqc.controller.dto.ResultResponse;
import com.di.dataqc.controller.dto.RunRulesRequest;
import com.di.dataqc.formula.FormulaCalculator;
import com.di.dataqc.formula.FormulaOperation;
import com.di.dataqc.formula.FormulaRequest;
import com.di.dataqc.formula.FormulaResult;
import com.di.dataqc.formula.MatchBy;
import com.di.dataqc.reconcile.NamedDataset;
import com.di.dataqc.reconcile.ReconciliationEngine;
import com.di.dataqc.reconcile.ReconciliationRequest;
import com.di.dataqc.reconcile.ReconciliationRequestMapper;
import com.di.dataqc.reconcile.ReconciliationResult;
import com.di.dataqc.rule.RuleBatchResult;
import com.di.dataqc.rule.RuleBatchService;
import com.di.dataqc.rule.RuleDescriptor;
import com.di.dataqc.rule.RuleRegistry;
import com.di.dataqc.store.DatasetSession;
import com.di.dataqc.store.DatasetSessionStore;
import com.di.dataqc.store.ResultStore;
import com.di.dataqc.store.ResultType;
import com.di.dataqc.store.StoredResult;
import com.di.dataqc.util.QcMetrics;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rule runs, comparisons, reconciliations and formula calculations over loaded sessions.
 * Every computed result is stored and returned with its {@code result_id}.
 */
@Slf4j
@RestController
@RequestMapping("/api/qc")
@RequiredArgsConstructor
public class QcController {

    private final RuleRegistry ruleRegistry;
    private final RuleBatchService ruleBatchService;
    private final DatasetComparator comparator;
    private final ReconciliationEngine reconciliationEngine;
    private final FormulaCalculator formulaCalculator;
    private final DatasetSessionStore sessionStore;
    private final ResultStore resultStore;
    private final QcMetrics metrics;

    @GetMapping(value = "/rules", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> listRules() {
        List<RuleDescriptor> rules = ruleRegistry.listRules();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("rules", rules);
        body.put("count", rules.size());
        return ResponseEntity.ok(body);
    }

    @PostMapping(value = "/run", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ResultResponse> runRules(@Valid @RequestBody RunRulesRequest request) {
        DatasetSession session = sessionStore.getRequired(request.getSessionId());
        RuleBatchResult batch = ruleBatchService.run(session.getDataset(), request.getRules());
        return ResponseEntity.ok(store(ResultType.RULE_BATCH, List.of(session.getId()), batch));
    }

    @PostMapping(value = "/compare", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ResultResponse> compare(@Valid @RequestBody CompareRequest request) {
        DatasetSession source = sessionStore.getRequired(request.getSourceId());
        DatasetSession target = sessionStore.getRequired(request.getTargetId());
        ComparisonOptions options = ComparisonOptions.builder()
                .keyColumns(nullToEmpty(request.getKeyColumns()))
                .compareColumns(nullToEmpty(request.getCompareColumns()))
                .tolerance(request.getTolerance())
                .ignoreCase(request.isIgnoreCase())
                .ignoreWhitespace(request.isIgnoreWhitespace())
                .build();
        ComparisonResult result = comparator.compare(source.getDataset(), target.getDataset(), options);
        metrics.recordComparison();
        return ResponseEntity.ok(store(ResultType.COMPARISON, List.of(source.getId(), target.getId()), result));
    }

    @PostMapping(value = "/reconcile", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ResultResponse> reconcile(@Valid @RequestBody ReconcileRequest request) {
        List<DatasetSession> sessions = new ArrayList<>();
        for (String id : request.getSessionIds()) {
            sessions.add(sessionStore.getRequired(id));
        }
        List<String> names = ReconciliationRequestMapper.uniqueNames(
                sessions.stream().map(DatasetSession::getName).toList());
        List<NamedDataset> sources = new ArrayList<>(sessions.size());
        for (int i = 0; i < sessions.size(); i++) {
            sources.add(new NamedDataset(names.get(i), sessions.get(i).getDataset()));
        }

        ReconciliationRequest reconciliation = ReconciliationRequest.builder()
                .sources(sources)
                .keyColumns(request.getKeyColumns())
                .valueColumns(nullToEmpty(request.getValueColumns()))
                .tolerance(ReconciliationRequestMapper.tolerance(request.getTolerance()))
                .options(ReconciliationRequestMapper.options(request.getOptions()))
                .analysis(ReconciliationRequestMapper.analysis(request.getAnalysis()))
                .aggregation(ReconciliationRequestMapper.aggregation(request.getAggregation()))
                .build();
        ReconciliationResult result = reconciliationEngine.reconcile(reconciliation);
        return ResponseEntity.ok(store(ResultType.RECONCILIATION, request.getSessionIds(), result));
    }

    @PostMapping(value = "/calculate", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ResultResponse> calculate(@Valid @RequestBody CalculateRequest request) {
        DatasetSession first = sessionStore.getRequired(request.getSource1Id());
        DatasetSession second = sessionStore.getRequired(request.getSource2Id());
        FormulaRequest formula = FormulaRequest.builder()
                .source1(new NamedDataset(first.getName(), first.getDataset()))
                .source2(new NamedDataset(second.getName(), second.getDataset()))
                .column1(request.getColumn1())
                .column2(request.getColumn2())
                .operation(FormulaOperation.fromSymbol(request.getOperation()))
                .resultName(request.getResultName() == null || request.getResultName().isBlank()
                        ? "Calculated" : request.getResultName().trim())
                .matchBy(MatchBy.fromId(request.getMatchBy()))
                .keyColumns(nullToEmpty(request.getKeyColumns()))
                .build();
        FormulaResult result = formulaCalculator.calculate(formula);
        return ResponseEntity.ok(store(ResultType.FORMULA, List.of(first.getId(), second.getId()), result));
    }

    @GetMapping(value = "/results/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ResultResponse> getResult(@PathVariable("id") String id) {
        return ResponseEntity.ok(ResultResponse.of(resultStore.getRequired(id)));
    }

    // ------------------------------------------------------------------------

    private ResultResponse store(ResultType type, List<String> sourceIds, Object payload) {
        String id = resultStore.save(StoredResult.builder()
                .type(type)
                .sourceIds(List.copyOf(sourceIds))
                .payload(payload)
                .build());
        log.info("[CONTROLLER] Stored {} result {} for sources {}", type.id(), id, sourceIds);
        return ResultResponse.of(resultStore.getRequired(id));
    }

    private static List<String> nullToEmpty(List<String> values) {
        return values == null ? List.of() : values;
    }
}
