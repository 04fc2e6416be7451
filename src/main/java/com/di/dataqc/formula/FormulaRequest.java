package com.di.dataqc.formula;

import com.di.dataqc.reconcile.NamedDataset;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * {@code source1.column1 <operation> source2.column2}, stored under {@code resultName}.
 */
@Value
@Builder
public class FormulaRequest {

    NamedDataset source1;

    NamedDataset source2;

    String column1;

    String column2;

    FormulaOperation operation;

    @Builder.Default
    String resultName = "Calculated";

    @Builder.Default
    MatchBy matchBy = MatchBy.INDEX;

    @Builder.Default
    List<String> keyColumns = List.of();
}
