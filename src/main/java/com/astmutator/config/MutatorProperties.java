package com.astmutator.config;

import com.astmutator.mutation.TraversalOrder;
import com.astmutator.mutation.operators.OperatorKind;
import com.github.javaparser.ParserConfiguration.LanguageLevel;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ConfigurationProperties("astmutator")
public class MutatorProperties {
    /** Operators to run, in order. Empty selects all of them. */
    private List<OperatorKind> operators = new ArrayList<>();
    private TraversalOrder traversalOrder = TraversalOrder.PRE_ORDER;
    private LanguageLevel languageLevel = LanguageLevel.JAVA_17;
    /** Where mutant sources are written; nothing is written when unset. */
    private String outputDir;
    /** JSON report destination; no report when unset. */
    private String reportFile;
    /** Stop after this many mutants per file, 0 for no limit. */
    private int maxMutations = 0;
    private boolean printDiffs = true;
}
