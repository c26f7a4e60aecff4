package com.layoutformatter.api;

import java.util.List;

import com.layoutformatter.config.FormatterConfig;
import com.layoutformatter.correction.LineBuffer;
import com.layoutformatter.sidetable.SideTables;

/**
 * A rewrite applied to already rendered text, driven by records collected during translation.
 */
public interface CorrectionPass {
    /**
     * Initialize the pass with the configuration.
     */
    void initialize(FormatterConfig config);

    /**
     * Rewrites {@code buffer} in place and reports what changed.
     */
    List<AppliedCorrection> apply(LineBuffer buffer, SideTables sideTables);

    String getName();
}
