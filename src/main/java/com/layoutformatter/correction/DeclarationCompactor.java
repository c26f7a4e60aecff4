package com.layoutformatter.correction;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import com.layoutformatter.api.AppliedCorrection;
import com.layoutformatter.api.CorrectionPass;
import com.layoutformatter.config.FormatterConfig;
import com.layoutformatter.sidetable.SideTables;
import com.layoutformatter.util.LoggerUtil;

/**
 * Removes the blank line canonical layout puts between two one-line definitions that
 * were written on adjacent source lines. Deletes whole lines, so it runs last.
 */
public class DeclarationCompactor implements CorrectionPass {
    private static final Logger logger = LoggerUtil.getLogger(DeclarationCompactor.class);

    @Override
    public void initialize(FormatterConfig config) {
        // only the enabled flag, checked by the formatter
    }

    @Override
    public String getName() {
        return FormatterConfig.COMPACTION;
    }

    @Override
    public List<AppliedCorrection> apply(LineBuffer buffer, SideTables sideTables) {
        List<InlineDeclaration> declarations = sideTables.getInlineDeclarations();
        List<AppliedCorrection> corrections = new ArrayList<>();

        for (InlineDeclaration declaration : declarations) {
            buffer.requireLine(declaration.getRenderedLine(), declaration);
        }

        // bottom up, so a deletion never moves a line still to be checked
        for (int i = declarations.size() - 1; i > 0; i--) {
            InlineDeclaration after = declarations.get(i);
            InlineDeclaration before = declarations.get(i - 1);

            int gap = before.getRenderedLine() + 1;
            if (before.getRenderedLine() + 2 == after.getRenderedLine()
                    && before.getOriginalSourceLine() + 1 == after.getOriginalSourceLine()
                    && buffer.isBlank(gap)) {
                buffer.deleteLine(gap);
                corrections.add(new AppliedCorrection("compact-declarations", before.getRenderedLine(),
                        after.getRenderedLine(), "Removed blank line between adjacent one-line definitions"));
            }
        }

        if (!corrections.isEmpty()) {
            logger.fine("Removed " + corrections.size() + " blank lines between one-line definitions");
        }
        sideTables.clearInlineDeclarations();
        return corrections;
    }
}
