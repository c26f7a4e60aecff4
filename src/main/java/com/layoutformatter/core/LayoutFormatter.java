package com.layoutformatter.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntPredicate;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.layoutformatter.api.AppliedCorrection;
import com.layoutformatter.api.CorrectionPass;
import com.layoutformatter.api.DocumentFormatter;
import com.layoutformatter.api.FormatterResult;
import com.layoutformatter.api.error.FormatterBugException;
import com.layoutformatter.api.error.FormatterError;
import com.layoutformatter.api.error.Severity;
import com.layoutformatter.config.FormatterConfig;
import com.layoutformatter.correction.CallShapeCorrector;
import com.layoutformatter.correction.DeclarationCompactor;
import com.layoutformatter.correction.LineBuffer;
import com.layoutformatter.doc.Doc;
import com.layoutformatter.ledger.AlignmentCorrector;
import com.layoutformatter.sidetable.SideTables;
import com.layoutformatter.sidetable.TranslatedDocument;
import com.layoutformatter.util.LoggerUtil;

/**
 * Renders translated documents and runs the correction passes over the rendered text in
 * their fixed order: alignment, call shapes, declaration compaction. The last one deletes
 * lines, so nothing may run after it.
 *
 * <p>A single invocation keeps all of its state in the document's side tables and a
 * private line buffer; independent documents can be formatted in parallel.
 */
public class LayoutFormatter implements DocumentFormatter {
    private static final Logger logger = LoggerUtil.getLogger(LayoutFormatter.class);

    private final FormatterConfig config;
    private final DocRenderer renderer;

    private final AtomicInteger processedCount = new AtomicInteger(0);
    private final AtomicInteger successCount = new AtomicInteger(0);
    private final AtomicInteger errorCount = new AtomicInteger(0);

    public LayoutFormatter(FormatterConfig config) {
        this.config = config;
        this.renderer = new DocRenderer(config.getIndentSize());
        logger.info("Layout formatter initialized: printWidth=" + config.getPrintWidth()
                + ", indentSize=" + config.getIndentSize());
    }

    /**
     * Renders and corrects {@code doc}. The side tables are consumed.
     *
     * @throws FormatterBugException if a record references a line that was not rendered
     */
    @Override
    public String format(Doc doc, int maxWidth, SideTables sideTables) {
        return formatCollecting(doc, maxWidth, sideTables, new ArrayList<>());
    }

    /**
     * Formats a document at the configured print width. Invariant violations are
     * reported as a failed result instead of text.
     */
    @Override
    public FormatterResult formatDocument(TranslatedDocument document) {
        processedCount.incrementAndGet();
        List<AppliedCorrection> corrections = new ArrayList<>();
        try {
            String text = formatCollecting(document.getDoc(), config.getPrintWidth(),
                    document.getSideTables(), corrections);
            successCount.incrementAndGet();
            logger.fine("Formatted document with " + corrections.size() + " corrections");

            return FormatterResult.builder()
                    .successful(true)
                    .formattedCode(text)
                    .appliedCorrections(corrections)
                    .build();
        } catch (FormatterBugException e) {
            errorCount.incrementAndGet();
            logger.log(Level.SEVERE, "Formatter invariant violated", e);

            return FormatterResult.builder()
                    .successful(false)
                    .formattedCode(null)
                    .addError(new FormatterError(Severity.FATAL, e.getMessage()))
                    .build();
        }
    }

    @Override
    public Map<String, FormatterResult> formatAll(Map<String, TranslatedDocument> documents) {
        return formatAll(documents, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Formats independent documents on {@code threadCount} threads. Results keep the
     * iteration order of {@code documents}.
     */
    public Map<String, FormatterResult> formatAll(Map<String, TranslatedDocument> documents, int threadCount) {
        Map<String, FormatterResult> results = new LinkedHashMap<>();
        if (documents.isEmpty()) {
            return results;
        }

        Map<String, Future<FormatterResult>> futures = new LinkedHashMap<>();
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, threadCount));
        try {
            for (Map.Entry<String, TranslatedDocument> entry : documents.entrySet()) {
                futures.put(entry.getKey(), executor.submit(() -> formatDocument(entry.getValue())));
            }
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(30, TimeUnit.MINUTES)) {
                    logger.warning("Timeout waiting for documents to be formatted");
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                logger.log(Level.WARNING, "Formatting interrupted", e);
                Thread.currentThread().interrupt();
                executor.shutdownNow();
            }
        }

        for (Map.Entry<String, Future<FormatterResult>> entry : futures.entrySet()) {
            results.put(entry.getKey(), collect(entry.getKey(), entry.getValue()));
        }

        logger.info("Formatted " + results.size() + " documents");
        return results;
    }

    /**
     * The result of one batch task. Anything the task threw, errors included, becomes a
     * fatal result so no document goes missing.
     */
    private FormatterResult collect(String name, Future<FormatterResult> future) {
        String failure;
        Throwable cause = null;
        if (!future.isDone()) {
            failure = "Formatting did not complete";
        } else {
            try {
                return future.get();
            } catch (ExecutionException e) {
                cause = e.getCause();
                failure = "Unexpected error: " + cause;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cause = e;
                failure = "Formatting interrupted";
            }
        }

        errorCount.incrementAndGet();
        logger.log(Level.SEVERE, failure + " for " + name, cause);
        return FormatterResult.builder()
                .successful(false)
                .formattedCode(null)
                .addError(new FormatterError(Severity.FATAL, failure))
                .build();
    }

    private String formatCollecting(Doc doc, int maxWidth, SideTables sideTables,
                                    List<AppliedCorrection> corrections) {
        String rendered = normalizeEnding(renderer.render(doc, maxWidth, sideTables::isVerbatimLine),
                sideTables::isVerbatimLine);
        LineBuffer buffer = LineBuffer.of(rendered, sideTables.getUnmodifiableLines());

        for (CorrectionPass pass : createPasses()) {
            List<AppliedCorrection> applied = pass.apply(buffer, sideTables);
            if (!applied.isEmpty() && logger.isLoggable(Level.FINE)) {
                logger.fine("Pass " + pass.getName() + " applied " + applied.size() + " corrections");
            }
            corrections.addAll(applied);
        }

        return buffer.toText();
    }

    /**
     * The passes enabled by configuration, in their mandatory order.
     */
    private List<CorrectionPass> createPasses() {
        List<CorrectionPass> passes = new ArrayList<>();
        passes.add(new AlignmentCorrector());
        if (config.isPassEnabled(FormatterConfig.CALL_SHAPE)) {
            passes.add(new CallShapeCorrector());
        }
        if (config.isPassEnabled(FormatterConfig.COMPACTION)) {
            passes.add(new DeclarationCompactor());
        }
        for (CorrectionPass pass : passes) {
            pass.initialize(config);
        }
        return passes;
    }

    /**
     * Strips trailing blanks and ends the text with exactly one line break.
     */
    static String normalizeEnding(String rendered) {
        return normalizeEnding(rendered, line -> false);
    }

    /**
     * Drops trailing blank lines and ends the text with exactly one line break. The
     * trailing blanks of the last line are kept if it is verbatim.
     */
    static String normalizeEnding(String rendered, IntPredicate verbatimLine) {
        int end = rendered.length();
        while (end > 0 && Character.isWhitespace(rendered.charAt(end - 1))) {
            end--;
        }

        int lastLine = 0;
        for (int i = 0; i < end; i++) {
            if (rendered.charAt(i) == '\n') {
                lastLine++;
            }
        }
        if (end > 0 && verbatimLine.test(lastLine)) {
            while (end < rendered.length() && rendered.charAt(end) != '\n') {
                end++;
            }
        }
        return rendered.substring(0, end) + "\n";
    }

    /**
     * Gets the number of documents processed.
     */
    public int getProcessedCount() {
        return processedCount.get();
    }

    /**
     * Gets the number of successfully formatted documents.
     */
    public int getSuccessCount() {
        return successCount.get();
    }

    /**
     * Gets the number of documents that failed to format.
     */
    public int getErrorCount() {
        return errorCount.get();
    }

    public FormatterConfig getConfig() {
        return config;
    }
}
