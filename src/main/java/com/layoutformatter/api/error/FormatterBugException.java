package com.layoutformatter.api.error;

/**
 * Thrown when the document or its side tables break an invariant the formatter relies
 * on, such as a record pointing at a line that was never rendered. This is a defect in
 * the code that translated the syntax tree; the formatter never works around it.
 */
public class FormatterBugException extends RuntimeException {
    private final transient Object record;

    public FormatterBugException(String message, Object record) {
        super(message + ": " + record);
        this.record = record;
    }

    /**
     * The ledger entry or record that triggered the failure.
     */
    public Object getRecord() {
        return record;
    }
}
