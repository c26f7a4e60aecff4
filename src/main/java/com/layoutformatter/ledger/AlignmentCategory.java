package com.layoutformatter.ledger;

/**
 * Kinds of constructs whose rendered columns can be aligned across consecutive lines.
 */
public enum AlignmentCategory {
    COMMENT("comments"),
    CASE_WHEN("caseWhen"),
    CALL_ALIGNMENT("callArguments"),
    ASSIGNMENT("assignments");

    private final String configKey;

    AlignmentCategory(String configKey) {
        this.configKey = configKey;
    }

    /**
     * Key of the flag enabling this category in the {@code alignment} config section.
     */
    public String getConfigKey() {
        return configKey;
    }
}
