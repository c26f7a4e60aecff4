package com.layoutformatter.ledger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Entries of one category with the same identity on consecutive lines.
 */
public class AlignmentRun {
    private final List<LedgerEntry> entries = new ArrayList<>();

    void add(LedgerEntry entry) {
        entry.joinRun(this, entries.size());
        entries.add(entry);
    }

    boolean accepts(LedgerEntry entry) {
        if (entries.isEmpty()) {
            return true;
        }
        LedgerEntry last = entries.get(entries.size() - 1);
        return last.getLine() + 1 == entry.getLine()
                && Objects.equals(last.getIdentityId(), entry.getIdentityId());
    }

    public List<LedgerEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public int size() {
        return entries.size();
    }

    public int getFirstLine() {
        return entries.get(0).getLine();
    }

    public int getLastLine() {
        return entries.get(entries.size() - 1).getLine();
    }

    /**
     * The column every entry of the run is moved to.
     */
    public int targetColumn() {
        int target = 0;
        for (LedgerEntry entry : entries) {
            target = Math.max(target, entry.getColumn());
        }
        return target;
    }
}
