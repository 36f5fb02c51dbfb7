package com.waveflow.examples.close;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * In-memory general ledger used by the close activities.
 *
 * Balances are kept per account and period. Every posting is a journal that can be
 * reversed by the step that posted it.
 */
public class CloseLedger {

    public record Journal(String journalId, String period, String source, String account, BigDecimal amount) {}

    private final Map<String, BigDecimal> subledger = new LinkedHashMap<>();
    private final Map<String, BigDecimal> intercompanyDue = new LinkedHashMap<>();
    private final Map<String, BigDecimal> intercompanyOwed = new LinkedHashMap<>();
    private final List<Journal> journals = new ArrayList<>();
    private final Set<String> lockedPeriods = new HashSet<>();

    /**
     * Load source system balances for a period as journals from the "data_sync" source.
     */
    public synchronized void importBalances(String period, Map<String, BigDecimal> balances) {
        requireOpen(period);
        balances.forEach((account, amount) -> journals.add(newJournal(period, "data_sync", account, amount)));
    }

    public synchronized void setSubledgerBalance(String account, BigDecimal amount) {
        subledger.put(account, amount);
    }

    public synchronized void setIntercompany(String entity, BigDecimal due, BigDecimal owed) {
        intercompanyDue.put(entity, due);
        intercompanyOwed.put(entity, owed);
    }

    public synchronized Journal post(String period, String source, String account, BigDecimal amount) {
        requireOpen(period);
        Journal journal = newJournal(period, source, account, amount);
        journals.add(journal);
        return journal;
    }

    /**
     * Remove every journal a source posted in a period.
     *
     * @return number of journals removed
     */
    public synchronized int reverse(String period, String source) {
        requireOpen(period);
        int before = journals.size();
        journals.removeIf(j -> j.period().equals(period) && j.source().equals(source));
        return before - journals.size();
    }

    public synchronized BigDecimal balance(String period, String account) {
        return journals.stream()
            .filter(j -> j.period().equals(period) && j.account().equals(account))
            .map(Journal::amount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Sum of all postings in a period; zero when the trial balance is balanced.
     */
    public synchronized BigDecimal trialBalance(String period) {
        return journals.stream()
            .filter(j -> j.period().equals(period))
            .map(Journal::amount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public synchronized Map<String, BigDecimal> subledgerBalances() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(subledger));
    }

    /**
     * Net of due minus owed over all counterparties.
     */
    public synchronized BigDecimal intercompanyDifference() {
        BigDecimal due = intercompanyDue.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal owed = intercompanyOwed.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        return due.subtract(owed);
    }

    public synchronized List<Journal> journals(String period) {
        return journals.stream().filter(j -> j.period().equals(period)).toList();
    }

    public synchronized void lock(String period) {
        lockedPeriods.add(period);
    }

    public synchronized void unlock(String period) {
        lockedPeriods.remove(period);
    }

    public synchronized boolean isLocked(String period) {
        return lockedPeriods.contains(period);
    }

    private void requireOpen(String period) {
        if (lockedPeriods.contains(period)) {
            throw new IllegalStateException("Period " + period + " is locked");
        }
    }

    private static Journal newJournal(String period, String source, String account, BigDecimal amount) {
        return new Journal("JE-" + UUID.randomUUID().toString().substring(0, 8), period, source, account, amount);
    }
}
