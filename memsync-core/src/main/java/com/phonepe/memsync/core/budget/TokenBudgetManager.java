/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.memsync.core.budget;

import com.google.common.base.Preconditions;
import com.phonepe.memsync.core.compression.CompressionEngine;
import com.phonepe.memsync.core.errors.ContentSerializationException;
import com.phonepe.memsync.core.model.MemoryEntry;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntPredicate;

/**
 * Per consumer token accounting.
 * Every consumer has a fixed ceiling and a running usage counter. Usage never goes below zero and admissions that
 * would take it above the ceiling are refused.
 */
@Slf4j
public class TokenBudgetManager {
    public static final Comparator<MemoryEntry> RETENTION_ORDER =
            Comparator.comparingInt(MemoryEntry::getPriority)
                    .thenComparingDouble(entry -> entry.getMetadata().getContextRelevance())
                    .reversed();

    private final TokenEstimator estimator;
    private final CompressionEngine compressionEngine;
    private final Map<String, ConsumerBudget> budgets = new ConcurrentHashMap<>();

    @Builder
    public TokenBudgetManager(TokenEstimator estimator, CompressionEngine compressionEngine,
                              Map<String, Integer> ceilings) {
        this.estimator = Objects.requireNonNullElseGet(estimator, CharacterRatioTokenEstimator::new);
        this.compressionEngine = Objects.requireNonNullElseGet(compressionEngine, CompressionEngine::new);
        Objects.requireNonNullElseGet(ceilings, Map::<String, Integer>of)
                .forEach(this::setBudget);
    }

    public void setBudget(final String consumer, final int ceiling) {
        Preconditions.checkArgument(ceiling >= 0, "Token ceiling for %s cannot be negative", consumer);
        budgets.compute(consumer, (name, existing) -> existing == null
                                                      ? new ConsumerBudget(ceiling, 0)
                                                      : existing.withCeiling(ceiling));
        log.info("Token budget for {} set to {}", consumer, ceiling);
    }

    public boolean hasBudget(final String consumer) {
        return budgets.containsKey(consumer);
    }

    public Set<String> consumers() {
        return Set.copyOf(budgets.keySet());
    }

    public int ceiling(final String consumer) {
        final var budget = budgets.get(consumer);
        return budget == null ? 0 : budget.ceiling();
    }

    public int usage(final String consumer) {
        final var budget = budgets.get(consumer);
        return budget == null ? 0 : budget.used();
    }

    public int available(final String consumer) {
        final var budget = budgets.get(consumer);
        return budget == null ? 0 : Math.max(0, budget.ceiling() - budget.used());
    }

    public Map<String, Integer> usageSnapshot() {
        final var snapshot = new TreeMap<String, Integer>();
        budgets.forEach((consumer, budget) -> snapshot.put(consumer, budget.used()));
        return snapshot;
    }

    public int estimateTokens(final MemoryEntry entry) {
        return estimator.estimateTokens(entry);
    }

    public boolean canFit(final MemoryEntry entry, final String consumer) {
        final var tokens = tryEstimate(entry);
        return tokens.isPresent() && canFit(tokens.getAsInt(), consumer);
    }

    public boolean canFit(final int tokens, final String consumer) {
        final var budget = budgets.get(consumer);
        return budget != null && budget.used() + tokens <= budget.ceiling();
    }

    /**
     * Whether the admitted tokens would fit once the released tokens are given back
     */
    public boolean canExchange(final String consumer, final int releasedTokens, final int admittedTokens) {
        final var budget = budgets.get(consumer);
        return budget != null
                && Math.max(0, budget.used() - releasedTokens) + admittedTokens <= budget.ceiling();
    }

    public boolean admit(final MemoryEntry entry, final String consumer) {
        return admit(consumer, estimateTokens(entry));
    }

    /**
     * @return false, leaving usage untouched, if the tokens do not fit or the consumer has no budget
     */
    public boolean admit(final String consumer, final int tokens) {
        return exchange(consumer, 0, tokens);
    }

    public void release(final MemoryEntry entry, final String consumer) {
        release(consumer, estimateTokens(entry));
    }

    public void release(final String consumer, final int tokens) {
        budgets.computeIfPresent(consumer, (name, budget) -> budget.withUsed(Math.max(0, budget.used() - tokens)));
    }

    /**
     * Atomically release one allocation and admit another in its place. Used when a consumer's copy of an entry is
     * replaced by a different variant.
     *
     * @return false, leaving usage untouched, if the admitted tokens do not fit after the release
     */
    public boolean exchange(final String consumer, final int releasedTokens, final int admittedTokens) {
        final var admitted = new AtomicBoolean(false);
        budgets.computeIfPresent(consumer, (name, budget) -> {
            final var afterRelease = Math.max(0, budget.used() - releasedTokens);
            if (afterRelease + admittedTokens > budget.ceiling()) {
                return budget;
            }
            admitted.set(true);
            return budget.withUsed(afterRelease + admittedTokens);
        });
        return admitted.get();
    }

    /**
     * Fit a candidate set into the consumer budget. Candidates are taken in descending order of priority and
     * context relevance.
     */
    public OptimizationResult optimizeForTool(final Collection<MemoryEntry> entries, final String consumer) {
        final var ordered = entries.stream()
                .sorted(RETENTION_ORDER)
                .toList();
        return admitInOrder(ordered, consumer);
    }

    /**
     * Greedily admit entries in the given order. Entries that do not fit as they are get compressed with
     * increasingly aggressive levels and the first fitting variant is admitted. Entries that fit at no level are
     * dropped, which is a policy outcome and not an error.
     */
    public OptimizationResult admitInOrder(final List<MemoryEntry> entries, final String consumer) {
        return fit(entries, consumer, tokens -> canFit(tokens, consumer), tokens -> admit(consumer, tokens));
    }

    /**
     * Same selection as {@link #admitInOrder(List, String)} but sized against a snapshot of the available budget.
     * Usage is left untouched, so repeating the call over the same entries gives the same result.
     */
    public OptimizationResult fitInOrder(final List<MemoryEntry> entries, final String consumer) {
        final var remaining = new AtomicInteger(available(consumer));
        return fit(entries, consumer,
                   tokens -> tokens <= remaining.get(),
                   tokens -> {
                       if (tokens > remaining.get()) {
                           return false;
                       }
                       remaining.addAndGet(-tokens);
                       return true;
                   });
    }

    private OptimizationResult fit(final List<MemoryEntry> entries,
                                   final String consumer,
                                   final IntPredicate fits,
                                   final IntPredicate take) {
        final var admitted = new ArrayList<MemoryEntry>();
        final var dropped = new ArrayList<MemoryEntry>();
        var admittedTokens = 0;
        if (!hasBudget(consumer)) {
            log.warn("No token budget configured for {}. Dropping all {} entries", consumer, entries.size());
            return new OptimizationResult(List.of(), List.copyOf(entries), 0);
        }
        for (final var entry : entries) {
            final var tokens = tryEstimate(entry);
            if (tokens.isPresent() && take.test(tokens.getAsInt())) {
                admitted.add(entry);
                admittedTokens += tokens.getAsInt();
                continue;
            }
            final var outcome = compressionEngine.compressUntil(entry, variant -> {
                final var variantTokens = tryEstimate(variant);
                return variantTokens.isPresent() && fits.test(variantTokens.getAsInt());
            });
            final var variantTokens = outcome.isSatisfied()
                                      ? tryEstimate(outcome.getEntry())
                                      : OptionalInt.empty();
            if (variantTokens.isPresent() && take.test(variantTokens.getAsInt())) {
                log.debug("Admitted entry for {} at compression level {}",
                          consumer, outcome.getEntry().getCompressionLevel());
                admitted.add(outcome.getEntry());
                admittedTokens += variantTokens.getAsInt();
            }
            else {
                dropped.add(entry);
            }
        }
        if (!dropped.isEmpty()) {
            log.info("Dropped {} of {} entries for {} as they do not fit the remaining budget",
                     dropped.size(), entries.size(), consumer);
        }
        return new OptimizationResult(List.copyOf(admitted), List.copyOf(dropped), admittedTokens);
    }

    private OptionalInt tryEstimate(final MemoryEntry entry) {
        try {
            return OptionalInt.of(estimator.estimateTokens(entry));
        }
        catch (ContentSerializationException e) {
            log.warn("Could not estimate tokens for entry: {}", e.getMessage());
            return OptionalInt.empty();
        }
    }

    private record ConsumerBudget(int ceiling, int used) {
        ConsumerBudget withCeiling(int newCeiling) {
            return new ConsumerBudget(newCeiling, used);
        }

        ConsumerBudget withUsed(int newUsed) {
            return new ConsumerBudget(ceiling, newUsed);
        }
    }
}
