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

package com.phonepe.memsync.core.sync;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.Striped;
import com.phonepe.memsync.core.budget.TokenBudgetManager;
import com.phonepe.memsync.core.compression.CompressionEngine;
import com.phonepe.memsync.core.errors.ContentSerializationException;
import com.phonepe.memsync.core.errors.ErrorType;
import com.phonepe.memsync.core.errors.StorageException;
import com.phonepe.memsync.core.errors.SyncError;
import com.phonepe.memsync.core.events.SyncEventBus;
import com.phonepe.memsync.core.model.CompressionLevel;
import com.phonepe.memsync.core.model.MemoryEntry;
import com.phonepe.memsync.core.model.MemoryScope;
import com.phonepe.memsync.core.model.MemoryType;
import com.phonepe.memsync.core.storage.MemoryStorage;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Keeps memory entries synchronized across a set of consumers.
 * <p>
 * Writes are applied to storage synchronously and recorded as {@link SyncOperation}s. Delivery to consumer adapters
 * happens later in {@link #processPendingOperations()}, either on demand or from a background worker started by
 * {@link #start()}. Every delivered variant is compressed as needed to fit the receiving consumer's token budget.
 * <p>
 * Mutations of a key are serialized by a striped lock, so versions of a key grow strictly and the queue holds
 * operations for a key in version order. Reads and the delivery loop never block writers of other keys.
 */
@Slf4j
public class MemorySyncEngine implements AutoCloseable {
    /**
     * Origin used for operations initiated by the engine itself, such as expiry purges
     */
    public static final String SYSTEM_ORIGIN = "memsync";

    private final MemoryStorage storage;
    private final CompressionEngine compressionEngine;
    private final TokenBudgetManager budgetManager;
    private final SyncEngineConfig config;
    private final Clock clock;
    private final SyncEventBus eventBus;
    private final ExecutorService deliveryExecutor;
    private final boolean ownsDeliveryExecutor;
    private final Set<String> configuredBudgets;
    private final Map<String, ToolAdapter> adapters = new ConcurrentHashMap<>();
    private final Striped<Lock> keyLocks;
    private final PendingOperationQueue pending = new PendingOperationQueue();
    private final DeliveryLedger ledger = new DeliveryLedger();
    private final ReentrantLock drainLock = new ReentrantLock();

    private volatile ScheduledExecutorService drainWorker;
    private volatile boolean started;

    @Builder
    public MemorySyncEngine(
            @NonNull MemoryStorage storage,
            CompressionEngine compressionEngine,
            TokenBudgetManager budgetManager,
            SyncEngineConfig config,
            Clock clock,
            SyncEventBus eventBus,
            ExecutorService deliveryExecutor) {
        this.storage = storage;
        this.compressionEngine = Objects.requireNonNullElseGet(compressionEngine, CompressionEngine::new);
        this.budgetManager = Objects.requireNonNullElseGet(
                budgetManager,
                () -> TokenBudgetManager.builder()
                        .compressionEngine(this.compressionEngine)
                        .build());
        this.config = Objects.requireNonNullElse(config, SyncEngineConfig.DEFAULT);
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemDefaultZone);
        this.eventBus = Objects.requireNonNullElseGet(eventBus, SyncEventBus::new);
        this.ownsDeliveryExecutor = deliveryExecutor == null;
        this.deliveryExecutor = Objects.requireNonNullElseGet(deliveryExecutor, Executors::newCachedThreadPool);
        this.configuredBudgets = Set.copyOf(this.budgetManager.consumers());
        this.keyLocks = Striped.lock(Math.max(1, this.config.getLockStripes()));
    }

    /**
     * Register the adapter that delivers entries to a consumer, replacing any earlier one for it. Consumers without
     * an explicitly configured budget get the adapter's context window size, or the configured default.
     */
    public void registerAdapter(@NonNull final ToolAdapter adapter) {
        final var consumer = adapter.consumer();
        Preconditions.checkArgument(!SYSTEM_ORIGIN.equals(consumer), "Consumer name %s is reserved", consumer);
        if (!configuredBudgets.contains(consumer)) {
            budgetManager.setBudget(consumer,
                                    adapter.contextWindowSize().orElse(config.getDefaultTokenBudget()));
        }
        final var previous = adapters.put(consumer, adapter);
        if (null != previous) {
            log.warn("Adapter for {} replaced", consumer);
        }
        if (started) {
            initializeAdapter(adapter);
        }
        log.info("Registered adapter for {}", consumer);
    }

    /**
     * Initialize storage and the registered adapters and start the background delivery worker if one is
     * configured.
     *
     * @throws StorageException if the storage backend cannot be initialized
     */
    public synchronized void start() {
        if (started) {
            return;
        }
        if (!storage.initialize()) {
            throw new StorageException("Memory storage could not be initialized");
        }
        adapters.values().forEach(this::initializeAdapter);
        final var interval = config.getDrainInterval();
        if (!interval.isZero() && !interval.isNegative()) {
            drainWorker = Executors.newSingleThreadScheduledExecutor();
            drainWorker.scheduleWithFixedDelay(this::drainSafely,
                                               interval.toMillis(),
                                               interval.toMillis(),
                                               TimeUnit.MILLISECONDS);
            log.info("Background delivery scheduled every {}", interval);
        }
        started = true;
        log.info("Memory sync engine started with {} adapters", adapters.size());
    }

    @Override
    public synchronized void close() {
        started = false;
        if (null != drainWorker) {
            drainWorker.shutdownNow();
            drainWorker = null;
        }
        if (ownsDeliveryExecutor) {
            deliveryExecutor.shutdownNow();
        }
        log.info("Memory sync engine stopped with {} operations pending", pending.size());
    }

    /**
     * Store an entry under a key. A create over an existing key replaces it and continues its version sequence.
     * Fails without writing if the stored entry cannot be read.
     */
    public WriteOutcome create(@NonNull final String key,
                               @NonNull final MemoryEntry entry,
                               @NonNull final String origin) {
        return withKeyLock(key, () -> {
            final Optional<MemoryEntry> existing;
            try {
                existing = storage.peek(key);
            }
            catch (StorageException e) {
                log.error("Create of {} from {} failed as the stored entry could not be read: {}",
                          key, origin, e.getMessage());
                return WriteOutcome.FAILED;
            }
            existing.ifPresent(stored -> log.warn("Create on existing key {} from {}. Replacing version {}",
                                                  key, origin, stored.getMetadata().getVersion()));
            final var now = now();
            final var version = existing.map(stored -> stored.getMetadata().getVersion() + 1).orElse(1L);
            return write(key, stamp(entry, null, origin, now, version), origin, SyncOperationType.CREATED);
        });
    }

    /**
     * Replace the entry under a key.
     * <p>
     * An update carrying a last modified time not later than the stored one loses: the stored entry is kept with
     * its version bumped and {@link WriteOutcome#SUPERSEDED} is returned. An update without a last modified time is
     * stamped with the current time, or just after the stored time if the clock lags, and always wins.
     * An update of a missing key behaves as a create. Fails without writing if the stored entry cannot be read.
     */
    public WriteOutcome update(@NonNull final String key,
                               @NonNull final MemoryEntry entry,
                               @NonNull final String origin) {
        return withKeyLock(key, () -> {
            final MemoryEntry existing;
            try {
                existing = storage.peek(key).orElse(null);
            }
            catch (StorageException e) {
                log.error("Update of {} from {} failed as the stored entry could not be read: {}",
                          key, origin, e.getMessage());
                return WriteOutcome.FAILED;
            }
            if (null == existing) {
                log.debug("Update of missing key {} from {} handled as create", key, origin);
                return write(key, stamp(entry, null, origin, now(), 1), origin, SyncOperationType.CREATED);
            }
            final var storedMetadata = existing.getMetadata();
            final var storedModified = storedMetadata.getLastModified();
            final var incomingModified = entry.getMetadata().getLastModified();
            final var nextVersion = storedMetadata.getVersion() + 1;
            if (null != incomingModified && null != storedModified && !incomingModified.isAfter(storedModified)) {
                log.warn("Conflicting update of {} from {} modified at {} lost to stored entry modified at {}",
                         key, origin, incomingModified, storedModified);
                final var retained = existing.withMetadata(storedMetadata.withVersion(nextVersion));
                return saveQuietly(key, retained) ? WriteOutcome.SUPERSEDED : WriteOutcome.FAILED;
            }
            var modified = incomingModified;
            if (null == modified) {
                modified = now();
                if (null != storedModified && !modified.isAfter(storedModified)) {
                    modified = storedModified.plus(1, ChronoUnit.MILLIS);
                }
            }
            return write(key, stamp(entry, existing, origin, modified, nextVersion), origin,
                         SyncOperationType.UPDATED);
        });
    }

    /**
     * @return false if nothing was stored under the key
     * @throws StorageException if the storage backend fails to read or delete the entry
     */
    public boolean delete(@NonNull final String key, @NonNull final String origin) {
        return withKeyLock(key, () -> {
            final var existing = storage.peek(key).orElse(null);
            if (null == existing) {
                log.debug("Delete of missing key {} from {} ignored", key, origin);
                return false;
            }
            if (!storage.delete(key)) {
                log.debug("Entry {} disappeared before delete from {}", key, origin);
                return false;
            }
            record(SyncOperationType.DELETED, key, existing, origin);
            log.info("Deleted memory entry {} on behalf of {}", key, origin);
            return true;
        });
    }

    /**
     * Read an entry for a consumer. Expired entries and tool specific entries of other consumers are not visible.
     * When the entry does not fit the consumer's remaining budget, the least compressed variant that fits is
     * returned, or the most compressed variant if none does. Every read is recorded as an
     * {@link SyncOperationType#ACCESSED} operation.
     *
     * @throws StorageException if the storage backend fails to read the entry
     */
    public Optional<MemoryEntry> get(@NonNull final String key, @NonNull final String consumer) {
        final var stored = storage.get(key);
        eventBus.publish(operation(SyncOperationType.ACCESSED, key, stored.orElse(null), consumer, Set.of()));
        final var entry = stored
                .filter(found -> !found.isExpired(now()))
                .filter(found -> found.isVisibleTo(consumer))
                .orElse(null);
        if (null == entry) {
            log.debug("No visible entry {} for {}", key, consumer);
            return Optional.empty();
        }
        if (consumer.equals(entry.getMetadata().getSourceTool())
                || !budgetManager.hasBudget(consumer)
                || budgetManager.canFit(entry, consumer)) {
            return Optional.of(entry);
        }
        final var outcome = compressionEngine.compressUntil(entry, variant -> budgetManager.canFit(variant, consumer));
        if (!outcome.isSatisfied()) {
            log.debug("Entry {} does not fit budget of {} at any level. Returning level {}",
                      key, consumer, outcome.getEntry().getCompressionLevel());
        }
        return Optional.of(outcome.getEntry());
    }

    /**
     * Restore the original content of a reference only entry
     */
    public MemoryEntry decompress(@NonNull final MemoryEntry entry) {
        return compressionEngine.decompress(entry, storage);
    }

    /**
     * Deliver queued operations to their targets. Operations superseded by a newer change to the same key are
     * dropped. Targets that fail stay pending and the operation is requeued. Runs are serialized; a call made while
     * another run is in progress returns immediately with an empty report.
     */
    public DrainReport processPendingOperations() {
        if (!drainLock.tryLock()) {
            log.debug("Delivery already in progress");
            return DrainReport.empty();
        }
        try {
            final var batch = pending.drain();
            var delivered = 0;
            var requeued = 0;
            var superseded = 0;
            for (final var operation : batch) {
                if (pending.isSuperseded(operation)) {
                    log.debug("Dropping superseded {} of {} at sequence {}",
                              operation.getType(), operation.getKey(), operation.getSequence());
                    superseded++;
                    continue;
                }
                final var failedTargets = deliver(operation);
                if (failedTargets.isEmpty()) {
                    pending.complete(operation);
                    delivered++;
                }
                else {
                    pending.requeue(operation.withPendingTargets(Set.copyOf(failedTargets))
                                            .withAttempts(operation.getAttempts() + 1));
                    requeued++;
                }
            }
            if (!batch.isEmpty()) {
                log.info("Processed {} pending operations. Delivered: {} Requeued: {} Superseded: {}",
                         batch.size(), delivered, requeued, superseded);
            }
            return new DrainReport(batch.size(), delivered, requeued, superseded);
        }
        finally {
            drainLock.unlock();
        }
    }

    /**
     * Work out how many entries fit the remaining budget of a consumer. Required keys are taken first in the given
     * order, then the remaining visible entries by priority and relevance, compressing where needed. Required keys
     * still have to fit the budget. Token usage of the consumer is not changed.
     *
     * @return Number of entries that fit. Zero if the consumer has no budget.
     * @throws StorageException if the storage backend fails to list or read entries
     */
    public int optimizeContextWindow(@NonNull final String consumer, final Collection<String> requiredKeys) {
        if (!budgetManager.hasBudget(consumer)) {
            log.error("No token budget for consumer {}", consumer);
            return 0;
        }
        final var now = now();
        final var required = new LinkedHashSet<>(Objects.requireNonNullElseGet(requiredKeys, List::<String>of));
        final var candidates = new ArrayList<MemoryEntry>();
        required.forEach(key -> storage.peek(key)
                .filter(entry -> !entry.isExpired(now) && entry.isVisibleTo(consumer))
                .ifPresent(candidates::add));
        storage.listKeys()
                .stream()
                .filter(key -> !required.contains(key))
                .map(storage::peek)
                .flatMap(Optional::stream)
                .filter(entry -> !entry.isExpired(now) && entry.isVisibleTo(consumer))
                .sorted(TokenBudgetManager.RETENTION_ORDER)
                .forEach(candidates::add);
        final var result = budgetManager.fitInOrder(candidates, consumer);
        log.info("Optimized context window of {}: {} entries fit using {} tokens, dropped {}",
                 consumer, result.admittedCount(), result.getAdmittedTokens(), result.getDropped().size());
        return result.admittedCount();
    }

    public MemoryStatus getMemoryStatus() {
        final var toolCounts = new TreeMap<String, Integer>();
        final var scopeCounts = new EnumMap<MemoryScope, Integer>(MemoryScope.class);
        final var typeCounts = new EnumMap<MemoryType, Integer>(MemoryType.class);
        final var compressionCounts = new EnumMap<CompressionLevel, Integer>(CompressionLevel.class);
        var entryCount = 0;
        var healthy = storage.isHealthy();
        try {
            for (final var key : storage.listKeys()) {
                final var entry = storage.peek(key).orElse(null);
                if (null == entry) {
                    continue;
                }
                entryCount++;
                toolCounts.merge(Objects.requireNonNullElse(entry.getMetadata().getSourceTool(), "unknown"),
                                 1, Integer::sum);
                scopeCounts.merge(entry.getScope(), 1, Integer::sum);
                typeCounts.merge(entry.getMemoryType(), 1, Integer::sum);
                compressionCounts.merge(entry.getCompressionLevel(), 1, Integer::sum);
            }
        }
        catch (StorageException e) {
            log.error("Error collecting memory status: {}", e.getMessage());
            healthy = false;
        }
        return MemoryStatus.builder()
                .healthy(healthy)
                .toolStatus(toolStatus())
                .entryCount(entryCount)
                .toolCounts(toolCounts)
                .scopeCounts(scopeCounts)
                .typeCounts(typeCounts)
                .compressionCounts(compressionCounts)
                .tokenUsage(budgetManager.usageSnapshot())
                .pendingOperations(pending.size())
                .pendingByConsumer(pending.pendingByConsumer())
                .build();
    }

    private Map<String, Map<String, Object>> toolStatus() {
        final var statuses = new TreeMap<String, Map<String, Object>>();
        adapters.forEach((consumer, adapter) -> {
            try {
                statuses.put(consumer, Map.copyOf(adapter.status()));
            }
            catch (RuntimeException e) {
                log.error("Error reading status of adapter for {}: {}", consumer, e.getMessage());
                statuses.put(consumer, Map.of("error", Objects.requireNonNullElse(e.getMessage(), e.toString())));
            }
        });
        return statuses;
    }

    /**
     * Delete every expired entry and propagate the deletions to all consumers
     *
     * Entries the storage backend fails to read or delete are skipped and left for the next purge.
     *
     * @return Number of entries removed
     */
    public int purgeExpired() {
        var purged = 0;
        for (final var key : storage.listKeys()) {
            final boolean removed = withKeyLock(key, () -> {
                try {
                    final var entry = storage.peek(key).orElse(null);
                    if (null == entry || !entry.isExpired(now()) || !storage.delete(key)) {
                        return false;
                    }
                    record(SyncOperationType.DELETED, key, entry, SYSTEM_ORIGIN);
                    return true;
                }
                catch (StorageException e) {
                    log.error("Skipping purge of {}: {}", key, e.getMessage());
                    return false;
                }
            });
            if (removed) {
                purged++;
            }
        }
        if (purged > 0) {
            log.info("Purged {} expired entries", purged);
        }
        return purged;
    }

    public SyncEventBus eventBus() {
        return eventBus;
    }

    public TokenBudgetManager budgetManager() {
        return budgetManager;
    }

    @VisibleForTesting
    int allocation(final String consumer, final String key) {
        return ledger.allocation(consumer, key);
    }

    private WriteOutcome write(String key, MemoryEntry entry, String origin, SyncOperationType type) {
        final MemoryEntry hashed;
        try {
            hashed = entry.withUpdatedHash();
        }
        catch (ContentSerializationException e) {
            log.error("Cannot write {} from {} as its content cannot be serialized: {}", key, origin, e.getMessage());
            return WriteOutcome.FAILED;
        }
        if (!saveQuietly(key, hashed)) {
            return WriteOutcome.FAILED;
        }
        record(type, key, hashed, origin);
        log.info("{} memory entry {} version {} from {}",
                 type == SyncOperationType.CREATED ? "Created" : "Updated",
                 key, hashed.getMetadata().getVersion(), origin);
        return type == SyncOperationType.CREATED ? WriteOutcome.CREATED : WriteOutcome.UPDATED;
    }

    private MemoryEntry stamp(MemoryEntry entry, MemoryEntry existing, String origin, LocalDateTime modified,
                              long version) {
        final var builder = entry.getMetadata()
                .toBuilder()
                .sourceTool(origin)
                .lastModified(modified)
                .version(version)
                .syncStatus(Map.of(origin, version));
        if (null != existing) {
            builder.accessCount(existing.getMetadata().getAccessCount())
                    .lastAccessed(existing.getMetadata().getLastAccessed());
        }
        return entry.withMetadata(builder.build());
    }

    private void record(SyncOperationType type, String key, MemoryEntry entry, String origin) {
        final var operation = operation(type, key, entry, origin, targetsFor(entry, origin));
        if (!operation.getPendingTargets().isEmpty()) {
            pending.enqueue(operation);
        }
        eventBus.publish(operation);
    }

    private SyncOperation operation(SyncOperationType type, String key, MemoryEntry entry, String origin,
                                    Set<String> targets) {
        return SyncOperation.builder()
                .operationId(UUID.randomUUID().toString())
                .sequence(type.requiresDelivery() ? pending.nextSequence() : 0)
                .type(type)
                .key(key)
                .entry(entry)
                .origin(origin)
                .pendingTargets(targets)
                .recordedAt(now())
                .build();
    }

    private Set<String> targetsFor(MemoryEntry entry, String origin) {
        if (entry.getMemoryType() == MemoryType.TOOL_SPECIFIC) {
            return Set.of();
        }
        final var targets = new TreeSet<String>(budgetManager.consumers());
        targets.addAll(adapters.keySet());
        targets.remove(origin);
        return Set.copyOf(targets);
    }

    /**
     * @return Targets that could not be delivered to
     */
    private Set<String> deliver(SyncOperation operation) {
        final var deliveries = new ArrayList<Delivery>();
        final var failed = new HashSet<String>();
        for (final var target : operation.getPendingTargets()) {
            final var delivery = startDelivery(operation, target);
            if (null == delivery.call()) {
                failed.add(target);
            }
            else {
                deliveries.add(delivery);
            }
        }
        CompletableFuture.allOf(deliveries.stream()
                                        .map(Delivery::call)
                                        .toArray(CompletableFuture[]::new))
                .join();
        for (final var delivery : deliveries) {
            final var result = delivery.call().join();
            if (result.isSuccess()) {
                completeDelivery(operation, delivery);
            }
            else {
                log.warn("Delivery of {} {} to {} failed (attempt {}): {}",
                         operation.getType(), operation.getKey(), delivery.target(),
                         operation.getAttempts() + 1, result.getMessage());
                if (operation.getType() != SyncOperationType.DELETED) {
                    budgetManager.exchange(delivery.target(), delivery.tokens(), delivery.previousTokens());
                }
                failed.add(delivery.target());
            }
        }
        return failed;
    }

    /**
     * Pick the variant, reserve its tokens and start the adapter call. A delivery with a null call failed before
     * reaching the adapter.
     */
    private Delivery startDelivery(SyncOperation operation, String target) {
        final var key = operation.getKey();
        final var adapter = adapters.get(target);
        if (null == adapter) {
            return failedBeforeCall(target, SyncError.error(ErrorType.NO_ADAPTER, target));
        }
        final var previousTokens = ledger.allocation(target, key);
        if (operation.getType() == SyncOperationType.DELETED) {
            return new Delivery(target, null, 0, previousTokens,
                                callAdapter(target, () -> adapter.syncDelete(key)));
        }
        final var snapshot = operation.getEntry();
        if (null == snapshot) {
            return failedBeforeCall(target, SyncError.error(ErrorType.MISSING_SNAPSHOT, key));
        }
        final var variant = fittingVariant(snapshot, target, previousTokens).orElse(null);
        final var tokens = null == variant ? 0 : estimate(variant);
        if (null == variant || !budgetManager.exchange(target, previousTokens, tokens)) {
            return failedBeforeCall(target, SyncError.error(ErrorType.BUDGET_EXHAUSTED, target));
        }
        final var call = operation.getType() == SyncOperationType.CREATED
                         ? callAdapter(target, () -> adapter.syncCreate(key, variant))
                         : callAdapter(target, () -> adapter.syncUpdate(key, variant));
        return new Delivery(target, variant, tokens, previousTokens, call);
    }

    private Optional<MemoryEntry> fittingVariant(MemoryEntry snapshot, String target, int previousTokens) {
        if (budgetManager.canExchange(target, previousTokens, estimate(snapshot))) {
            return Optional.of(snapshot);
        }
        final var outcome = compressionEngine.compressUntil(
                snapshot,
                variant -> budgetManager.canExchange(target, previousTokens, estimate(variant)));
        return outcome.isSatisfied() ? Optional.of(outcome.getEntry()) : Optional.empty();
    }

    private Delivery failedBeforeCall(String target, SyncError error) {
        log.warn("Delivery to {} not attempted: {}", target, error.getMessage());
        return new Delivery(target, null, 0, 0, null);
    }

    private CompletableFuture<SyncError> callAdapter(String target, Supplier<Boolean> call) {
        final var timeout = config.getAdapterTimeout();
        return CompletableFuture.supplyAsync(call, deliveryExecutor)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((accepted, error) -> {
                    if (null == error) {
                        return Boolean.TRUE.equals(accepted)
                               ? SyncError.success()
                               : SyncError.error(ErrorType.ADAPTER_REJECTED, target);
                    }
                    final var cause = error instanceof CompletionException && null != error.getCause()
                                      ? error.getCause()
                                      : error;
                    if (cause instanceof TimeoutException) {
                        return SyncError.error(ErrorType.ADAPTER_TIMEOUT, target, timeout);
                    }
                    return SyncError.error(ErrorType.ADAPTER_FAILURE, target, cause.getMessage());
                });
    }

    private void completeDelivery(SyncOperation operation, Delivery delivery) {
        final var target = delivery.target();
        final var key = operation.getKey();
        if (operation.getType() == SyncOperationType.DELETED) {
            budgetManager.release(target, ledger.remove(target, key));
            log.debug("Delivered delete of {} to {}", key, target);
            return;
        }
        ledger.record(target, key, delivery.tokens());
        final var version = operation.version();
        try {
            storage.updateMetadata(key, metadata -> metadata.getVersion() == version
                                                    ? metadata.withSynced(target, version)
                                                    : metadata);
        }
        catch (StorageException e) {
            log.error("Could not record delivery of {} version {} to {}: {}", key, version, target, e.getMessage());
        }
        log.debug("Delivered {} version {} to {} at level {}",
                  key, version, target, delivery.variant().getCompressionLevel());
    }

    private int estimate(MemoryEntry entry) {
        try {
            return budgetManager.estimateTokens(entry);
        }
        catch (ContentSerializationException e) {
            return Integer.MAX_VALUE;
        }
    }

    private boolean saveQuietly(String key, MemoryEntry entry) {
        try {
            if (storage.save(key, entry)) {
                return true;
            }
            log.error("Storage refused to save {}", key);
        }
        catch (StorageException e) {
            log.error("Error saving {}: {}", key, e.getMessage());
        }
        return false;
    }

    private void drainSafely() {
        try {
            processPendingOperations();
        }
        catch (RuntimeException e) {
            log.error("Background delivery run failed", e);
        }
    }

    private void initializeAdapter(ToolAdapter adapter) {
        try {
            if (!adapter.initialize()) {
                log.warn("Adapter for {} failed to initialize. Deliveries to it will be retried",
                         adapter.consumer());
            }
        }
        catch (RuntimeException e) {
            log.error("Error initializing adapter for {}", adapter.consumer(), e);
        }
    }

    private <T> T withKeyLock(String key, Supplier<T> action) {
        final var lock = keyLocks.get(key);
        lock.lock();
        try {
            return action.get();
        }
        finally {
            lock.unlock();
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private record Delivery(String target, MemoryEntry variant, int tokens, int previousTokens,
                            CompletableFuture<SyncError> call) {
    }
}
