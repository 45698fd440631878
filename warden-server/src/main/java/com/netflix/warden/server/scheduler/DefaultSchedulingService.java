/*
 * Copyright 2021 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.netflix.warden.server.scheduler;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import javax.annotation.PreDestroy;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.netflix.warden.api.binding.model.Binding;
import com.netflix.warden.api.binding.service.BindingStore;
import com.netflix.warden.api.binding.service.BindingStoreException;
import com.netflix.warden.api.model.ResourceDimension;
import com.netflix.warden.api.model.ResourceDimensions;
import com.netflix.warden.api.priority.model.PreemptionPolicy;
import com.netflix.warden.api.scheduler.model.ResourcePool;
import com.netflix.warden.api.scheduler.model.SchedulingEvent;
import com.netflix.warden.api.scheduler.model.SchedulingResult;
import com.netflix.warden.api.scheduler.model.Taint;
import com.netflix.warden.api.scheduler.model.TaintEffect;
import com.netflix.warden.api.scheduler.model.Workload;
import com.netflix.warden.api.scheduler.model.WorkloadState;
import com.netflix.warden.api.scheduler.model.WorkloadStatus;
import com.netflix.warden.api.scheduler.service.SchedulerException;
import com.netflix.warden.api.scheduler.service.SchedulingService;
import com.netflix.warden.common.runtime.WardenRuntime;
import com.netflix.warden.common.util.time.Clock;
import com.netflix.warden.server.scheduler.constraint.CapacityConstraint;
import com.netflix.warden.server.scheduler.constraint.PlacementConstraint;
import com.netflix.warden.server.scheduler.constraint.RequiredAffinityConstraint;
import com.netflix.warden.server.scheduler.constraint.TaintTolerationConstraint;
import com.netflix.warden.server.scheduler.fitness.FitnessCalculator;
import com.netflix.warden.server.scheduler.fitness.LeastAllocatedFitnessCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Single writer scheduler. All state changes and placement decisions happen under one lock, so the outcome depends
 * only on the order of the calls. Each placement goes through:
 * <ul>
 *     <li>filtering, evaluating the {@link PlacementConstraint}s against each pool</li>
 *     <li>scoring of the feasible pools with the {@link FitnessCalculator}, ties resolved by pool id</li>
 *     <li>if no pool is feasible, preemption of lower priority workloads</li>
 *     <li>binding, with the pool occupancy checked again inside the binding store pool lock</li>
 * </ul>
 */
public class DefaultSchedulingService implements SchedulingService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultSchedulingService.class);

    private static final Comparator<Workload> QUEUE_ORDER = Comparator
            .comparingInt(Workload::getPriority).reversed()
            .thenComparingLong(Workload::getCreationSequence)
            .thenComparing(Workload::getId);

    private static final Comparator<Workload> VICTIM_ORDER = Comparator
            .comparingInt(Workload::getPriority)
            .thenComparingLong(Workload::getCreationSequence)
            .thenComparing(Workload::getId);

    private final SchedulerConfiguration configuration;
    private final BindingStore bindingStore;
    private final Clock clock;
    private final SchedulerMetrics metrics;

    private final List<PlacementConstraint> constraints;
    private final FitnessCalculator fitnessCalculator;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ResourcePool> pools = new TreeMap<>();
    private final Map<String, Workload> workloads = new HashMap<>();
    private final Map<String, WorkloadStatus> statuses = new HashMap<>();
    private final NavigableSet<Workload> pendingQueue = new TreeSet<>(QUEUE_ORDER);

    private final Sinks.Many<SchedulingEvent> eventSink = Sinks.many().multicast().directBestEffort();

    private ScheduledExecutorService executor;
    private Disposable schedulingLoop;

    public DefaultSchedulingService(SchedulerConfiguration configuration,
                                    BindingStore bindingStore,
                                    WardenRuntime runtime) {
        this.configuration = configuration;
        this.bindingStore = bindingStore;
        this.clock = runtime.getClock();
        this.metrics = new SchedulerMetrics(runtime.getRegistry());
        this.constraints = ImmutableList.of(
                new TaintTolerationConstraint(),
                new RequiredAffinityConstraint(),
                new CapacityConstraint()
        );
        this.fitnessCalculator = new LeastAllocatedFitnessCalculator(configuration);
    }

    /**
     * Starts the background loop, placing pending workloads at the configured interval.
     */
    public void enterActiveMode() {
        Preconditions.checkState(schedulingLoop == null, "Scheduling loop already running");
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "warden-scheduler");
            thread.setDaemon(true);
            return thread;
        });
        Scheduler loopScheduler = Schedulers.fromExecutorService(executor);
        long intervalMs = configuration.getSchedulingIntervalMs();
        this.schedulingLoop = loopScheduler.schedulePeriodically(this::runIteration, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        logger.info("Scheduling loop started with interval {}ms", intervalMs);
    }

    @PreDestroy
    public void shutdown() {
        if (schedulingLoop != null) {
            schedulingLoop.dispose();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
        eventSink.tryEmitComplete();
    }

    private void runIteration() {
        long startTime = clock.wallTime();
        try {
            List<SchedulingResult> results = scheduleAll();
            if (!results.isEmpty()) {
                logger.debug("Scheduling iteration completed: placementAttempts={}", results.size());
            }
        } catch (Exception e) {
            logger.warn("Scheduling iteration failed", e);
        } finally {
            metrics.iterationLatency(clock.wallTime() - startTime);
        }
    }

    @Override
    public List<ResourcePool> getPools() {
        return inLock(() -> new ArrayList<>(pools.values()));
    }

    @Override
    public Optional<ResourcePool> findPool(String poolId) {
        return inLock(() -> Optional.ofNullable(pools.get(poolId)));
    }

    @Override
    public void addPool(ResourcePool pool) {
        inLock(() -> {
            if (pools.containsKey(pool.getId())) {
                throw SchedulerException.poolAlreadyExists(pool.getId());
            }
            pools.put(pool.getId(), pool);
            logger.info("Resource pool added: {}", pool);
            retryUnschedulable();
            return null;
        });
    }

    @Override
    public void updatePool(ResourcePool pool) {
        inLock(() -> {
            ResourcePool previous = pools.get(pool.getId());
            if (previous == null) {
                throw SchedulerException.poolNotFound(pool.getId());
            }
            pools.put(pool.getId(), pool);
            logger.info("Resource pool updated: {}", pool);

            Set<Taint> addedNoExecuteTaints = new HashSet<>();
            for (Taint taint : pool.getTaints()) {
                if (taint.getEffect() == TaintEffect.NoExecute && !previous.getTaints().contains(taint)) {
                    addedNoExecuteTaints.add(taint);
                }
            }
            if (!addedNoExecuteTaints.isEmpty()) {
                for (Workload workload : snapshotOf(pool).getBoundWorkloads()) {
                    Optional<Taint> untolerated = addedNoExecuteTaints.stream().filter(taint -> !workload.tolerates(taint)).findFirst();
                    untolerated.ifPresent(taint -> evict(workload, pool.getId(), "taint", "untolerated NoExecute taint " + taint));
                }
            }

            PoolSnapshot snapshot = snapshotOf(pool);
            if (!ResourceDimensions.fits(snapshot.getAllocated(), pool.getCapacity())) {
                List<Workload> candidates = new ArrayList<>(snapshot.getBoundWorkloads());
                candidates.sort(VICTIM_ORDER);
                ResourceDimension allocated = snapshot.getAllocated();
                for (Workload workload : candidates) {
                    if (ResourceDimensions.fits(allocated, pool.getCapacity())) {
                        break;
                    }
                    evict(workload, pool.getId(), "capacity", "resource pool capacity reduced");
                    allocated = ResourceDimensions.subtract(allocated, workload.getDemand());
                }
            }

            retryUnschedulable();
            return null;
        });
    }

    @Override
    public void removePool(String poolId) {
        inLock(() -> {
            ResourcePool pool = pools.remove(poolId);
            if (pool == null) {
                throw SchedulerException.poolNotFound(poolId);
            }
            for (Binding binding : bindingStore.listBindings(poolId)) {
                Workload workload = workloads.get(binding.getWorkloadId());
                if (workload == null) {
                    bindingStore.unbind(binding.getWorkloadId());
                } else {
                    evict(workload, poolId, "poolRemoved", "resource pool removed");
                }
            }
            logger.info("Resource pool removed: {}", poolId);
            return null;
        });
    }

    @Override
    public void submit(Workload workload) {
        inLock(() -> {
            if (workloads.containsKey(workload.getId())) {
                throw SchedulerException.workloadAlreadyExists(workload.getId());
            }
            workloads.put(workload.getId(), workload);
            emit(SchedulingEvent.Type.Submitted, workload.getId(), Optional.empty(), "submitted");

            // A binding may exist already, if it was restored from the journal. It is kept only if the workload
            // still passes all placement constraints on that pool.
            Optional<Binding> existing = bindingStore.findBinding(workload.getId());
            if (existing.isPresent()) {
                String poolId = existing.get().getPoolId();
                ResourcePool pool = pools.get(poolId);
                Optional<String> failure = pool == null
                        ? Optional.of("resource pool not found")
                        : evaluateConstraints(workload, snapshotOf(pool, workload.getId()), false);
                if (!failure.isPresent()) {
                    setStatus(workload.getId(), WorkloadState.Bound, "restored binding to " + poolId);
                    emit(SchedulingEvent.Type.Bound, workload.getId(), Optional.of(poolId), "restored binding");
                    logger.info("Workload {} restored on pool {}", workload.getId(), poolId);
                    return null;
                }
                bindingStore.unbind(workload.getId());
                logger.info("Restored binding of workload {} to pool {} dropped: {}", workload.getId(), poolId, failure.get());
            }

            setStatus(workload.getId(), WorkloadState.Pending, "submitted");
            pendingQueue.add(workload);
            metrics.pendingQueueSize(pendingQueue.size());
            return null;
        });
    }

    @Override
    public void removeWorkload(String workloadId) {
        inLock(() -> {
            Workload workload = workloads.remove(workloadId);
            if (workload == null) {
                throw SchedulerException.workloadNotFound(workloadId);
            }
            pendingQueue.remove(workload);
            metrics.pendingQueueSize(pendingQueue.size());
            Optional<Binding> removed = bindingStore.unbind(workloadId);
            statuses.remove(workloadId);
            emit(SchedulingEvent.Type.Removed, workloadId, removed.map(Binding::getPoolId), "removed");
            logger.info("Workload removed: {}", workloadId);

            if (removed.isPresent()) {
                retryUnschedulable();
            }
            return null;
        });
    }

    @Override
    public Optional<Workload> findWorkload(String workloadId) {
        return inLock(() -> Optional.ofNullable(workloads.get(workloadId)));
    }

    @Override
    public WorkloadStatus getStatus(String workloadId) {
        return inLock(() -> {
            WorkloadStatus status = statuses.get(workloadId);
            if (status == null) {
                throw SchedulerException.workloadNotFound(workloadId);
            }
            return status;
        });
    }

    @Override
    public List<Workload> getPendingWorkloads() {
        return inLock(() -> new ArrayList<>(pendingQueue));
    }

    @Override
    public Optional<SchedulingResult> scheduleNext() {
        return inLock(() -> {
            Workload next = pendingQueue.pollFirst();
            metrics.pendingQueueSize(pendingQueue.size());
            if (next == null) {
                return Optional.empty();
            }
            return Optional.of(place(next));
        });
    }

    @Override
    public List<SchedulingResult> scheduleAll() {
        return inLock(() -> {
            List<SchedulingResult> results = new ArrayList<>();
            Optional<SchedulingResult> next;
            while ((next = scheduleNext()).isPresent()) {
                results.add(next.get());
            }
            return results;
        });
    }

    @Override
    public void retryUnschedulable() {
        inLock(() -> {
            int count = 0;
            for (Map.Entry<String, WorkloadStatus> entry : statuses.entrySet()) {
                if (entry.getValue().getState() == WorkloadState.Unschedulable) {
                    entry.setValue(WorkloadStatus.of(WorkloadState.Pending, "retry", clock.wallTime()));
                    pendingQueue.add(workloads.get(entry.getKey()));
                    count++;
                }
            }
            metrics.pendingQueueSize(pendingQueue.size());
            if (count > 0) {
                logger.info("Moved {} unschedulable workload(s) back to the pending queue", count);
            }
            return null;
        });
    }

    @Override
    public Flux<SchedulingEvent> events() {
        return eventSink.asFlux();
    }

    private SchedulingResult place(Workload workload) {
        int maxAttempts = Math.max(1, configuration.getMaxAlreadyBoundRetries());
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            setStatus(workload.getId(), WorkloadState.Filtering, "filtering");
            List<PoolSnapshot> snapshots = snapshots();

            List<PoolSnapshot> feasible = new ArrayList<>();
            List<String> failures = new ArrayList<>();
            for (PoolSnapshot snapshot : snapshots) {
                Optional<String> failure = evaluateConstraints(workload, snapshot, false);
                if (failure.isPresent()) {
                    failures.add(snapshot.getPoolId() + ": " + failure.get());
                } else {
                    feasible.add(snapshot);
                }
            }

            if (feasible.isEmpty()) {
                String reason = snapshots.isEmpty() ? "no resource pools available" : "no feasible pool [" + String.join("; ", failures) + ']';
                if (workload.getPreemptionPolicy() == PreemptionPolicy.NeverPreempt) {
                    return markUnschedulable(workload, reason);
                }
                Optional<PreemptionPlan> plan = findPreemptionPlan(workload, snapshots);
                if (!plan.isPresent()) {
                    return markUnschedulable(workload, reason);
                }
                Optional<SchedulingResult> result = preemptAndBind(workload, plan.get());
                if (result.isPresent()) {
                    return result.get();
                }
                continue;
            }

            setStatus(workload.getId(), WorkloadState.Scoring, "scoring");
            PoolSnapshot best = selectBest(workload, feasible);
            Optional<Binding> binding = tryBind(workload, best.getPoolId());
            if (binding.isPresent()) {
                return markBound(workload, best.getPoolId(), ImmutableList.of());
            }
        }
        return markUnschedulable(workload, "binding conflicts after " + maxAttempts + " attempt(s)");
    }

    /**
     * Returns the reason of the first failed constraint, or empty if all succeeded.
     */
    private Optional<String> evaluateConstraints(Workload workload, PoolSnapshot snapshot, boolean skipCapacityDependent) {
        for (PlacementConstraint constraint : constraints) {
            if (skipCapacityDependent && constraint.isCapacityDependent()) {
                continue;
            }
            PlacementConstraint.Result result = constraint.evaluate(workload, snapshot);
            if (!result.isSuccessful()) {
                return Optional.of(result.getFailureReason());
            }
        }
        return Optional.empty();
    }

    private PoolSnapshot selectBest(Workload workload, List<PoolSnapshot> feasible) {
        PoolSnapshot best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        // Snapshots are ordered by pool id, and only a strictly better score replaces the current best.
        for (PoolSnapshot snapshot : feasible) {
            double score = fitnessCalculator.calculateFitness(workload, snapshot);
            if (best == null || score > bestScore) {
                best = snapshot;
                bestScore = score;
            }
        }
        return best;
    }

    private Optional<PreemptionPlan> findPreemptionPlan(Workload workload, List<PoolSnapshot> snapshots) {
        PreemptionPlan best = null;
        for (PoolSnapshot snapshot : snapshots) {
            if (evaluateConstraints(workload, snapshot, true).isPresent()) {
                continue;
            }
            List<Workload> candidates = new ArrayList<>();
            for (Workload bound : snapshot.getBoundWorkloads()) {
                if (bound.getPriority() < workload.getPriority()) {
                    candidates.add(bound);
                }
            }
            candidates.sort(VICTIM_ORDER);

            List<Workload> victims = new ArrayList<>();
            ResourceDimension free = snapshot.getFree();
            for (Workload candidate : candidates) {
                if (ResourceDimensions.fits(workload.getDemand(), free)) {
                    break;
                }
                victims.add(candidate);
                free = ResourceDimensions.add(free, candidate.getDemand());
            }
            if (victims.isEmpty() || !ResourceDimensions.fits(workload.getDemand(), free)) {
                continue;
            }
            PreemptionPlan plan = new PreemptionPlan(snapshot.getPoolId(), victims);
            if (best == null || PreemptionPlan.ORDER.compare(plan, best) < 0) {
                best = plan;
            }
        }
        return Optional.ofNullable(best);
    }

    private Optional<SchedulingResult> preemptAndBind(Workload workload, PreemptionPlan plan) {
        String poolId = plan.getPoolId();
        setStatus(workload.getId(), WorkloadState.PendingPreemption, "preempting " + plan.getVictimIds() + " on " + poolId);

        Optional<Binding> binding = preemptInPoolLock(workload, plan);
        if (!binding.isPresent()) {
            return Optional.empty();
        }
        logger.info("Workload {} preempted {} on pool {}", workload.getId(), plan.getVictimIds(), poolId);

        for (Workload victim : plan.getVictims()) {
            setStatus(victim.getId(), WorkloadState.Pending, "preempted by " + workload.getId());
            pendingQueue.add(victim);
            emit(SchedulingEvent.Type.Preempted, victim.getId(), Optional.of(poolId), "preempted by " + workload.getId());
        }
        metrics.preempted(plan.getVictims().size());
        metrics.pendingQueueSize(pendingQueue.size());
        return Optional.of(markBound(workload, poolId, plan.getVictimIds()));
    }

    /**
     * Releases the victims and binds the workload in one pool lock section. Nothing is released if the plan no
     * longer holds, and the victims are bound again if the workload binding fails.
     */
    private Optional<Binding> preemptInPoolLock(Workload workload, PreemptionPlan plan) {
        String poolId = plan.getPoolId();
        return bindingStore.executeInPoolLock(poolId, () -> {
            ResourceDimension free = snapshotOf(pools.get(poolId)).getFree();
            for (Workload victim : plan.getVictims()) {
                boolean stillBound = bindingStore.findBinding(victim.getId()).map(b -> b.getPoolId().equals(poolId)).orElse(false);
                if (!stillBound) {
                    logger.info("Preemption victim {} no longer bound to pool {}", victim.getId(), poolId);
                    metrics.bindingConflict();
                    return Optional.<Binding>empty();
                }
                free = ResourceDimensions.add(free, victim.getDemand());
            }
            if (!ResourceDimensions.fits(workload.getDemand(), free)) {
                logger.info("Pool {} occupancy changed before preempting for workload {}", poolId, workload.getId());
                metrics.bindingConflict();
                return Optional.<Binding>empty();
            }

            List<Binding> released = new ArrayList<>();
            plan.getVictims().forEach(victim -> bindingStore.unbind(victim.getId()).ifPresent(released::add));
            try {
                return Optional.of(bindingStore.bind(workload.getId(), poolId));
            } catch (BindingStoreException e) {
                released.forEach(victimBinding -> bindingStore.bind(victimBinding.getWorkloadId(), victimBinding.getPoolId()));
                if (e.getErrorCode() != BindingStoreException.ErrorCode.AlreadyBound) {
                    throw e;
                }
                logger.info("Binding conflict for workload {}, preemption of {} reverted: {}", workload.getId(), plan.getVictimIds(), e.getMessage());
                metrics.bindingConflict();
                return Optional.<Binding>empty();
            }
        });
    }

    /**
     * Binds the workload, if it still fits the pool. Occupancy is read again inside the pool lock, as external
     * parties may change the binding store.
     */
    private Optional<Binding> tryBind(Workload workload, String poolId) {
        try {
            return bindingStore.executeInPoolLock(poolId, () -> {
                PoolSnapshot snapshot = snapshotOf(pools.get(poolId));
                if (!ResourceDimensions.fits(workload.getDemand(), snapshot.getFree())) {
                    logger.info("Pool {} occupancy changed before binding workload {}", poolId, workload.getId());
                    metrics.bindingConflict();
                    return Optional.<Binding>empty();
                }
                return Optional.of(bindingStore.bind(workload.getId(), poolId));
            });
        } catch (BindingStoreException e) {
            if (e.getErrorCode() != BindingStoreException.ErrorCode.AlreadyBound) {
                throw e;
            }
            logger.info("Binding conflict for workload {}: {}", workload.getId(), e.getMessage());
            metrics.bindingConflict();
            return Optional.empty();
        }
    }

    private SchedulingResult markBound(Workload workload, String poolId, List<String> preempted) {
        setStatus(workload.getId(), WorkloadState.Bound, "bound to " + poolId);
        emit(SchedulingEvent.Type.Bound, workload.getId(), Optional.of(poolId), "bound");
        metrics.bound(!preempted.isEmpty());
        logger.debug("Workload {} bound to pool {}", workload.getId(), poolId);
        return preempted.isEmpty()
                ? SchedulingResult.bound(workload.getId(), poolId)
                : SchedulingResult.boundAfterPreemption(workload.getId(), poolId, preempted);
    }

    private SchedulingResult markUnschedulable(Workload workload, String reason) {
        setStatus(workload.getId(), WorkloadState.Unschedulable, reason);
        emit(SchedulingEvent.Type.Unschedulable, workload.getId(), Optional.empty(), reason);
        metrics.unschedulable();
        logger.info("Workload {} is unschedulable: {}", workload.getId(), reason);
        return SchedulingResult.unschedulable(workload.getId(), reason);
    }

    private void evict(Workload workload, String poolId, String metricReason, String reason) {
        bindingStore.unbind(workload.getId());
        setStatus(workload.getId(), WorkloadState.Pending, reason);
        pendingQueue.add(workload);
        metrics.pendingQueueSize(pendingQueue.size());
        metrics.evicted(metricReason);
        emit(SchedulingEvent.Type.Evicted, workload.getId(), Optional.of(poolId), reason);
        logger.info("Workload {} evicted from pool {}: {}", workload.getId(), poolId, reason);
    }

    private List<PoolSnapshot> snapshots() {
        List<PoolSnapshot> snapshots = new ArrayList<>(pools.size());
        pools.values().forEach(pool -> snapshots.add(snapshotOf(pool)));
        return snapshots;
    }

    /**
     * Bindings of workloads not known to this scheduler do not occupy any resources.
     */
    private PoolSnapshot snapshotOf(ResourcePool pool) {
        return snapshotOf(pool, null);
    }

    private PoolSnapshot snapshotOf(ResourcePool pool, String excludedWorkloadId) {
        List<Workload> bound = new ArrayList<>();
        for (Binding binding : bindingStore.listBindings(pool.getId())) {
            if (binding.getWorkloadId().equals(excludedWorkloadId)) {
                continue;
            }
            Workload workload = workloads.get(binding.getWorkloadId());
            if (workload != null) {
                bound.add(workload);
            }
        }
        return new PoolSnapshot(pool, bound);
    }

    private void setStatus(String workloadId, WorkloadState state, String reason) {
        statuses.put(workloadId, WorkloadStatus.of(state, reason, clock.wallTime()));
    }

    private void emit(SchedulingEvent.Type type, String workloadId, Optional<String> poolId, String reason) {
        Sinks.EmitResult result = eventSink.tryEmitNext(new SchedulingEvent(type, workloadId, poolId, reason, clock.wallTime()));
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            logger.debug("Scheduling event not delivered: type={}, workloadId={}, result={}", type, workloadId, result);
        }
    }

    private <T> T inLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private static class PreemptionPlan {

        private static final Comparator<PreemptionPlan> ORDER = Comparator
                .comparingInt(PreemptionPlan::getMaxVictimPriority)
                .thenComparingInt(plan -> plan.getVictims().size())
                .thenComparing(PreemptionPlan::getPoolId);

        private final String poolId;
        private final List<Workload> victims;
        private final int maxVictimPriority;

        private PreemptionPlan(String poolId, List<Workload> victims) {
            this.poolId = poolId;
            this.victims = victims;
            this.maxVictimPriority = victims.stream().mapToInt(Workload::getPriority).max().orElse(Integer.MIN_VALUE);
        }

        private String getPoolId() {
            return poolId;
        }

        private List<Workload> getVictims() {
            return victims;
        }

        private List<String> getVictimIds() {
            List<String> ids = new ArrayList<>(victims.size());
            victims.forEach(victim -> ids.add(victim.getId()));
            return ids;
        }

        private int getMaxVictimPriority() {
            return maxVictimPriority;
        }
    }
}
