// Copyright 2025 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package dev.buildbridge.graph;

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.GoogleLogger;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import dev.buildbridge.lib.events.Event;
import dev.buildbridge.lib.events.EventHandler;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs {@link Phase}s over a {@link ModuleGraph}, one after the other, with a full barrier in
 * between. Within a phase independent modules run concurrently on a fixed-size worker pool.
 *
 * <p>A module whose step throws {@link ModuleStepException} or reports an error is failed, and so
 * is every module that transitively depends on it; failed modules are skipped by all later steps
 * while the rest of the graph proceeds. Cycles among the ordering edges of a phase fail the modules
 * on and behind the cycle. An unchecked exception from any step is a bug: the phase is drained
 * without starting further steps and the exception is rethrown from {@link #runPhase}.
 *
 * <p>One scheduler instance accumulates failures over the phases it runs, so a caller may run
 * phases one at a time and act between them.
 */
public final class PhaseScheduler {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final ModuleGraph graph;
  private final SchedulerContext context;
  private final Map<String, ErrorInfo> failures =
      Collections.synchronizedMap(new LinkedHashMap<>());
  private final List<PhaseResult> phaseResults = Collections.synchronizedList(new ArrayList<>());

  public PhaseScheduler(ModuleGraph graph, SchedulerContext context) {
    this.graph = graph;
    this.context = context;
  }

  /** Runs {@code phases} in order and returns the result of the whole run. */
  public SchedulerResult runAll(List<Phase> phases) throws InterruptedException {
    for (Phase phase : phases) {
      runPhase(phase);
    }
    return getResult();
  }

  /** The phases run so far and every failure recorded so far. */
  public SchedulerResult getResult() {
    synchronized (failures) {
      return new SchedulerResult(ImmutableList.copyOf(phaseResults), ImmutableMap.copyOf(failures));
    }
  }

  /** Runs a single phase over every module and waits for all of it to finish. */
  public PhaseResult runPhase(Phase phase) throws InterruptedException {
    logger.atInfo().log(
        "Starting phase '%s' (%s) over %d modules",
        phase.getName(),
        phase.getOrdering(),
        graph.size());
    PhaseResult.Builder result = PhaseResult.builder(phase.getName());

    ImmutableListMultimap<ModuleNode, ModuleNode> waitsFor = computeWaitsFor(phase);
    ImmutableListMultimap<ModuleNode, ModuleNode> unblocks = waitsFor.inverse();

    Map<ModuleNode, AtomicInteger> pending = new HashMap<>();
    for (ModuleNode module : graph.getModules()) {
      pending.put(module, new AtomicInteger(waitsFor.get(module).size()));
    }
    Set<ModuleNode> unschedulable = findUnschedulable(waitsFor, unblocks);
    if (!unschedulable.isEmpty()) {
      reportCycles(phase, unschedulable, waitsFor, result);
    }

    List<ModuleNode> schedulable = new ArrayList<>();
    for (ModuleNode module : graph.getModules()) {
      if (!unschedulable.contains(module)) {
        schedulable.add(module);
      }
    }

    PhaseRun run = new PhaseRun(phase, result, pending, unblocks, schedulable.size());
    try {
      for (ModuleNode module : schedulable) {
        if (pending.get(module).get() == 0) {
          run.submit(module);
        }
      }
      run.latch.await();
    } finally {
      run.executor.shutdownNow();
    }

    Throwable catastrophe = run.catastrophe.get();
    if (catastrophe != null) {
      logger.atSevere().withCause(catastrophe).log(
          "Aborting run: unexpected failure in phase '%s'", phase.getName());
      Throwables.throwIfUnchecked(catastrophe);
      throw new IllegalStateException(catastrophe);
    }
    if (run.interrupted.get()) {
      throw new InterruptedException("interrupted during phase " + phase.getName());
    }

    PhaseResult phaseResult = result.build();
    phaseResults.add(phaseResult);
    logger.atInfo().log(
        "Finished phase '%s': %d completed, %d skipped, %d failed",
        phase.getName(),
        phaseResult.getCompleted().size(),
        phaseResult.getSkipped().size(),
        phaseResult.getErrors().size());
    return phaseResult;
  }

  /** For each module, the modules that must finish this phase before it may start. */
  private ImmutableListMultimap<ModuleNode, ModuleNode> computeWaitsFor(Phase phase) {
    ImmutableListMultimap.Builder<ModuleNode, ModuleNode> waitsFor =
        ImmutableListMultimap.builder();
    if (phase.getOrdering() == PhaseOrdering.UNORDERED) {
      return waitsFor.build();
    }
    for (ModuleNode module : graph.getModules()) {
      for (ModuleNode dependency : phase.orderingDependencies(graph, module)) {
        if (phase.getOrdering() == PhaseOrdering.BOTTOM_UP) {
          waitsFor.put(module, dependency);
        } else {
          waitsFor.put(dependency, module);
        }
      }
    }
    return waitsFor.build();
  }

  /** Modules that can never start because they wait, directly or not, on a cycle. */
  private Set<ModuleNode> findUnschedulable(
      ImmutableListMultimap<ModuleNode, ModuleNode> waitsFor,
      ImmutableListMultimap<ModuleNode, ModuleNode> unblocks) {
    Map<ModuleNode, Integer> remaining = new HashMap<>();
    Deque<ModuleNode> ready = new ArrayDeque<>();
    for (ModuleNode module : graph.getModules()) {
      int count = waitsFor.get(module).size();
      remaining.put(module, count);
      if (count == 0) {
        ready.add(module);
      }
    }
    while (!ready.isEmpty()) {
      ModuleNode module = ready.poll();
      remaining.remove(module);
      for (ModuleNode next : unblocks.get(module)) {
        if (remaining.merge(next, -1, Integer::sum) == 0) {
          ready.add(next);
        }
      }
    }
    return new HashSet<>(remaining.keySet());
  }

  /**
   * Fails every unschedulable module with a {@link CycleInfo}. Each of them waits on another
   * unschedulable module, so following those links from any of them ends on a cycle.
   */
  private void reportCycles(
      Phase phase,
      Set<ModuleNode> unschedulable,
      ImmutableListMultimap<ModuleNode, ModuleNode> waitsFor,
      PhaseResult.Builder result) {
    Map<ModuleNode, CycleInfo> cycleInfos = new HashMap<>();
    for (ModuleNode start : graph.getModules()) {
      if (!unschedulable.contains(start) || cycleInfos.containsKey(start)) {
        continue;
      }
      List<ModuleNode> path = new ArrayList<>();
      Map<ModuleNode, Integer> positions = new HashMap<>();
      ModuleNode current = start;
      while (!positions.containsKey(current) && !cycleInfos.containsKey(current)) {
        positions.put(current, path.size());
        path.add(current);
        current = firstUnschedulable(waitsFor.get(current), unschedulable);
      }
      int tail = path.size();
      CycleInfo reached;
      if (cycleInfos.containsKey(current)) {
        reached = cycleInfos.get(current);
      } else {
        int cycleStart = positions.get(current);
        List<String> cycle = new ArrayList<>();
        for (ModuleNode member : path.subList(cycleStart, path.size())) {
          cycle.add(member.getName());
        }
        if (phase.getOrdering() == PhaseOrdering.TOP_DOWN) {
          // Wait links run against the dependency edges here; report the cycle along the edges.
          Collections.reverse(cycle);
        }
        reached = CycleInfo.create(cycle);
        for (ModuleNode member : path.subList(cycleStart, path.size())) {
          cycleInfos.put(member, reached.fromPerspectiveOf(member.getName()));
        }
        tail = cycleStart;
      }
      for (int i = tail - 1; i >= 0; i--) {
        reached = reached.fromPerspectiveOf(path.get(i).getName());
        cycleInfos.put(path.get(i), reached);
      }
    }
    Map<ModuleNode, ErrorInfo> cycleErrors = new LinkedHashMap<>();
    for (ModuleNode module : graph.getModules()) {
      CycleInfo cycleInfo = cycleInfos.get(module);
      if (cycleInfo == null) {
        continue;
      }
      ErrorInfo error = ErrorInfo.fromCycle(cycleInfo);
      result.addError(module.getName(), error);
      // Every module on or behind a cycle keeps its own cycle error, not a dependency failure.
      failures.putIfAbsent(module.getName(), error);
      cycleErrors.put(module, error);
      if (cycleInfo.getPathToCycle().isEmpty()) {
        context
            .getEventHandler()
            .handle(
                Event.error(
                        String.format(
                            "dependency cycle in phase '%s': %s", phase.getName(), cycleInfo))
                    .withTag(module.getName()));
      }
    }
    cycleErrors.forEach(this::recordFailure);
  }

  private static ModuleNode firstUnschedulable(List<ModuleNode> candidates, Set<ModuleNode> set) {
    for (ModuleNode candidate : candidates) {
      if (set.contains(candidate)) {
        return candidate;
      }
    }
    throw new IllegalStateException("unschedulable module does not wait on another: " + candidates);
  }

  /** Fails {@code module} and every module that transitively depends on it. */
  private void recordFailure(ModuleNode module, ErrorInfo error) {
    module.markFailed();
    failures.putIfAbsent(module.getName(), error);
    Deque<String> work = new ArrayDeque<>();
    work.push(module.getName());
    while (!work.isEmpty()) {
      String failed = work.pop();
      ErrorInfo cause = failures.get(failed);
      for (String dependentName : graph.getReverseDependencies(failed)) {
        ModuleNode dependent = graph.getModule(dependentName);
        if (dependent.markFailed()) {
          logger.atFine().log("Module '%s' fails because '%s' failed", dependentName, failed);
          failures.putIfAbsent(
              dependentName, ErrorInfo.fromDependencyFailure(dependentName, failed, cause));
          work.push(dependentName);
        }
      }
    }
  }

  /** The mutable state of one phase while it runs. */
  private final class PhaseRun {
    private final Phase phase;
    private final PhaseResult.Builder result;
    private final Map<ModuleNode, AtomicInteger> pending;
    private final ImmutableListMultimap<ModuleNode, ModuleNode> unblocks;
    private final CountDownLatch latch;
    private final ExecutorService executor;
    private final AtomicReference<Throwable> catastrophe = new AtomicReference<>();
    private final AtomicBoolean interrupted = new AtomicBoolean();

    private PhaseRun(
        Phase phase,
        PhaseResult.Builder result,
        Map<ModuleNode, AtomicInteger> pending,
        ImmutableListMultimap<ModuleNode, ModuleNode> unblocks,
        int moduleCount) {
      this.phase = phase;
      this.result = result;
      this.pending = pending;
      this.unblocks = unblocks;
      this.latch = new CountDownLatch(moduleCount);
      this.executor =
          Executors.newFixedThreadPool(
              context.getParallelism(),
              new ThreadFactoryBuilder()
                  .setNameFormat("phase-" + phase.getName() + "-%d")
                  .setDaemon(true)
                  .build());
    }

    private void submit(ModuleNode module) {
      try {
        executor.execute(() -> process(module));
      } catch (RejectedExecutionException e) {
        // Only happens once the waiting thread was interrupted and shut the pool down.
        logger.atFine().withCause(e).log("Dropped '%s' after shutdown", module.getName());
      }
    }

    private void process(ModuleNode module) {
      try {
        if (catastrophe.get() != null || interrupted.get() || module.isFailed()) {
          result.addSkipped(module.getName());
        } else {
          runStep(module);
        }
      } catch (InterruptedException e) {
        interrupted.set(true);
        Thread.currentThread().interrupt();
      } catch (RuntimeException | Error e) {
        catastrophe.compareAndSet(null, e);
      } finally {
        for (ModuleNode next : unblocks.get(module)) {
          if (pending.get(next).decrementAndGet() == 0) {
            submit(next);
          }
        }
        latch.countDown();
      }
    }

    private void runStep(ModuleNode module) throws InterruptedException {
      ModuleStepEnvironment env = new ModuleStepEnvironment(module, phase);
      try {
        phase.getStep().run(module, env);
      } catch (ModuleStepException e) {
        env.reportError(e.getMessage());
        fail(module, ErrorInfo.fromException(e));
        return;
      }
      if (env.hasErrors()) {
        fail(
            module,
            ErrorInfo.fromException(
                new ModuleStepException(
                    String.format(
                        "module '%s' reported %d error(s) in phase '%s'",
                        module.getName(), env.errorCount.get(), phase.getName()))));
      } else {
        result.addCompleted(module.getName());
      }
    }

    private void fail(ModuleNode module, ErrorInfo error) {
      logger.atFine().log(
          "Module '%s' failed in phase '%s': %s", module.getName(), phase.getName(), error);
      result.addError(module.getName(), error);
      recordFailure(module, error);
    }
  }

  private final class ModuleStepEnvironment implements StepEnvironment {
    private final ModuleNode module;
    private final Phase phase;
    private final AtomicInteger errorCount = new AtomicInteger();
    private final EventHandler taggingHandler;

    private ModuleStepEnvironment(ModuleNode module, Phase phase) {
      this.module = module;
      this.phase = phase;
      this.taggingHandler =
          event -> {
            if (event.getKind().isError()) {
              errorCount.incrementAndGet();
            }
            context
                .getEventHandler()
                .handle(event.getTag() == null ? event.withTag(module.getName()) : event);
          };
    }

    @Override
    public ModuleGraph getGraph() {
      return graph;
    }

    @Override
    public String getPhaseName() {
      return phase.getName();
    }

    @Override
    public void reportError(String message) {
      taggingHandler.handle(Event.error(message));
    }

    @Override
    public void reportWarning(String message) {
      taggingHandler.handle(Event.warn(message));
    }

    @Override
    public EventHandler getEventHandler() {
      return taggingHandler;
    }

    @Override
    public boolean hasErrors() {
      return errorCount.get() > 0;
    }
  }
}
