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
package dev.buildbridge.bp2build;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.flogger.GoogleLogger;
import dev.buildbridge.graph.ConversionStatus;
import dev.buildbridge.graph.ErrorInfo;
import dev.buildbridge.graph.ModuleGraph;
import dev.buildbridge.graph.ModuleNode;
import dev.buildbridge.graph.ModuleStepException;
import dev.buildbridge.graph.Phase;
import dev.buildbridge.graph.PhaseScheduler;
import dev.buildbridge.graph.SchedulerContext;
import dev.buildbridge.graph.SchedulerResult;
import dev.buildbridge.graph.StepEnvironment;
import dev.buildbridge.lib.allowlist.ConversionDecision;
import dev.buildbridge.lib.events.Event;
import dev.buildbridge.lib.events.EventHandler;
import dev.buildbridge.lib.events.LoggingEventHandler;
import dev.buildbridge.lib.events.StoredEventHandler;
import dev.buildbridge.lib.events.TeeEventHandler;
import dev.buildbridge.lib.label.Label;
import dev.buildbridge.mixed.ExternalExecutor;
import dev.buildbridge.mixed.ExternalQueryException;
import dev.buildbridge.mixed.MixedBuildContext;
import dev.buildbridge.mixed.MixedBuildable;
import dev.buildbridge.mixed.MixedBuilds;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import javax.annotation.Nullable;

/**
 * Converts a module graph according to a {@link ConversionConfig}.
 *
 * <p>Every mode starts with dependency discovery. {@link BuildMode#BP2BUILD} then converts each
 * allowlisted module top-down; {@link BuildMode#API_BP2BUILD} converts the API contributions only.
 * {@link BuildMode#MIXED_BUILD} queues external queries for the eligible modules, has the external
 * executor answer them all at the barrier, and lets each module process its answer bottom-up.
 */
public final class ConversionPipeline {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  public static final String DISCOVERY_PHASE = "dependency_discovery";
  public static final String CONVERSION_PHASE = "bp2build_conversion";
  public static final String API_CONVERSION_PHASE = "api_bp2build_conversion";
  public static final String MIXED_QUEUE_PHASE = "mixed_build_queue";
  public static final String MIXED_PROCESS_PHASE = "mixed_build_process";

  private final ConversionConfig config;
  private final ModuleTypeRegistry registry;
  private final EventHandler eventHandler;
  @Nullable private final ExternalExecutor executor;

  /** Reports diagnostics to the process log only. */
  public ConversionPipeline(ConversionConfig config, ModuleTypeRegistry registry) {
    this(config, registry, new LoggingEventHandler());
  }

  public ConversionPipeline(
      ConversionConfig config, ModuleTypeRegistry registry, EventHandler eventHandler) {
    this(config, registry, eventHandler, null);
  }

  /** {@code executor} is required for mixed builds and ignored otherwise. */
  public ConversionPipeline(
      ConversionConfig config,
      ModuleTypeRegistry registry,
      EventHandler eventHandler,
      @Nullable ExternalExecutor executor) {
    checkArgument(
        config.getBuildMode() != BuildMode.MIXED_BUILD || executor != null,
        "a mixed build needs an external executor");
    this.config = checkNotNull(config);
    this.registry = checkNotNull(registry);
    this.eventHandler = checkNotNull(eventHandler);
    this.executor = executor;
  }

  /**
   * Runs all phases of the configured mode over {@code graph}. Module errors are collected in the
   * result; only bugs, interruption, and a failure of the external executor as a whole escape.
   */
  public ConversionResult run(ModuleGraph graph)
      throws InterruptedException, ExternalQueryException {
    logger.atInfo().log("Converting %d modules: %s", graph.size(), config);
    StoredEventHandler storedEvents = new StoredEventHandler();
    EventHandler events = new TeeEventHandler(storedEvents, eventHandler);
    for (String conflict : config.getAllowlist().findConflicts()) {
      events.handle(Event.warn("allowlist: " + conflict));
    }
    PhaseScheduler scheduler =
        new PhaseScheduler(
            graph,
            SchedulerContext.newBuilder()
                .setParallelism(config.getParallelism())
                .setEventHandler(events)
                .build());
    ConversionDecisions decisions = new ConversionDecisions(config.newDecider());
    Run run = new Run(decisions, events);

    DependencyDiscovery discovery =
        new DependencyDiscovery(registry, config.allowMissingDependencies());
    scheduler.runPhase(
        Phase.bottomUpByDeclaredDependencies(
            DISCOVERY_PHASE, discovery::declaredModuleNames, discovery));
    graph.completeDiscovery();
    decisions.setEarlierFailures(scheduler.getResult().getFailedModules());

    switch (config.getBuildMode()) {
      case BP2BUILD:
        scheduler.runPhase(Phase.topDown(CONVERSION_PHASE, run::convert));
        break;
      case API_BP2BUILD:
        scheduler.runPhase(Phase.topDown(API_CONVERSION_PHASE, run::convertApi));
        break;
      case MIXED_BUILD:
        scheduler.runPhase(Phase.unordered(MIXED_QUEUE_PHASE, run::queueExternalCall));
        executor.invokeQueries();
        scheduler.runPhase(Phase.bottomUp(MIXED_PROCESS_PHASE, run::processExternalResponse));
        break;
    }

    ConversionResult result = run.buildResult(graph, scheduler, storedEvents);
    logger.atInfo().log("Conversion finished: %s", result.getMetrics());
    if (result.hasErrors()) {
      logger.atWarning().log(
          "%d modules failed, %d errors reported",
          result.getSchedulerResult().getFailedModules().size(),
          result.getErrors().size());
    }
    return result;
  }

  /** State of one {@link #run}, shared by the steps of all workers. */
  private final class Run {
    private final ConversionDecisions decisions;
    private final EventHandler events;
    private final Map<String, ImmutableList<TargetDeclaration>> targetsByModule =
        new ConcurrentHashMap<>();
    private final Map<String, Boolean> mixedBuildEnabled = new ConcurrentHashMap<>();

    private Run(ConversionDecisions decisions, EventHandler events) {
      this.decisions = decisions;
      this.events = events;
    }

    private void convert(ModuleNode module, StepEnvironment env) throws ModuleStepException {
      ConversionStatus status = module.getConversionStatus();
      if (module.getHandcraftedLabel() != null) {
        status.setState(ConversionStatus.State.HANDCRAFTED);
        return;
      }
      if (!decide(module, "not allowlisted")) {
        return;
      }
      Optional<Converter> converter = registry.getConverter(module);
      checkState(converter.isPresent(), "'%s' was allowed to convert without a converter", module);
      ConversionContext ctx = new ConversionContext(module, env, config, decisions, registry);
      try {
        converter.get().convert(ctx);
      } catch (ModuleStepException e) {
        status.markUnconverted("conversion failed: " + e.getMessage());
        throw e;
      }
      finish(module, env, ctx);
    }

    private void convertApi(ModuleNode module, StepEnvironment env) throws ModuleStepException {
      if (!decide(module, "does not contribute to an API surface")) {
        return;
      }
      Optional<ApiConverter> converter = registry.getApiConverter(module);
      checkState(converter.isPresent(), "'%s' contributes an API without a converter", module);
      ConversionContext ctx = new ConversionContext(module, env, config, decisions, registry);
      try {
        converter.get().convertApi(ctx);
      } catch (ModuleStepException e) {
        module.getConversionStatus().markUnconverted("conversion failed: " + e.getMessage());
        throw e;
      }
      finish(module, env, ctx);
    }

    /**
     * Reports the decision's diagnostics and returns whether to convert. Diagnostics are not step
     * errors: a conflict denies conversion of this module without failing its dependents.
     */
    private boolean decide(ModuleNode module, String notConvertedReason) {
      ConversionDecision decision = decisions.decide(module);
      for (String diagnostic : decision.getDiagnostics()) {
        events.handle(Event.error(diagnostic).withTag(module.getName()));
      }
      if (!decision.shouldConvert()) {
        module
            .getConversionStatus()
            .markUnconverted(decision.hasConflict() ? "allowlist conflict" : notConvertedReason);
        return false;
      }
      return true;
    }

    private void finish(ModuleNode module, StepEnvironment env, ConversionContext ctx) {
      ConversionStatus status = module.getConversionStatus();
      if (!config.allowMissingDependencies() && status.hasMissingDependencies()) {
        env.reportError("depends on undefined modules " + status.getMissingDependencies());
      }
      if (env.hasErrors()) {
        status.markUnconverted("conversion errors");
      } else if (ctx.getUnconvertibleReason() != null) {
        status.markUnconverted(ctx.getUnconvertibleReason());
      } else {
        status.setState(ConversionStatus.State.CONVERTED);
        targetsByModule.put(module.getName(), ctx.getTargets());
      }
    }

    private void queueExternalCall(ModuleNode module, StepEnvironment env) {
      Optional<MixedBuildable> mixedBuildable = registry.getMixedBuildable(module);
      if (mixedBuildable.isEmpty()) {
        return;
      }
      MixedBuildContext ctx = mixedBuildContext(module, env);
      boolean enabled =
          MixedBuilds.isEnabled(ctx) && mixedBuildable.get().isMixedBuildSupported(ctx);
      mixedBuildEnabled.put(module.getName(), enabled);
      logger.atFine().log("Mixed build %s for '%s'", enabled ? "enabled" : "disabled", module);
      if (enabled) {
        mixedBuildable.get().queueExternalCall(ctx);
      }
    }

    private void processExternalResponse(ModuleNode module, StepEnvironment env)
        throws ModuleStepException {
      if (!mixedBuildEnabled.getOrDefault(module.getName(), false)) {
        return;
      }
      registry
          .getMixedBuildable(module)
          .get()
          .processExternalQueryResponse(mixedBuildContext(module, env));
    }

    private MixedBuildContext mixedBuildContext(ModuleNode module, StepEnvironment env) {
      return new MixedBuildContext(
          module,
          env,
          executor,
          Label.of(ModuleLabels.moduleLabel(module, registry.isPrebuilt(module)), module.getName()),
          config.getTargetOs(),
          decisions.isConvertedToBazel(module),
          config.isMixedBuildAllowlisted(module.getName()));
    }

    private ConversionResult buildResult(
        ModuleGraph graph, PhaseScheduler scheduler, StoredEventHandler storedEvents) {
      Map<String, List<TargetDeclaration>> byPackage = new TreeMap<>();
      List<TargetDeclaration> allTargets = new ArrayList<>();
      ImmutableMap.Builder<String, ConversionStatus> statuses = ImmutableMap.builder();
      SchedulerResult schedulerResult = scheduler.getResult();
      for (ModuleNode module : graph.getModules()) {
        ConversionStatus status = module.getConversionStatus();
        statuses.put(module.getName(), status);
        if (module.isFailed()) {
          // A dependency may fail after its dependents were converted top-down.
          if (status.getState() == ConversionStatus.State.CONVERTED
              || (status.getState() == ConversionStatus.State.UNCONVERTED
                  && status.getUnconvertedReason() == null)) {
            ErrorInfo error = schedulerResult.getError(module.getName());
            status.markUnconverted(error == null ? "failed" : error.describe());
          }
          continue;
        }
        for (TargetDeclaration target :
            targetsByModule.getOrDefault(module.getName(), ImmutableList.of())) {
          byPackage.computeIfAbsent(target.getPackageName(), k -> new ArrayList<>()).add(target);
          allTargets.add(target);
        }
      }
      ImmutableSortedMap.Builder<String, ImmutableList<TargetDeclaration>> targets =
          ImmutableSortedMap.naturalOrder();
      byPackage.forEach((pkg, list) -> targets.put(pkg, ImmutableList.copyOf(list)));
      return new ConversionResult(
          config.getBuildMode(),
          targets.buildOrThrow(),
          decisions.snapshot(),
          statuses.buildOrThrow(),
          ImmutableMap.copyOf(mixedBuildEnabled),
          storedEvents.getEvents(),
          schedulerResult,
          ConversionMetrics.compute(graph.getModules(), allTargets));
    }
  }
}
