package com.event.seating.engine;

import com.event.seating.domain.FeasibilityVerdict;
import com.event.seating.domain.Guest;
import com.event.seating.domain.ObjectiveWeights;
import com.event.seating.domain.OptimizationConfig;
import com.event.seating.domain.OptimizationResult;
import com.event.seating.domain.PlanExplanations;
import com.event.seating.domain.PlanMetrics;
import com.event.seating.domain.SearchStatus;
import com.event.seating.domain.SeatingConstraint;
import com.event.seating.domain.SeatingPlan;
import com.event.seating.domain.TableAssignment;
import com.event.seating.domain.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.Set;

/**
 * LOCAL SEARCH ENGINE
 * Greedy initial plan, one repair pass, then first-improvement hill climbing over
 * pairwise swaps and single moves. A trial is accepted only if it passes validation and
 * strictly raises the weighted score, so the result is locally optimal, never globally
 * guaranteed. Traversal order and the seed fully determine the output.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LocalSearchOptimizer implements SeatingOptimizer {

    private final FeasibilityChecker feasibilityChecker;
    private final AssignmentBuilder assignmentBuilder;
    private final AssignmentRepairer assignmentRepairer;
    private final ConstraintValidator constraintValidator;
    private final ScoringEngine scoringEngine;
    private final ExplanationGenerator explanationGenerator;

    @Override
    public OptimizationResult optimize(List<Guest> guests, List<SeatingConstraint> constraints,
                                      ObjectiveWeights weights, OptimizationConfig config) {
        long startTime = System.currentTimeMillis();
        int tableCount = config.getTableCount();
        int seatsPerTable = config.getSeatsPerTable();
        int maxIterations = config.maxIterationsOrDefault();
        long seed = config.seedOrDefault();

        SearchStatus status = SearchStatus.INITIALIZING;
        log.info("Seating {} guests at {} tables x {} seats (seed={}, maxIterations={})",
                guests.size(), tableCount, seatsPerTable, seed, maxIterations);

        // ---------------------------------------------------------
        // 1. PRE-FLIGHT
        // ---------------------------------------------------------
        FeasibilityVerdict verdict = feasibilityChecker.check(guests.size(), constraints, tableCount, seatsPerTable);
        if (!verdict.isFeasible()) {
            log.warn("Infeasible seating request: {}", verdict.getReason());
            return infeasibleResult(verdict.getReason(), seed, System.currentTimeMillis() - startTime);
        }

        // ---------------------------------------------------------
        // 2. INITIAL PLAN (+ REPAIR IF NEEDED)
        // ---------------------------------------------------------
        Random random = new Random(seed);
        SeatingPlan plan = assignmentBuilder.build(guests, constraints, tableCount, seatsPerTable, random);

        ValidationResult validation = constraintValidator.validate(plan, constraints, guests);
        if (!validation.isValid()) {
            log.debug("Initial plan has {} violation(s), running repair pass", validation.getViolations().size());
            plan = assignmentRepairer.repair(plan, constraints, seatsPerTable);
        }

        PlanMetrics baseline = scoringEngine.score(plan, guests, weights);
        PlanMetrics metrics = baseline;

        // ---------------------------------------------------------
        // 3. HILL CLIMBING
        // ---------------------------------------------------------
        status = SearchStatus.SEARCHING;
        int iterations = 0;
        while (status == SearchStatus.SEARCHING) {
            if (iterations >= maxIterations) {
                status = SearchStatus.ITERATION_LIMIT_REACHED;
                break;
            }
            iterations++;

            Trial accepted = firstImprovingSwap(plan, metrics, guests, constraints, weights);
            if (accepted == null) {
                accepted = firstImprovingMove(plan, metrics, guests, constraints, weights, seatsPerTable);
            }

            if (accepted == null) {
                status = SearchStatus.CONVERGED;
            } else {
                plan = accepted.getPlan();
                metrics = accepted.getMetrics();
                log.debug("Iteration {}: accepted {} -> weighted {}", iterations, accepted.getDescription(), metrics.getWeighted());
            }
        }

        // ---------------------------------------------------------
        // 4. FINAL CHECK & RESULT
        // ---------------------------------------------------------
        ValidationResult finalValidation = constraintValidator.validate(plan, constraints, guests);
        PlanExplanations explanations = explanationGenerator.generate(plan, guests, metrics, constraints);
        List<String> warnings = collectWarnings(guests, plan);

        if (!finalValidation.isValid()) {
            log.warn("Returning plan with {} residual constraint violation(s)", finalValidation.getViolations().size());
        }

        long duration = System.currentTimeMillis() - startTime;
        log.info("Seating finished: status={}, iterations={}, weighted {} -> {}, feasible={}, {} ms",
                status, iterations, format(baseline.getWeighted()), format(metrics.getWeighted()),
                finalValidation.isValid(), duration);

        return OptimizationResult.builder()
                .plan(plan)
                .metrics(metrics)
                .baselineMetrics(baseline)
                .explanations(explanations)
                .warnings(warnings)
                .feasible(finalValidation.isValid())
                .violations(finalValidation.getViolations())
                .iterations(iterations)
                .status(status)
                .seed(seed)
                .computationTimeMs(duration)
                .restarts(1)
                .searchTrace(String.format(Locale.ROOT, "Seed %d: weighted %s -> %s after %d iteration(s) (%s).",
                        seed, format(baseline.getWeighted()), format(metrics.getWeighted()), iterations, status))
                .build();
    }

    // =================================================================
    // NEIGHBOURHOODS
    // =================================================================

    @Value
    private static class Trial {
        SeatingPlan plan;
        PlanMetrics metrics;
        String description;
    }

    /**
     * Swaps across every table pair (t1 < t2), then guest index order within each table.
     */
    private Trial firstImprovingSwap(SeatingPlan plan, PlanMetrics current, List<Guest> guests,
                                     List<SeatingConstraint> constraints, ObjectiveWeights weights) {
        List<TableAssignment> tables = plan.getTables();
        for (int t1 = 0; t1 < tables.size(); t1++) {
            for (int t2 = t1 + 1; t2 < tables.size(); t2++) {
                int size1 = tables.get(t1).size();
                int size2 = tables.get(t2).size();
                for (int g1 = 0; g1 < size1; g1++) {
                    for (int g2 = 0; g2 < size2; g2++) {
                        SeatingPlan candidate = swap(plan, t1, g1, t2, g2);
                        Trial trial = evaluate(candidate, current, guests, constraints, weights);
                        if (trial != null) {
                            return new Trial(trial.getPlan(), trial.getMetrics(),
                                    "swap " + tables.get(t1).getGuestIds().get(g1)
                                            + " <-> " + tables.get(t2).getGuestIds().get(g2));
                        }
                    }
                }
            }
        }
        return null;
    }

    /**
     * Moves one guest to any other table with a free seat, ordered by (from, to, guest).
     */
    private Trial firstImprovingMove(SeatingPlan plan, PlanMetrics current, List<Guest> guests,
                                     List<SeatingConstraint> constraints, ObjectiveWeights weights,
                                     int seatsPerTable) {
        List<TableAssignment> tables = plan.getTables();
        for (int from = 0; from < tables.size(); from++) {
            for (int to = 0; to < tables.size(); to++) {
                if (from == to || !tables.get(to).hasRoom(seatsPerTable)) {
                    continue;
                }
                for (int g = 0; g < tables.get(from).size(); g++) {
                    SeatingPlan candidate = move(plan, from, g, to);
                    Trial trial = evaluate(candidate, current, guests, constraints, weights);
                    if (trial != null) {
                        return new Trial(trial.getPlan(), trial.getMetrics(),
                                "move " + tables.get(from).getGuestIds().get(g) + " -> " + tables.get(to).getTableId());
                    }
                }
            }
        }
        return null;
    }

    /**
     * @return the scored candidate when it is valid and strictly better, otherwise null
     */
    private Trial evaluate(SeatingPlan candidate, PlanMetrics current, List<Guest> guests,
                           List<SeatingConstraint> constraints, ObjectiveWeights weights) {
        if (!constraintValidator.validate(candidate, constraints, guests).isValid()) {
            return null;
        }
        PlanMetrics candidateMetrics = scoringEngine.score(candidate, guests, weights);
        if (candidateMetrics.getWeighted() > current.getWeighted()) {
            return new Trial(candidate, candidateMetrics, null);
        }
        return null;
    }

    static SeatingPlan swap(SeatingPlan plan, int t1, int g1, int t2, int g2) {
        SeatingPlan next = plan.copy();
        List<String> first = next.getTables().get(t1).getGuestIds();
        List<String> second = next.getTables().get(t2).getGuestIds();
        String held = first.get(g1);
        first.set(g1, second.get(g2));
        second.set(g2, held);
        return next;
    }

    static SeatingPlan move(SeatingPlan plan, int from, int guestIndex, int to) {
        SeatingPlan next = plan.copy();
        String guestId = next.getTables().get(from).getGuestIds().remove(guestIndex);
        next.getTables().get(to).getGuestIds().add(guestId);
        return next;
    }

    // =================================================================
    // RESULT HELPERS
    // =================================================================

    private List<String> collectWarnings(List<Guest> guests, SeatingPlan plan) {
        List<String> warnings = new ArrayList<>();
        for (Guest guest : guests) {
            if (!guest.hasCompany()) {
                warnings.add("Guest \"" + guest.getName() + "\" has no company specified");
            }
        }

        Set<String> seated = plan.seatedGuestIds();
        for (Guest guest : guests) {
            if (!seated.contains(guest.getId())) {
                warnings.add("Guest \"" + guest.getName() + "\" was not assigned to any table");
            }
        }
        return warnings;
    }

    private OptimizationResult infeasibleResult(String reason, long seed, long duration) {
        List<String> warnings = new ArrayList<>();
        warnings.add(reason);
        return OptimizationResult.builder()
                .plan(SeatingPlan.empty())
                .metrics(PlanMetrics.zero())
                .baselineMetrics(PlanMetrics.zero())
                .explanations(PlanExplanations.builder()
                        .overall("Unable to create seating plan: " + reason)
                        .build())
                .warnings(warnings)
                .feasible(false)
                .iterations(0)
                .status(SearchStatus.INFEASIBLE_TERMINATED)
                .seed(seed)
                .computationTimeMs(duration)
                .restarts(1)
                .searchTrace("Infeasible: " + reason)
                .build();
    }

    private static String format(double score) {
        return String.format(Locale.ROOT, "%.4f", score);
    }
}
