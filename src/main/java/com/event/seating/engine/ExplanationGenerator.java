package com.event.seating.engine;

import com.event.seating.domain.ConstraintType;
import com.event.seating.domain.Guest;
import com.event.seating.domain.GuestType;
import com.event.seating.domain.Objective;
import com.event.seating.domain.PlanExplanations;
import com.event.seating.domain.PlanMetrics;
import com.event.seating.domain.ReasonCode;
import com.event.seating.domain.ReasonCode.Impact;
import com.event.seating.domain.SeatingConstraint;
import com.event.seating.domain.SeatingPlan;
import com.event.seating.domain.Seniority;
import com.event.seating.domain.TableAssignment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns a finished plan into reason codes and static-template text. Only facts present
 * in the plan, the guest records and the metrics are reported; richer narrative is left
 * to whatever consumes {@link PlanExplanations#getReasonCodes()}.
 */
@Component
public class ExplanationGenerator {

    static final double STRONG_OBJECTIVE_THRESHOLD = 0.7;
    static final int SAME_COMPANY_CLUSTER_SIZE = 3;

    public PlanExplanations generate(SeatingPlan plan, List<Guest> guests, PlanMetrics metrics,
                                     List<SeatingConstraint> constraints) {
        Map<String, Guest> guestMap = GuestIndex.byId(guests);
        List<ReasonCode> reasonCodes = new ArrayList<>();
        Map<String, List<String>> perTable = new LinkedHashMap<>();

        for (TableAssignment table : plan.getTables()) {
            List<Guest> seated = GuestIndex.seatedAt(table, guestMap);
            if (seated.isEmpty()) {
                continue;
            }
            TableNotes notes = new TableNotes(table.getTableId(), reasonCodes);

            describeCompanies(table, seated, notes);
            describeDepartments(table, seated, notes);
            describeSeniority(table, seated, notes);
            describeDeal(seated, notes);
            describeGroups(table, constraints, guestMap, notes);

            perTable.put(table.getTableId(), notes.lines);
        }

        return PlanExplanations.builder()
                .perTable(perTable)
                .overall(summarize(metrics, plan, guests.size(), reasonCodes))
                .reasonCodes(reasonCodes)
                .build();
    }

    // =================================================================
    // PER-TABLE RULES
    // =================================================================

    private void describeCompanies(TableAssignment table, List<Guest> seated, TableNotes notes) {
        Map<String, List<String>> byCompany = new LinkedHashMap<>();
        for (Guest guest : seated) {
            if (guest.hasCompany()) {
                byCompany.computeIfAbsent(guest.getCompany(), k -> new ArrayList<>()).add(guest.getId());
            }
        }

        if (byCompany.size() > 1) {
            notes.add("COMPANY_DIVERSITY", new ArrayList<>(table.getGuestIds()),
                    "Cross-company networking: " + byCompany.size() + " different companies represented",
                    Impact.POSITIVE, Objective.DIVERSITY);
        }

        byCompany.forEach((company, ids) -> {
            if (ids.size() >= SAME_COMPANY_CLUSTER_SIZE) {
                notes.add("SAME_COMPANY_CLUSTER", ids,
                        ids.size() + " guests from " + company + " share this table",
                        Impact.NEGATIVE, Objective.NOVELTY);
            }
        });
    }

    private void describeDepartments(TableAssignment table, List<Guest> seated, TableNotes notes) {
        Set<String> departments = new LinkedHashSet<>();
        for (Guest guest : seated) {
            if (guest.hasDepartment()) {
                departments.add(guest.getDepartment());
            }
        }
        if (departments.size() > 2) {
            notes.add("DEPARTMENT_DIVERSITY", new ArrayList<>(table.getGuestIds()),
                    "Department mix: " + departments.size() + " different departments",
                    Impact.POSITIVE, Objective.DIVERSITY);
        }
    }

    private void describeSeniority(TableAssignment table, List<Guest> seated, TableNotes notes) {
        Set<Seniority> levels = EnumSet.noneOf(Seniority.class);
        for (Guest guest : seated) {
            if (guest.getSeniority() != null) {
                levels.add(guest.getSeniority());
            }
        }
        if (levels.size() > 2) {
            notes.add("SENIORITY_MIX", new ArrayList<>(table.getGuestIds()),
                    "Balanced seniority: " + levels.size() + " experience levels",
                    Impact.POSITIVE, Objective.BALANCE);
        }
    }

    private void describeDeal(List<Guest> seated, TableNotes notes) {
        List<Guest> buyers = GuestIndex.ofType(seated, GuestType.BUYER);
        List<Guest> sellers = GuestIndex.ofType(seated, GuestType.SELLER);

        if (!buyers.isEmpty() && !sellers.isEmpty()) {
            List<String> ids = new ArrayList<>(ids(buyers));
            ids.addAll(ids(sellers));
            notes.add("BUYER_SELLER_MIX", ids,
                    "Business opportunity: " + buyers.size() + " buyer(s) and " + sellers.size() + " seller(s)",
                    Impact.POSITIVE, Objective.TRANSACTION);
        }

        for (Guest catalyst : GuestIndex.ofType(seated, GuestType.CATALYST)) {
            notes.add("CATALYST_PRESENT", List.of(catalyst.getId()),
                    "Conversation catalyst: " + catalyst.getName(),
                    Impact.POSITIVE, Objective.BALANCE);
        }

        if (GuestIndex.hasSameCompanySellers(sellers)) {
            notes.add("COMPETING_SELLERS", ids(sellers),
                    "Note: Multiple sellers from the same company",
                    Impact.NEGATIVE, Objective.TRANSACTION);
        }
    }

    private void describeGroups(TableAssignment table, List<SeatingConstraint> constraints,
                                Map<String, Guest> guestMap, TableNotes notes) {
        for (SeatingConstraint constraint : constraints) {
            if (constraint.getType() != ConstraintType.MUST_SIT_TOGETHER || constraint.groupSize() == 0) {
                continue;
            }
            if (!table.getGuestIds().containsAll(constraint.getGuestIds())) {
                continue;
            }
            String names = constraint.getGuestIds().stream()
                    .map(guestMap::get)
                    .filter(g -> g != null)
                    .map(Guest::getName)
                    .collect(Collectors.joining(", "));
            notes.add("MUST_SIT_TOGETHER_SATISFIED", new ArrayList<>(constraint.getGuestIds()),
                    "Grouped by request: " + names,
                    Impact.NEUTRAL, null);
        }
    }

    // =================================================================
    // SUMMARY
    // =================================================================

    private String summarize(PlanMetrics metrics, SeatingPlan plan, int guestCount, List<ReasonCode> reasonCodes) {
        List<String> parts = new ArrayList<>();
        parts.add(String.format(Locale.ROOT, "Overall optimization score: %.1f%%", metrics.getWeighted() * 100));

        // Ties go to the objective declared first
        Objective best = Objective.NOVELTY;
        for (Objective objective : Objective.values()) {
            if (metrics.scoreFor(objective) > metrics.scoreFor(best)) {
                best = objective;
            }
        }
        double bestScore = metrics.scoreFor(best);
        if (bestScore >= STRONG_OBJECTIVE_THRESHOLD) {
            parts.add(String.format(Locale.ROOT, "Strong performance in %s (%.0f%%)", best.getLabel(), bestScore * 100));
        }

        long positive = reasonCodes.stream().filter(r -> r.getImpact() == Impact.POSITIVE).count();
        long negative = reasonCodes.stream().filter(r -> r.getImpact() == Impact.NEGATIVE).count();
        if (positive > negative * 2) {
            parts.add("Well-balanced tables with good networking potential");
        } else if (negative > positive) {
            parts.add("Some trade-offs were made to satisfy hard constraints");
        }

        parts.add(guestCount + " guests across " + plan.occupiedTableCount() + " tables");
        return String.join(". ", parts) + ".";
    }

    private static List<String> ids(List<Guest> guests) {
        List<String> ids = new ArrayList<>(guests.size());
        for (Guest guest : guests) {
            ids.add(guest.getId());
        }
        return ids;
    }

    // Collects one table's lines while appending to the plan-wide reason code list
    private static final class TableNotes {
        private final String tableId;
        private final List<ReasonCode> sink;
        private final List<String> lines = new ArrayList<>();

        private TableNotes(String tableId, List<ReasonCode> sink) {
            this.tableId = tableId;
            this.sink = sink;
        }

        void add(String code, List<String> guestIds, String description, Impact impact, Objective objective) {
            lines.add(description);
            sink.add(ReasonCode.builder()
                    .code(code)
                    .tableId(tableId)
                    .guestIds(guestIds)
                    .description(description)
                    .impact(impact)
                    .objective(objective)
                    .build());
        }
    }
}
