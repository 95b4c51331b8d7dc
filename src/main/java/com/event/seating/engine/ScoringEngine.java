package com.event.seating.engine;

import com.event.seating.domain.Guest;
import com.event.seating.domain.GuestType;
import com.event.seating.domain.ObjectiveWeights;
import com.event.seating.domain.PlanMetrics;
import com.event.seating.domain.SeatingPlan;
import com.event.seating.domain.Seniority;
import com.event.seating.domain.TableAssignment;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Soft-objective scoring. Every score lies in [0, 1] and is a mean over tables (or over
 * co-seated pairs for novelty), so table order never changes the result. Empty tables
 * are skipped. Missing company / department values count as absent, never as a match.
 */
@Component
public class ScoringEngine {

    // Novelty pair penalties
    static final double SAME_COMPANY_PENALTY = 0.4;
    static final double SAME_DEPARTMENT_PENALTY = 0.3;
    static final double KNOWN_CONNECTION_PENALTY = 0.3;

    // Transaction table adjustments (added to a 0.5 base)
    static final double TRANSACTION_BASE = 0.5;
    static final double BUYER_SELLER_BONUS = 0.4;
    static final double CATALYST_BONUS = 0.2;
    static final double RATIO_BONUS = 0.2;
    static final double COMPETING_SELLER_PENALTY = 0.3;
    static final double ONE_SIDED_PENALTY = 0.2;

    public PlanMetrics score(SeatingPlan plan, List<Guest> guests, ObjectiveWeights weights) {
        Map<String, Guest> guestMap = GuestIndex.byId(guests);

        PlanMetrics metrics = PlanMetrics.builder()
                .novelty(novelty(plan, guestMap))
                .diversity(diversity(plan, guestMap))
                .balance(balance(plan, guestMap))
                .transaction(transaction(plan, guestMap))
                .build();
        metrics.setWeighted(weighted(metrics, weights));
        return metrics;
    }

    /**
     * Weighted composite, no renormalization of the weights.
     */
    public double weighted(PlanMetrics metrics, ObjectiveWeights weights) {
        return metrics.getNovelty() * weights.getNovelty()
                + metrics.getDiversity() * weights.getDiversity()
                + metrics.getBalance() * weights.getBalance()
                + metrics.getTransaction() * weights.getTransaction();
    }

    public double novelty(SeatingPlan plan, List<Guest> guests) {
        return novelty(plan, GuestIndex.byId(guests));
    }

    public double diversity(SeatingPlan plan, List<Guest> guests) {
        return diversity(plan, GuestIndex.byId(guests));
    }

    public double balance(SeatingPlan plan, List<Guest> guests) {
        return balance(plan, GuestIndex.byId(guests));
    }

    public double transaction(SeatingPlan plan, List<Guest> guests) {
        return transaction(plan, GuestIndex.byId(guests));
    }

    // =================================================================
    // OBJECTIVES
    // =================================================================

    private double novelty(SeatingPlan plan, Map<String, Guest> guestMap) {
        double total = 0;
        int pairs = 0;

        for (TableAssignment table : plan.getTables()) {
            List<Guest> seated = GuestIndex.seatedAt(table, guestMap);
            for (int i = 0; i < seated.size(); i++) {
                for (int j = i + 1; j < seated.size(); j++) {
                    total += pairNovelty(seated.get(i), seated.get(j));
                    pairs++;
                }
            }
        }

        return pairs > 0 ? total / pairs : 1.0;
    }

    private double pairNovelty(Guest a, Guest b) {
        double score = 1.0;
        if (a.hasCompany() && b.hasCompany() && a.getCompany().equals(b.getCompany())) {
            score -= SAME_COMPANY_PENALTY;
        }
        if (a.hasDepartment() && b.hasDepartment() && a.getDepartment().equals(b.getDepartment())) {
            score -= SAME_DEPARTMENT_PENALTY;
        }
        if (a.knows(b)) {
            score -= KNOWN_CONNECTION_PENALTY;
        }
        return Math.max(0, score);
    }

    private double diversity(SeatingPlan plan, Map<String, Guest> guestMap) {
        double total = 0;
        int occupied = 0;

        for (TableAssignment table : plan.getTables()) {
            List<Guest> seated = GuestIndex.seatedAt(table, guestMap);
            if (seated.isEmpty()) {
                continue;
            }
            Set<String> companies = new HashSet<>();
            Set<String> departments = new HashSet<>();
            for (Guest guest : seated) {
                if (guest.hasCompany()) {
                    companies.add(guest.getCompany());
                }
                if (guest.hasDepartment()) {
                    departments.add(guest.getDepartment());
                }
            }
            double companyMix = (double) companies.size() / seated.size();
            double departmentMix = (double) departments.size() / seated.size();
            total += (companyMix + departmentMix) / 2;
            occupied++;
        }

        return occupied > 0 ? total / occupied : 1.0;
    }

    private double balance(SeatingPlan plan, Map<String, Guest> guestMap) {
        double total = 0;
        int occupied = 0;

        for (TableAssignment table : plan.getTables()) {
            List<Guest> seated = GuestIndex.seatedAt(table, guestMap);
            if (seated.isEmpty()) {
                continue;
            }
            total += (seniorityEvenness(seated) + typeMix(seated)) / 2;
            occupied++;
        }

        return occupied > 0 ? total / occupied : 1.0;
    }

    /**
     * Mean over the levels present of {@code 1 - |count - ideal| / max(1, ideal)}, where
     * ideal is an even share across all four levels. Each level term is floored at 0.
     */
    private double seniorityEvenness(List<Guest> seated) {
        Map<Seniority, Integer> counts = new EnumMap<>(Seniority.class);
        for (Guest guest : seated) {
            if (guest.getSeniority() != null) {
                counts.merge(guest.getSeniority(), 1, Integer::sum);
            }
        }
        if (counts.isEmpty()) {
            return 0.5;
        }

        int withSeniority = 0;
        for (int count : counts.values()) {
            withSeniority += count;
        }
        double ideal = withSeniority / (double) Seniority.values().length;

        double score = 0;
        for (int count : counts.values()) {
            score += Math.max(0, 1 - Math.abs(count - ideal) / Math.max(1, ideal));
        }
        return score / counts.size();
    }

    private double typeMix(List<Guest> seated) {
        Set<GuestType> types = EnumSet.noneOf(GuestType.class);
        for (Guest guest : seated) {
            types.add(guest.getGuestType());
        }
        return types.size() > 1 ? 1.0 : 0.5;
    }

    private double transaction(SeatingPlan plan, Map<String, Guest> guestMap) {
        double total = 0;
        int occupied = 0;

        for (TableAssignment table : plan.getTables()) {
            List<Guest> seated = GuestIndex.seatedAt(table, guestMap);
            if (seated.isEmpty()) {
                continue;
            }
            total += tableTransaction(seated);
            occupied++;
        }

        return occupied > 0 ? total / occupied : 0.5;
    }

    private double tableTransaction(List<Guest> seated) {
        List<Guest> sellers = GuestIndex.ofType(seated, GuestType.SELLER);
        int buyers = GuestIndex.ofType(seated, GuestType.BUYER).size();
        int catalysts = GuestIndex.ofType(seated, GuestType.CATALYST).size();

        double score = TRANSACTION_BASE;
        boolean bothSides = buyers > 0 && !sellers.isEmpty();

        if (bothSides) {
            score += BUYER_SELLER_BONUS;
            score += RATIO_BONUS * Math.min(buyers, sellers.size()) / Math.max(buyers, sellers.size());
        }
        if (catalysts > 0 && (buyers > 0 || !sellers.isEmpty())) {
            score += CATALYST_BONUS;
        }
        if (GuestIndex.hasSameCompanySellers(sellers)) {
            score -= COMPETING_SELLER_PENALTY;
        }
        if ((!sellers.isEmpty() && buyers == 0) || (buyers > 0 && sellers.isEmpty())) {
            score -= ONE_SIDED_PENALTY;
        }

        return Math.max(0, Math.min(1, score));
    }
}
