package com.event.seating;

import com.event.seating.domain.ConstraintType;
import com.event.seating.domain.Guest;
import com.event.seating.domain.GuestType;
import com.event.seating.domain.ObjectiveWeights;
import com.event.seating.domain.OptimizationConfig;
import com.event.seating.domain.OptimizationResult;
import com.event.seating.domain.ReasonCode;
import com.event.seating.domain.SeatingConstraint;
import com.event.seating.domain.Seniority;
import com.event.seating.domain.TableAssignment;
import com.event.seating.service.SeatingService;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

@Component
@ConditionalOnProperty(name = "seating.demo.enabled", havingValue = "true")
public class DemoRunner implements CommandLineRunner {

    private final SeatingService service;

    public DemoRunner(SeatingService service) {
        this.service = service;
    }

    @Override
    public void run(String... args) {
        System.out.println("=== STARTING SEATING DEMO (PARTNER DINNER, 3 TABLES x 4 SEATS) ===");

        // 1. Guests
        List<Guest> guests = Arrays.asList(
                guest("g01", "Ana Ruiz", "Northwind", "Procurement", Seniority.EXECUTIVE, GuestType.BUYER),
                guest("g02", "Ben Cole", "Northwind", "IT", Seniority.SENIOR, GuestType.BUYER),
                guest("g03", "Chen Li", "Contoso", "Sales", Seniority.MID, GuestType.SELLER),
                guest("g04", "Dara Okoye", "Contoso", "Sales", Seniority.JUNIOR, GuestType.SELLER),
                guest("g05", "Eli Stone", "Fabrikam", "Operations", Seniority.SENIOR, GuestType.BUYER),
                guest("g06", "Farah Aziz", "Tailspin", "Sales", Seniority.EXECUTIVE, GuestType.SELLER),
                guest("g07", "Gus Moreau", "Host Co", "Events", Seniority.MID, GuestType.CATALYST),
                guest("g08", "Hana Sato", "Litware", "Finance", Seniority.JUNIOR, GuestType.NEUTRAL),
                guest("g09", "Ivan Petrov", "Fabrikam", "IT", Seniority.MID, GuestType.BUYER),
                guest("g10", "Jade Kim", null, "Marketing", Seniority.JUNIOR, GuestType.NEUTRAL)
        );

        // 2. Rules
        List<SeatingConstraint> constraints = Arrays.asList(
                SeatingConstraint.builder().id("c1").type(ConstraintType.MUST_SIT_TOGETHER)
                        .guestIds(Arrays.asList("g01", "g07")).build(),
                SeatingConstraint.builder().id("c2").type(ConstraintType.MUST_NOT_SIT_TOGETHER)
                        .guestIds(Arrays.asList("g03", "g04")).build(),
                SeatingConstraint.builder().id("c3").type(ConstraintType.MAX_SELLERS_PER_TABLE)
                        .value(2).build()
        );

        // 3. Weights (lean towards business opportunities)
        ObjectiveWeights weights = ObjectiveWeights.builder()
                .novelty(0.2).diversity(0.2).balance(0.2).transaction(0.4)
                .build();

        // 4. Run Optimization
        OptimizationResult result = service.optimizeSeating(guests, constraints, weights,
                OptimizationConfig.defaults(3, 4), SeatingService.MULTI_START);

        System.out.println("\nStatus: " + result.getStatus());
        System.out.println("Feasible: " + result.isFeasible());
        System.out.println("Iterations: " + result.getIterations() + " (restarts: " + result.getRestarts() + ")");
        System.out.println("Computation Time: " + result.getComputationTimeMs() + " ms");

        System.out.println("\n--- PLAN ---");
        for (TableAssignment table : result.getPlan().getTables()) {
            System.out.printf("%s: %s%n", table.getTableId(), table.getGuestIds());
            result.getExplanations().getPerTable()
                    .getOrDefault(table.getTableId(), List.of())
                    .forEach(line -> System.out.println("    - " + line));
        }

        System.out.println("\n--- METRICS (baseline -> final) ---");
        System.out.printf("Novelty:     %.3f -> %.3f%n", result.getBaselineMetrics().getNovelty(), result.getMetrics().getNovelty());
        System.out.printf("Diversity:   %.3f -> %.3f%n", result.getBaselineMetrics().getDiversity(), result.getMetrics().getDiversity());
        System.out.printf("Balance:     %.3f -> %.3f%n", result.getBaselineMetrics().getBalance(), result.getMetrics().getBalance());
        System.out.printf("Transaction: %.3f -> %.3f%n", result.getBaselineMetrics().getTransaction(), result.getMetrics().getTransaction());
        System.out.printf("Weighted:    %.3f -> %.3f%n", result.getBaselineMetrics().getWeighted(), result.getMetrics().getWeighted());

        System.out.println("\n--- SUMMARY ---");
        System.out.println(result.getExplanations().getOverall());
        long negatives = result.getExplanations().getReasonCodes().stream()
                .filter(r -> r.getImpact() == ReasonCode.Impact.NEGATIVE)
                .count();
        System.out.println("Reason codes: " + result.getExplanations().getReasonCodes().size() + " (" + negatives + " negative)");
        result.getWarnings().forEach(w -> System.out.println("WARNING: " + w));
    }

    private static Guest guest(String id, String name, String company, String department,
                               Seniority seniority, GuestType type) {
        return Guest.builder()
                .id(id)
                .name(name)
                .company(company)
                .department(department)
                .seniority(seniority)
                .guestType(type)
                .build();
    }
}
