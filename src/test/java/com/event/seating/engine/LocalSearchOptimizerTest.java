package com.event.seating.engine;

import com.event.seating.domain.Guest;
import com.event.seating.domain.GuestType;
import com.event.seating.domain.ObjectiveWeights;
import com.event.seating.domain.OptimizationConfig;
import com.event.seating.domain.OptimizationResult;
import com.event.seating.domain.SearchStatus;
import com.event.seating.domain.SeatingConstraint;
import com.event.seating.domain.TableAssignment;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.event.seating.testutil.SeatingFixtures.apart;
import static com.event.seating.testutil.SeatingFixtures.conferenceGuests;
import static com.event.seating.testutil.SeatingFixtures.guest;
import static com.event.seating.testutil.SeatingFixtures.localSearch;
import static com.event.seating.testutil.SeatingFixtures.together;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LocalSearchOptimizer Tests")
class LocalSearchOptimizerTest {

    private final LocalSearchOptimizer optimizer = localSearch();

    private static List<Guest> buyersAndSellers() {
        return List.of(
                guest("b1", GuestType.BUYER, "Alpha"),
                guest("b2", GuestType.BUYER, "Beta"),
                guest("s1", GuestType.SELLER, "Gamma"),
                guest("s2", GuestType.SELLER, "Delta"));
    }

    @Test
    @DisplayName("Buyers and sellers end up mixed at every table")
    void testMixesBuyersAndSellers() {
        OptimizationResult result = optimizer.optimize(buyersAndSellers(), List.of(), ObjectiveWeights.equal(),
                OptimizationConfig.defaults(2, 2));

        assertTrue(result.isFeasible());
        assertEquals(SearchStatus.CONVERGED, result.getStatus());
        assertEquals(1.0, result.getMetrics().getTransaction(), 1e-9);
        for (TableAssignment table : result.getPlan().getTables()) {
            assertEquals(2, table.size());
            assertTrue(table.getGuestIds().stream().anyMatch(id -> id.startsWith("b")));
            assertTrue(table.getGuestIds().stream().anyMatch(id -> id.startsWith("s")));
        }
    }

    @Test
    @DisplayName("Too few seats terminates before any plan is built")
    void testInfeasibleCapacity() {
        List<Guest> guests = List.of(
                guest("a", GuestType.BUYER), guest("b", GuestType.BUYER), guest("c", GuestType.SELLER),
                guest("d", GuestType.SELLER), guest("e", GuestType.NEUTRAL));

        OptimizationResult result = optimizer.optimize(guests, List.of(), ObjectiveWeights.equal(),
                OptimizationConfig.defaults(2, 2));

        assertFalse(result.isFeasible());
        assertEquals(SearchStatus.INFEASIBLE_TERMINATED, result.getStatus());
        assertEquals(0, result.getIterations());
        assertTrue(result.getPlan().getTables().isEmpty());
        assertEquals(0.0, result.getMetrics().getWeighted());
        assertEquals(1, result.getWarnings().size());
        assertTrue(result.getWarnings().get(0).startsWith("Not enough seats"));
        assertTrue(result.getExplanations().getOverall().startsWith("Unable to create seating plan: "));
    }

    @Test
    @DisplayName("An unavoidable apart-violation is reported instead of hidden")
    void testResidualViolation() {
        List<Guest> guests = List.of(guest("a", GuestType.BUYER, "Alpha"), guest("b", GuestType.SELLER, "Beta"));

        OptimizationResult result = optimizer.optimize(guests, List.of(apart("rivals", "a", "b")),
                ObjectiveWeights.equal(), OptimizationConfig.defaults(1, 2));

        assertFalse(result.isFeasible());
        assertEquals(2, result.getPlan().seatedCount());
        assertFalse(result.getViolations().isEmpty());
        assertEquals("rivals", result.getViolations().get(0).getConstraintId());
    }

    @Test
    @DisplayName("Same input and seed give the same plan, metrics and explanations")
    void testDeterministic() {
        OptimizationConfig config = OptimizationConfig.defaults(3, 5);
        List<SeatingConstraint> constraints = List.of(together("team", "g1", "g2"), apart("rivals", "g0", "g6"));

        OptimizationResult first = optimizer.optimize(guestsWithWalkIn(), constraints, ObjectiveWeights.equal(), config);
        OptimizationResult second = optimizer.optimize(guestsWithWalkIn(), constraints, ObjectiveWeights.equal(), config);

        assertEquals(first.getPlan(), second.getPlan());
        assertEquals(first.getMetrics(), second.getMetrics());
        assertEquals(first.getIterations(), second.getIterations());
        assertFalse(first.getExplanations().getReasonCodes().isEmpty());
        assertEquals(first.getExplanations(), second.getExplanations());
        assertEquals(List.of("Guest \"Guest walk-in\" has no company specified"), first.getWarnings());
        assertEquals(first.getWarnings(), second.getWarnings());
    }

    @Test
    @DisplayName("Together-group ids that match no guest never take a seat")
    void testUnknownGroupMemberIgnored() {
        List<Guest> guests = List.of(guest("a", GuestType.BUYER, "Alpha"), guest("b", GuestType.SELLER, "Beta"));

        OptimizationResult result = optimizer.optimize(guests, List.of(together("pair", "a", "ghost")),
                ObjectiveWeights.equal(), OptimizationConfig.defaults(1, 2));

        assertTrue(result.isFeasible());
        assertEquals(Set.of("a", "b"), result.getPlan().seatedGuestIds());
        assertTrue(result.getWarnings().isEmpty());
    }

    private static List<Guest> guestsWithWalkIn() {
        List<Guest> guests = new ArrayList<>(conferenceGuests());
        guests.add(guest("walk-in", GuestType.NEUTRAL));
        return guests;
    }

    @Test
    @DisplayName("Search never ends below the starting score and keeps every guest seated once")
    void testMonotoneAndComplete() {
        List<Guest> guests = conferenceGuests();

        for (long seed = 1; seed <= 5; seed++) {
            OptimizationConfig config = OptimizationConfig.defaults(4, 4).toBuilder().seed(seed).build();
            OptimizationResult result = optimizer.optimize(guests, List.of(), ObjectiveWeights.equal(), config);

            assertTrue(result.getMetrics().getWeighted() >= result.getBaselineMetrics().getWeighted(), "seed " + seed);
            Set<String> seen = new HashSet<>();
            for (TableAssignment table : result.getPlan().getTables()) {
                assertTrue(table.size() <= 4);
                for (String id : table.getGuestIds()) {
                    assertTrue(seen.add(id), "seated twice: " + id);
                }
            }
            assertEquals(guests.size(), seen.size());
            assertEquals(seed, result.getSeed());
        }
    }

    @Test
    @DisplayName("A zero iteration budget returns the repaired initial plan")
    void testZeroIterations() {
        OptimizationConfig config = OptimizationConfig.defaults(3, 5).toBuilder().maxIterations(0).build();

        OptimizationResult result = optimizer.optimize(conferenceGuests(), List.of(), ObjectiveWeights.equal(), config);

        assertEquals(SearchStatus.ITERATION_LIMIT_REACHED, result.getStatus());
        assertEquals(0, result.getIterations());
        assertEquals(result.getBaselineMetrics(), result.getMetrics());
    }

    @Test
    @DisplayName("Together-groups survive the search")
    void testTogetherGroupKept() {
        List<SeatingConstraint> constraints = List.of(together("team", "g1", "g2", "g3"), apart("rivals", "g0", "g6"));

        // spare seats so the repair pass always has somewhere to go

        OptimizationResult result = optimizer.optimize(conferenceGuests(), constraints, ObjectiveWeights.equal(),
                OptimizationConfig.defaults(4, 4));

        assertTrue(result.isFeasible());
        int table = result.getPlan().tableIndexOf("g1");
        assertEquals(table, result.getPlan().tableIndexOf("g2"));
        assertEquals(table, result.getPlan().tableIndexOf("g3"));
        assertNotEquals(result.getPlan().tableIndexOf("g0"), result.getPlan().tableIndexOf("g6"));
        assertTrue(result.getExplanations().getReasonCodes().stream()
                .anyMatch(r -> r.getCode().equals("MUST_SIT_TOGETHER_SATISFIED")));
    }

    @Test
    @DisplayName("Guests without a company are flagged in the warnings")
    void testMissingCompanyWarning() {
        List<Guest> guests = List.of(guest("a", GuestType.BUYER), guest("b", GuestType.SELLER, "Beta"));

        OptimizationResult result = optimizer.optimize(guests, List.of(), ObjectiveWeights.equal(),
                OptimizationConfig.defaults(1, 2));

        assertEquals(List.of("Guest \"Guest a\" has no company specified"), result.getWarnings());
        assertEquals(1, result.getRestarts());
        assertNotNull(result.getSearchTrace());
    }
}
