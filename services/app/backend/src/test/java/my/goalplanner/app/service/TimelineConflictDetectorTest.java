package my.goalplanner.app.service;

import my.goalplanner.app.config.AppProperties;
import my.goalplanner.app.domain.AssetAllocation;
import my.goalplanner.app.domain.ConflictType;
import my.goalplanner.app.domain.ConflictWarning;
import my.goalplanner.app.domain.Goal;
import my.goalplanner.app.domain.Priority;
import my.goalplanner.app.domain.ProjectionResult;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimelineConflictDetectorTest {
	private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-01T00:00:00Z"), ZoneOffset.UTC);

	private final TimelineConflictDetector detector = new TimelineConflictDetector(null, CLOCK);

	@Test
	void reportsClusterWhoseCombinedSipExceedsSurplus() {
		List<Goal> goals = List.of(
				projected("car", 2027, "4000"),
				projected("wedding", 2028, "4000"));

		List<ConflictWarning> warnings = detector.detectConflicts(goals, new BigDecimal("5000"));

		assertThat(warnings).hasSize(1);
		ConflictWarning warning = warnings.get(0);
		assertThat(warning.type()).isEqualTo(ConflictType.TIMELINE_CLUSTER);
		assertThat(warning.goalIds()).containsExactly("car", "wedding");
		assertThat(warning.fromYear()).isEqualTo(2027);
		assertThat(warning.toYear()).isEqualTo(2028);
		assertThat(warning.combinedMonthlySIP()).isEqualByComparingTo("8000");
		assertThat(warning.shortfall()).isEqualByComparingTo("3000");
	}

	@Test
	void noWarningWhenClusterFitsSurplus() {
		List<Goal> goals = List.of(
				projected("car", 2027, "2000"),
				projected("wedding", 2028, "2500"));

		assertThat(detector.detectConflicts(goals, new BigDecimal("5000"))).isEmpty();
	}

	@Test
	void ignoresGoalsBeyondTheNearTerm() {
		List<Goal> goals = List.of(
				projected("retirement", 2045, "4000"),
				projected("house", 2046, "4000"));

		assertThat(detector.detectConflicts(goals, new BigDecimal("5000"))).isEmpty();
	}

	@Test
	void goalsFurtherApartThanTheWindowDoNotCluster() {
		List<Goal> goals = List.of(
				projected("car", 2026, "3000"),
				projected("wedding", 2029, "3000"));

		assertThat(detector.detectConflicts(goals, new BigDecimal("5000"))).isEmpty();
	}

	@Test
	void singleGoalAboveSurplusIsSelfConflict() {
		List<Goal> goals = List.of(
				projected("house", 2040, "7000"),
				projected("car", 2027, "1000"));

		List<ConflictWarning> warnings = detector.detectConflicts(goals, new BigDecimal("5000"));

		assertThat(warnings).hasSize(1);
		assertThat(warnings.get(0).type()).isEqualTo(ConflictType.SELF);
		assertThat(warnings.get(0).goalIds()).containsExactly("house");
		assertThat(warnings.get(0).shortfall()).isEqualByComparingTo("2000");
	}

	@Test
	void overlappingWindowsAreReportedOnce() {
		List<Goal> goals = List.of(
				projected("a", 2026, "3000"),
				projected("b", 2027, "3000"),
				projected("c", 2028, "3000"));

		List<ConflictWarning> warnings = detector.detectConflicts(goals, new BigDecimal("5000"));

		assertThat(warnings).hasSize(1);
		assertThat(warnings.get(0).goalIds()).containsExactly("a", "b", "c");
		assertThat(warnings.get(0).shortfall()).isEqualByComparingTo("4000");
	}

	@Test
	void configuredWindowAndFractionApply() {
		AppProperties properties = new AppProperties(new AppProperties.Planning(null, 10, 4, 0.5), null, null);
		TimelineConflictDetector tight = new TimelineConflictDetector(properties, CLOCK);
		List<Goal> goals = List.of(
				projected("car", 2026, "1500"),
				projected("house", 2030, "1500"));

		List<ConflictWarning> warnings = tight.detectConflicts(goals, new BigDecimal("5000"));

		assertThat(warnings).hasSize(1);
		assertThat(warnings.get(0).shortfall()).isEqualByComparingTo("0");
	}

	@Test
	void rejectsUnprojectedGoals() {
		Goal raw = new Goal("raw", "Raw", new BigDecimal("1000"), 2027, Priority.LOW);

		assertThatThrownBy(() -> detector.detectConflicts(List.of(raw), new BigDecimal("5000")))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("raw");
	}

	@Test
	void emptyGoalListHasNoConflicts() {
		assertThat(detector.detectConflicts(List.of(), BigDecimal.ZERO)).isEmpty();
	}

	static Goal projected(String id, int targetYear, String monthlySIP) {
		return projected(id, Priority.MEDIUM, targetYear, monthlySIP);
	}

	static Goal projected(String id, Priority priority, int targetYear, String monthlySIP) {
		Goal goal = new Goal(id, id, new BigDecimal("100000"), targetYear, priority);
		goal.applyProjection(targetYear - 2025,
				new ProjectionResult(0.08, new AssetAllocation(50, 40, 10), new BigDecimal(monthlySIP), false, "medium"));
		return goal;
	}
}
