package my.goalplanner.app.cache;

import my.goalplanner.app.domain.ClientProfile;
import my.goalplanner.app.domain.Goal;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Deterministic SHA-256 fingerprint of the inputs that determine a recommendation.
 * <p>
 * Only caller-owned fields take part: goal id, title, target amount, target year and priority,
 * plus the client's id, risk tolerance and cash-flow figures, and the planning year the horizons
 * are measured from. Engine-derived goal fields are
 * never read, so projecting a goal cannot change the key that decides whether to project it.
 * Goals are sorted by id and amounts are compared by value, so the same inputs in another order
 * or with another decimal scale hash identically.
 */
public final class RecommendationFingerprint {
	private static final String VERSION = "goal-plan-v2";

	private RecommendationFingerprint() {
	}

	public static String compute(List<Goal> goals, ClientProfile profile, int planningYear) {
		if (goals == null) {
			throw new IllegalArgumentException("Goals are required");
		}
		if (profile == null) {
			throw new IllegalArgumentException("Client profile is required");
		}
		List<Goal> sorted = new ArrayList<>(goals.size());
		Set<String> ids = new HashSet<>();
		for (Goal goal : goals) {
			if (goal == null) {
				throw new IllegalArgumentException("Goal list must not contain null entries");
			}
			if (!ids.add(goal.getId())) {
				throw new IllegalArgumentException("Duplicate goal id " + goal.getId());
			}
			sorted.add(goal);
		}
		sorted.sort(Comparator.comparing(Goal::getId));

		StringBuilder canonical = new StringBuilder();
		field(canonical, VERSION);
		field(canonical, Integer.toString(planningYear));
		field(canonical, profile.clientId());
		field(canonical, profile.riskTolerance().name());
		field(canonical, amount(profile.totalMonthlyIncome()));
		field(canonical, amount(profile.totalMonthlyExpenses()));
		field(canonical, amount(profile.monthlyEMI()));
		field(canonical, Integer.toString(sorted.size()));
		for (Goal goal : sorted) {
			field(canonical, goal.getId());
			field(canonical, goal.getTitle());
			field(canonical, amount(goal.getTargetAmount()));
			field(canonical, Integer.toString(goal.getTargetYear()));
			field(canonical, goal.getPriority().name());
		}
		return sha256(canonical.toString().getBytes(StandardCharsets.UTF_8));
	}

	// length-prefixed so no field value can imitate a separator
	private static void field(StringBuilder builder, String value) {
		builder.append(value.length()).append(':').append(value).append(';');
	}

	private static String amount(BigDecimal value) {
		return value.stripTrailingZeros().toPlainString();
	}

	private static String sha256(byte[] data) {
		try {
			MessageDigest digest = MessageDigest.getInstance("SHA-256");
			return toHex(digest.digest(data));
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 not available.", e);
		}
	}

	private static String toHex(byte[] bytes) {
		StringBuilder builder = new StringBuilder();
		for (byte b : bytes) {
			builder.append(String.format("%02x", b));
		}
		return builder.toString();
	}
}
