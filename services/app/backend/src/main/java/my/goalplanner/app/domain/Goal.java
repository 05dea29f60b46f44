package my.goalplanner.app.domain;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * One savings objective. Caller fields are edited through the setters; every edit clears the
 * engine-derived fields so a stale projection can never be read back.
 */
@Getter
public class Goal {
	public static final int MIN_TARGET_YEAR = 1;
	public static final int MAX_TARGET_YEAR = 9999;

	private final String id;
	private String title;
	private BigDecimal targetAmount;
	private int targetYear;
	private Priority priority;

	private Integer timeInYears;
	private AssetAllocation assetAllocation;
	private Double expectedReturn;
	private BigDecimal monthlySIP;
	private boolean immediate;

	public Goal(String id, String title, BigDecimal targetAmount, int targetYear, Priority priority) {
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("Goal id is required");
		}
		this.id = id;
		setTitle(title);
		setTargetAmount(targetAmount);
		setTargetYear(targetYear);
		setPriority(priority);
	}

	public void setTitle(String title) {
		if (title == null || title.isBlank()) {
			throw new IllegalArgumentException("Goal title is required for goal " + id);
		}
		this.title = title;
		clearProjection();
	}

	public void setTargetAmount(BigDecimal targetAmount) {
		if (targetAmount == null) {
			throw new IllegalArgumentException("Target amount is required for goal " + id);
		}
		if (targetAmount.signum() < 0) {
			throw new IllegalArgumentException("Target amount must not be negative for goal " + id);
		}
		this.targetAmount = targetAmount;
		clearProjection();
	}

	public void setTargetYear(int targetYear) {
		if (targetYear < MIN_TARGET_YEAR || targetYear > MAX_TARGET_YEAR) {
			throw new IllegalArgumentException("Target year must be between " + MIN_TARGET_YEAR + " and "
					+ MAX_TARGET_YEAR + " for goal " + id);
		}
		this.targetYear = targetYear;
		clearProjection();
	}

	public void setPriority(Priority priority) {
		if (priority == null) {
			throw new IllegalArgumentException("Priority is required for goal " + id);
		}
		this.priority = priority;
		clearProjection();
	}

	public boolean isProjected() {
		return monthlySIP != null;
	}

	public void applyProjection(int timeInYears, ProjectionResult projection) {
		if (projection == null) {
			throw new IllegalArgumentException("Projection is required for goal " + id);
		}
		this.timeInYears = timeInYears;
		this.assetAllocation = projection.allocation();
		this.expectedReturn = projection.expectedReturn();
		this.monthlySIP = projection.monthlySIP();
		this.immediate = projection.immediate();
	}

	private void clearProjection() {
		this.timeInYears = null;
		this.assetAllocation = null;
		this.expectedReturn = null;
		this.monthlySIP = null;
		this.immediate = false;
	}

	@Override
	public String toString() {
		return "Goal{id='" + id + "', title='" + title + "', targetAmount=" + targetAmount
				+ ", targetYear=" + targetYear + ", priority=" + priority + ", monthlySIP=" + monthlySIP + '}';
	}
}
