package my.goalplanner.app.domain;

import java.math.BigDecimal;
import java.util.List;

public record ProjectedGoal(String goalId,
							String title,
							BigDecimal targetAmount,
							int targetYear,
							Priority priority,
							int timeInYears,
							AssetAllocation assetAllocation,
							double expectedReturn,
							BigDecimal monthlySIP,
							boolean immediate,
							List<Milestone> milestones) {
}
