package my.goalplanner.app.model;

public enum AssetClass {
	EQUITY,
	DEBT,
	GOLD
}
