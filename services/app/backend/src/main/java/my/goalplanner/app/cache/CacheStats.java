package my.goalplanner.app.cache;

public record CacheStats(int totalEntries, int staleEntries, int activeEntries, long totalPayloadBytes) {
}
