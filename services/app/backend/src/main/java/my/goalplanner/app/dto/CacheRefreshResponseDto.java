package my.goalplanner.app.dto;

public record CacheRefreshResponseDto(String clientId, boolean removed) {
}
