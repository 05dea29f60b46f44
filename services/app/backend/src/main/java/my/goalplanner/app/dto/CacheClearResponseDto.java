package my.goalplanner.app.dto;

public record CacheClearResponseDto(int removed) {
}
