package my.goalplanner.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.goalplanner.app.cache.CacheStats;
import my.goalplanner.app.cache.CachedRecommendation;
import my.goalplanner.app.cache.RecommendationCache;
import my.goalplanner.app.domain.ClientProfile;
import my.goalplanner.app.dto.CacheClearResponseDto;
import my.goalplanner.app.dto.CacheRefreshResponseDto;
import my.goalplanner.app.dto.PlanRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/recommendation-cache")
@Tag(name = "Recommendation Cache")
public class RecommendationCacheController {
	private final RecommendationCache cache;

	public RecommendationCacheController(RecommendationCache cache) {
		this.cache = cache;
	}

	@PostMapping("/lookup")
	@Operation(summary = "Look up the cached recommendation for a client and goal set")
	public ResponseEntity<CachedRecommendation> lookup(@Valid @RequestBody PlanRequest request) {
		return cache.lookup(request.toGoals(), request.profile().toProfile())
				.map(ResponseEntity::ok)
				.orElseGet(() -> ResponseEntity.notFound().build());
	}

	@PostMapping("/refresh")
	@Operation(summary = "Drop the cached recommendation for a client")
	public CacheRefreshResponseDto refresh(@Valid @RequestBody PlanRequest request) {
		ClientProfile profile = request.profile().toProfile();
		return new CacheRefreshResponseDto(profile.clientId(), cache.forceRefresh(request.toGoals(), profile));
	}

	@DeleteMapping
	@Operation(summary = "Clear all cached recommendations")
	public CacheClearResponseDto clear() {
		return new CacheClearResponseDto(cache.clearAll());
	}

	@GetMapping("/stats")
	@Operation(summary = "Get cache statistics")
	public CacheStats stats() {
		return cache.stats();
	}
}
