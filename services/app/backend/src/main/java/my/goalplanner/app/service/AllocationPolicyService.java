package my.goalplanner.app.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import my.goalplanner.app.config.AppProperties;
import my.goalplanner.app.domain.AssetAllocation;
import my.goalplanner.app.domain.RiskTolerance;
import my.goalplanner.app.model.AllocationPolicy;
import my.goalplanner.app.model.AssetClass;
import my.goalplanner.app.model.HorizonBucket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the allocation policy table from a JSON resource. A missing resource falls back to the
 * built-in table; a resource that is present but invalid fails startup.
 */
@Service
public class AllocationPolicyService {
	private static final Logger logger = LoggerFactory.getLogger(AllocationPolicyService.class);
	static final String DEFAULT_LOCATION = "classpath:allocation_policy.json";
	private static final AllocationPolicy DEFAULT_POLICY = createDefaultPolicy();

	private final ObjectMapper jsonMapper;
	private final AllocationPolicy policy;

	public AllocationPolicyService(ResourceLoader resourceLoader, AppProperties properties) {
		this.jsonMapper = JsonMapper.builder().build();
		String location = properties == null || properties.planning() == null
				|| properties.planning().allocationPolicyLocation() == null
				|| properties.planning().allocationPolicyLocation().isBlank()
				? DEFAULT_LOCATION
				: properties.planning().allocationPolicyLocation();
		this.policy = loadPolicy(resourceLoader.getResource(location), location);
	}

	public AllocationPolicy getPolicy() {
		return policy;
	}

	private AllocationPolicy loadPolicy(Resource resource, String location) {
		if (!resource.exists()) {
			logger.info("Allocation policy {} not found, using built-in defaults.", location);
			return DEFAULT_POLICY;
		}
		try (InputStream inputStream = resource.getInputStream()) {
			String json = new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
			AllocationPolicy parsed = parsePolicy(json);
			logger.info("Loaded allocation policy from {} ({} horizon buckets).", location,
					parsed.getHorizonBuckets().size());
			return parsed;
		} catch (IOException ex) {
			throw new IllegalStateException("Unable to read allocation policy " + location, ex);
		}
	}

	AllocationPolicy parsePolicy(String json) {
		PolicyDocument document;
		try {
			document = jsonMapper.readValue(json, PolicyDocument.class);
		} catch (JacksonException ex) {
			throw new IllegalStateException("Allocation policy is not valid JSON: " + ex.getMessage(), ex);
		}
		if (document == null) {
			throw new IllegalStateException("Allocation policy is empty");
		}
		Map<AssetClass, Double> returns = toReturns(document.assetClassReturns());
		List<HorizonBucket> buckets = toBuckets(document.horizonBuckets());
		return new AllocationPolicy(returns, buckets);
	}

	private Map<AssetClass, Double> toReturns(Map<AssetClass, Double> raw) {
		if (raw == null) {
			throw new IllegalStateException("Allocation policy is missing asset_class_returns");
		}
		Map<AssetClass, Double> returns = new EnumMap<>(AssetClass.class);
		for (AssetClass assetClass : AssetClass.values()) {
			Double value = raw.get(assetClass);
			if (value == null || value.isNaN() || value <= -1.0) {
				throw new IllegalStateException("Allocation policy has no valid return for " + assetClass);
			}
			returns.put(assetClass, value);
		}
		return Map.copyOf(returns);
	}

	private List<HorizonBucket> toBuckets(List<BucketDocument> raw) {
		if (raw == null || raw.isEmpty()) {
			throw new IllegalStateException("Allocation policy is missing horizon_buckets");
		}
		List<HorizonBucket> buckets = new ArrayList<>();
		Integer previousMax = null;
		for (int i = 0; i < raw.size(); i++) {
			BucketDocument bucket = raw.get(i);
			boolean last = i == raw.size() - 1;
			String name = bucket.name() == null || bucket.name().isBlank() ? "bucket-" + (i + 1) : bucket.name();
			if (last != (bucket.maxYears() == null)) {
				throw new IllegalStateException("Only the last horizon bucket may omit max_years (bucket " + name + ")");
			}
			if (bucket.maxYears() != null && previousMax != null && bucket.maxYears() <= previousMax) {
				throw new IllegalStateException("Horizon buckets must have ascending max_years (bucket " + name + ")");
			}
			previousMax = bucket.maxYears();
			buckets.add(new HorizonBucket(name, bucket.maxYears(), toAllocations(name, bucket.allocations())));
		}
		return List.copyOf(buckets);
	}

	private Map<RiskTolerance, AssetAllocation> toAllocations(String bucketName,
															 Map<RiskTolerance, AllocationDocument> raw) {
		Map<RiskTolerance, AssetAllocation> allocations = new EnumMap<>(RiskTolerance.class);
		for (RiskTolerance riskTolerance : RiskTolerance.values()) {
			AllocationDocument allocation = raw == null ? null : raw.get(riskTolerance);
			if (allocation == null) {
				throw new IllegalStateException("Horizon bucket " + bucketName + " has no allocation for " + riskTolerance);
			}
			try {
				allocations.put(riskTolerance,
						new AssetAllocation(allocation.equity(), allocation.debt(), allocation.gold()));
			} catch (IllegalArgumentException ex) {
				throw new IllegalStateException("Horizon bucket " + bucketName + " / " + riskTolerance + ": "
						+ ex.getMessage(), ex);
			}
		}
		return Map.copyOf(allocations);
	}

	private static AllocationPolicy createDefaultPolicy() {
		Map<AssetClass, Double> returns = Map.of(
				AssetClass.EQUITY, 0.12,
				AssetClass.DEBT, 0.07,
				AssetClass.GOLD, 0.08
		);
		List<HorizonBucket> buckets = List.of(
				new HorizonBucket("short", 3, allocations(
						new AssetAllocation(10, 85, 5),
						new AssetAllocation(15, 80, 5),
						new AssetAllocation(20, 75, 5))),
				new HorizonBucket("medium", 7, allocations(
						new AssetAllocation(30, 60, 10),
						new AssetAllocation(45, 45, 10),
						new AssetAllocation(60, 30, 10))),
				new HorizonBucket("long", null, allocations(
						new AssetAllocation(45, 45, 10),
						new AssetAllocation(60, 30, 10),
						new AssetAllocation(75, 15, 10)))
		);
		return new AllocationPolicy(returns, buckets);
	}

	private static Map<RiskTolerance, AssetAllocation> allocations(AssetAllocation conservative,
																   AssetAllocation moderate,
																   AssetAllocation aggressive) {
		Map<RiskTolerance, AssetAllocation> allocations = new LinkedHashMap<>();
		allocations.put(RiskTolerance.CONSERVATIVE, conservative);
		allocations.put(RiskTolerance.MODERATE, moderate);
		allocations.put(RiskTolerance.AGGRESSIVE, aggressive);
		return Map.copyOf(allocations);
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	record PolicyDocument(
			@JsonProperty("asset_class_returns") Map<AssetClass, Double> assetClassReturns,
			@JsonProperty("horizon_buckets") List<BucketDocument> horizonBuckets
	) {
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	record BucketDocument(
			@JsonProperty("name") String name,
			@JsonProperty("max_years") Integer maxYears,
			@JsonProperty("allocations") Map<RiskTolerance, AllocationDocument> allocations
	) {
	}

	record AllocationDocument(
			@JsonProperty("equity") int equity,
			@JsonProperty("debt") int debt,
			@JsonProperty("gold") int gold
	) {
	}
}
