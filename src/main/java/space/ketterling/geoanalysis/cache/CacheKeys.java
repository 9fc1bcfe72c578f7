package space.ketterling.geoanalysis.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import space.ketterling.geoanalysis.geo.BoundingBox;
import space.ketterling.geoanalysis.plan.AnalysisPlan;
import space.ketterling.geoanalysis.plan.DatasetId;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Deterministic cache keys.
 *
 * <p>
 * An analysis key depends only on the analysis type, the set of dataset ids,
 * the time range and the location, serialised as JSON with a fixed field order
 * and sorted datasets, then hashed with SHA-256 and truncated to 16 hex chars.
 * </p>
 */
public final class CacheKeys {
    public static final String ANALYSIS = "analysis";
    public static final String EXPLANATION = "explanation";

    private static final int HASH_CHARS = 16;
    private static final ObjectMapper OM = new ObjectMapper();

    private CacheKeys() {
    }

    public static String analysisKey(AnalysisPlan plan) {
        return ANALYSIS + ":" + shortHash(canonicalJson(plan));
    }

    /**
     * Key for an explanation generated for a cached result and a user question.
     */
    public static String explanationKey(String resultKey, String query) {
        return EXPLANATION + ":" + shortHash(resultKey + ":" + query);
    }

    /**
     * Splits a key into namespace and hash.
     *
     * @throws IllegalArgumentException when the key has no {@code :}
     */
    public static ParsedKey parse(String key) {
        int idx = key == null ? -1 : key.indexOf(':');
        if (idx <= 0 || idx == key.length() - 1)
            throw new IllegalArgumentException("not a cache key: " + key);
        return new ParsedKey(key.substring(0, idx), key.substring(idx + 1));
    }

    static String canonicalJson(AnalysisPlan plan) {
        ObjectNode root = OM.createObjectNode();
        root.put("analysisType", plan.analysisType().wireName());
        ArrayNode datasets = root.putArray("datasets");
        List<String> sorted = plan.datasetIds().stream()
                .map(DatasetId::catalogId)
                .distinct()
                .sorted()
                .collect(Collectors.toList());
        sorted.forEach(datasets::add);
        ObjectNode range = root.putObject("timeRange");
        range.put("start", plan.timeRange().start().toString());
        range.put("end", plan.timeRange().end().toString());
        if (plan.location().isNamed()) {
            root.put("location", plan.location().name().orElseThrow());
        } else {
            BoundingBox b = plan.location().bbox().orElseThrow();
            ArrayNode arr = root.putArray("location");
            for (double v : b.toArray())
                arr.add(v);
        }
        try {
            return OM.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialise cache key material", e);
        }
    }

    private static String shortHash(String material) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(material.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, HASH_CHARS);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public record ParsedKey(String namespace, String hash) {
    }
}
