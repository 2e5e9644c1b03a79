package com.partfinder.service;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.partfinder.client.CancellationToken;
import com.partfinder.client.ClassificationOracle;
import com.partfinder.client.OracleJsonExtractor;
import com.partfinder.config.HeuristicWeights;
import com.partfinder.config.StoreLocatorProperties;
import com.partfinder.model.CandidateStore;
import com.partfinder.model.LikelihoodAssessment;
import com.partfinder.model.LikelihoodSource;
import com.partfinder.model.Part;
import com.partfinder.model.StoreTypeTag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Scores how likely each candidate is to stock the part and drops the unlikely ones.
 * Uses the classification oracle when it is configured and answers usefully,
 * otherwise the rule table in {@link HeuristicWeights}.
 */
@Service
@Slf4j
public class AvailabilityVerifier {

    private static final String PROMPT = """
        You are an expert in appliance parts retail. Determine which of these stores would ACTUALLY carry this specific appliance part.

        Part: %s
        Category: %s

        Stores to evaluate:
        %s

        For each store, give a likelihood score (0-100) that it carries this SPECIFIC part. Be strict:
        - High scores only for stores that sell appliance parts (home improvement chains, appliance repair, parts stores)
        - Restaurants, clothing stores, gas stations, banks and similar businesses get 0-10

        Respond with a JSON array only, for example:
        [{"index": 1, "likelihood": 85, "reason": "Major home improvement store with appliance parts section"}]

        Only include stores with likelihood >= %d.
        """;

    private final ClassificationOracle oracle;
    private final HeuristicWeights weights;
    private final Gson gson;
    private final int oracleCandidateLimit;
    private final Pattern excludedNamePattern;

    public AvailabilityVerifier(ClassificationOracle oracle, HeuristicWeights weights, Gson gson,
                                StoreLocatorProperties properties) {
        this.oracle = oracle;
        this.weights = weights;
        this.gson = gson;
        this.oracleCandidateLimit = properties.getSearch().getOracleCandidateLimit();
        this.excludedNamePattern = wordPattern(weights.getExcludedNameWords());
    }

    public List<CandidateStore> verify(List<CandidateStore> candidates, Part part) {
        return verify(candidates, part, CancellationToken.none());
    }

    /**
     * Every returned candidate carries a likelihood of at least the configured
     * minimum and a short reason. Candidates that arrive already scored (synthetic
     * stores) are kept as they are.
     */
    public List<CandidateStore> verify(List<CandidateStore> candidates, Part part, CancellationToken token) {
        return confirm(assess(candidates, part, token));
    }

    /**
     * The part of verification that does not depend on where the search started.
     * Oracle verdicts and preset scores are final. Heuristic candidates are kept if
     * they could reach the minimum at some distance; {@link #confirm} settles them
     * once their distance from the actual origin is known.
     */
    public List<CandidateStore> assess(List<CandidateStore> candidates, Part part, CancellationToken token) {
        List<CandidateStore> assessed = new ArrayList<>();
        List<CandidateStore> unscored = new ArrayList<>();
        for (CandidateStore candidate : candidates) {
            if (candidate.hasLikelihood()) {
                if (candidate.getLikelihood() >= weights.getMinLikelihood()) {
                    assessed.add(candidate);
                }
            } else {
                unscored.add(candidate);
            }
        }
        if (unscored.isEmpty()) {
            return assessed;
        }

        List<CandidateStore> byOracle = oracle.isAvailable() ? verifyWithOracle(unscored, part, token) : List.of();
        if (byOracle.isEmpty()) {
            assessed.addAll(assessWithHeuristics(unscored));
        } else {
            assessed.addAll(byOracle);
            // the oracle only sees the first few; score the rest locally
            if (unscored.size() > oracleCandidateLimit) {
                assessed.addAll(assessWithHeuristics(unscored.subList(oracleCandidateLimit, unscored.size())));
            }
        }
        log.info("Assessed {} of {} candidates for '{}'", assessed.size(), candidates.size(), part.getName());
        return assessed;
    }

    /**
     * Rescores heuristic candidates against their current distance and drops those
     * below the minimum. Other candidates pass through unchanged.
     */
    public List<CandidateStore> confirm(List<CandidateStore> candidates) {
        List<CandidateStore> confirmed = new ArrayList<>(candidates.size());
        for (CandidateStore candidate : candidates) {
            if (candidate.getLikelihoodSource() != LikelihoodSource.HEURISTIC) {
                confirmed.add(candidate);
                continue;
            }
            HeuristicScore score = score(candidate);
            if (score.likelihood >= weights.getMinLikelihood()) {
                confirmed.add(candidate.withLikelihood(score.likelihood, score.reason, LikelihoodSource.HEURISTIC));
            }
        }
        return confirmed;
    }

    List<CandidateStore> verifyWithOracle(List<CandidateStore> candidates, Part part, CancellationToken token) {
        List<CandidateStore> presented = candidates.subList(0, Math.min(oracleCandidateLimit, candidates.size()));
        try {
            String answer = oracle.complete(buildPrompt(presented, part), 800, token);
            JsonArray array = OracleJsonExtractor.firstArray(answer, OracleJsonExtractor::containsObject);
            List<CandidateStore> accepted = applyAssessments(presented, parseAssessments(array));
            if (accepted.isEmpty()) {
                log.info("Oracle accepted no stores for '{}', using heuristic backup", part.getName());
            }
            return accepted;
        } catch (IOException e) {
            log.warn("Oracle availability check failed, using heuristics: {}", e.getMessage());
            return List.of();
        }
    }

    String buildPrompt(List<CandidateStore> presented, Part part) {
        StringBuilder stores = new StringBuilder();
        for (int i = 0; i < presented.size(); i++) {
            CandidateStore store = presented.get(i);
            String types = store.getTypes().isEmpty() ? "Unknown" : String.join(", ", store.getTypes());
            stores.append(i + 1).append(". ").append(store.getName())
                    .append(" - ").append(store.getAddress())
                    .append(" (Types: ").append(types);
            if (store.getDistanceMiles() != null) {
                stores.append("; ").append(DistanceCalculator.formatDistance(store.getDistanceMiles()));
            }
            stores.append(")\n");
        }
        String category = part.hasCategory() ? part.getCategory() : "Unknown";
        return String.format(PROMPT, part.getName(), category, stores.toString().trim(), weights.getMinLikelihood());
    }

    /**
     * Schema check for the oracle's answer: entries that are not objects with a
     * numeric index and likelihood are skipped.
     */
    List<LikelihoodAssessment> parseAssessments(JsonArray array) {
        List<LikelihoodAssessment> assessments = new ArrayList<>();
        for (JsonElement element : array) {
            if (!element.isJsonObject()) {
                continue;
            }
            try {
                LikelihoodAssessment assessment = gson.fromJson(element, LikelihoodAssessment.class);
                if (assessment.getIndex() != null && assessment.getLikelihood() != null) {
                    assessments.add(assessment);
                }
            } catch (JsonParseException e) {
                log.debug("Skipping malformed assessment {}: {}", element, e.getMessage());
            }
        }
        return assessments;
    }

    private List<CandidateStore> applyAssessments(List<CandidateStore> presented, List<LikelihoodAssessment> assessments) {
        Map<Integer, CandidateStore> accepted = new LinkedHashMap<>();
        for (LikelihoodAssessment assessment : assessments) {
            int index = assessment.getIndex() - 1;
            int likelihood = assessment.getLikelihood();
            if (index < 0 || index >= presented.size() || accepted.containsKey(index)) {
                continue;
            }
            if (likelihood < weights.getMinLikelihood() || likelihood > 100) {
                continue;
            }
            String reason = assessment.getReason() == null || assessment.getReason().isBlank()
                    ? "Assessed by AI" : assessment.getReason();
            accepted.put(index, presented.get(index).withLikelihood(likelihood, reason, LikelihoodSource.ORACLE));
        }
        return new ArrayList<>(accepted.values());
    }

    private List<CandidateStore> assessWithHeuristics(List<CandidateStore> candidates) {
        List<CandidateStore> kept = new ArrayList<>();
        for (CandidateStore candidate : candidates) {
            HeuristicScore best = score(candidate.toBuilder().distanceMiles(0.0).build());
            if (best.likelihood >= weights.getMinLikelihood()) {
                HeuristicScore score = score(candidate);
                kept.add(candidate.withLikelihood(score.likelihood, score.reason, LikelihoodSource.HEURISTIC));
            }
        }
        return kept;
    }

    public int heuristicLikelihood(CandidateStore candidate) {
        return score(candidate).likelihood;
    }

    HeuristicScore score(CandidateStore candidate) {
        String name = candidate.lowerCaseName().replace('’', '\'');
        Set<String> types = candidate.getTypes().stream()
                .map(t -> t.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());

        String exclusion = exclusionHit(name, types);
        if (exclusion != null) {
            return new HeuristicScore(0, "Heuristic evaluation - excluded business type (" + exclusion + ")");
        }

        int likelihood = weights.getBaseScore();
        List<String> signals = new ArrayList<>();

        for (HeuristicWeights.KeywordGroup group : weights.getKeywordGroups()) {
            String bestKeyword = null;
            int best = 0;
            for (Map.Entry<String, Integer> keyword : group.getKeywords().entrySet()) {
                if (name.contains(keyword.getKey()) && keyword.getValue() > best) {
                    best = keyword.getValue();
                    bestKeyword = keyword.getKey();
                }
            }
            if (bestKeyword != null) {
                likelihood += best;
                signals.add("'" + bestKeyword + "'");
            }
        }

        Set<StoreTypeTag> tags = new HashSet<>();
        types.forEach(t -> StoreTypeTag.fromValue(t).ifPresent(tags::add));
        for (StoreTypeTag tag : tags) {
            Integer weight = weights.getTagWeights().get(tag);
            if (weight != null) {
                likelihood += weight;
                signals.add(tag.tag());
            }
        }

        if (candidate.getDistanceMiles() != null) {
            for (HeuristicWeights.ProximityTier tier : weights.getProximityTiers()) {
                if (candidate.getDistanceMiles() <= tier.getMaxMiles()) {
                    likelihood += tier.getBonus();
                    signals.add("within " + tier.getMaxMiles() + " mi");
                    break;
                }
            }
        }

        likelihood = Math.max(0, Math.min(100, likelihood));
        String reason = signals.isEmpty()
                ? "Heuristic evaluation - no appliance parts signals"
                : "Heuristic evaluation - " + String.join(", ", signals);
        return new HeuristicScore(likelihood, reason);
    }

    private String exclusionHit(String name, Set<String> types) {
        Matcher matcher = excludedNamePattern.matcher(name);
        if (matcher.find()) {
            return matcher.group();
        }
        for (String type : types) {
            if (weights.getExcludedTypes().contains(type)) {
                return type;
            }
            for (String prefix : weights.getExcludedTypePrefixes()) {
                if (type.startsWith(prefix)) {
                    return type;
                }
            }
        }
        return null;
    }

    private static Pattern wordPattern(Set<String> words) {
        if (words.isEmpty()) {
            return Pattern.compile("(?!)");
        }
        String alternation = words.stream()
                .sorted((a, b) -> Integer.compare(b.length(), a.length()))
                .map(w -> Pattern.quote(w.toLowerCase(Locale.ROOT)))
                .collect(Collectors.joining("|"));
        return Pattern.compile("(?<![\\p{L}\\p{N}])(?:" + alternation + ")(?![\\p{L}\\p{N}])");
    }

    static final class HeuristicScore {
        final int likelihood;
        final String reason;

        HeuristicScore(int likelihood, String reason) {
            this.likelihood = likelihood;
            this.reason = reason;
        }
    }
}
