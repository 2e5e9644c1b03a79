package com.partfinder.config;

import com.partfinder.model.StoreTypeTag;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Weight table for the heuristic availability scorer.
 *
 * <p>Keywords are grouped by what they signal. Within a group only the strongest
 * matching keyword counts; distinct groups add up. Any exclusion hit forces the
 * score to zero regardless of the positive signals.</p>
 */
@Value
@Builder(toBuilder = true)
public class HeuristicWeights {

    int baseScore;
    int minLikelihood;
    @Singular
    List<KeywordGroup> keywordGroups;
    @Singular
    Map<StoreTypeTag, Integer> tagWeights;
    @Singular
    List<ProximityTier> proximityTiers;
    @Singular
    Set<String> excludedNameWords;
    @Singular
    Set<String> excludedTypes;
    @Singular("excludedTypePrefix")
    Set<String> excludedTypePrefixes;

    @Value
    public static class KeywordGroup {
        String name;
        Map<String, Integer> keywords;
    }

    @Value
    public static class ProximityTier {
        double maxMiles;
        int bonus;
    }

    public static HeuristicWeights defaults() {
        return HeuristicWeights.builder()
                .baseScore(20)
                .minLikelihood(60)
                .keywordGroup(new KeywordGroup("parts-specialist", Map.of(
                        "appliance parts", 55,
                        "sears", 45,
                        "parts", 45)))
                .keywordGroup(new KeywordGroup("home-improvement-chain", Map.of(
                        "home depot", 40,
                        "lowe's", 40,
                        "lowes", 40,
                        "depot", 35,
                        "home improvement", 30)))
                .keywordGroup(new KeywordGroup("appliance", Map.of(
                        "appliance", 35)))
                .keywordGroup(new KeywordGroup("repair", Map.of(
                        "repair", 30)))
                .keywordGroup(new KeywordGroup("hardware", Map.of(
                        "ace hardware", 30,
                        "true value", 30,
                        "hardware", 25)))
                .tagWeight(StoreTypeTag.HARDWARE_STORE, 25)
                .tagWeight(StoreTypeTag.HOME_GOODS_STORE, 20)
                .tagWeight(StoreTypeTag.ELECTRONICS_STORE, 15)
                .proximityTier(new ProximityTier(1.0, 15))
                .proximityTier(new ProximityTier(2.0, 10))
                .proximityTier(new ProximityTier(3.0, 5))
                // food service
                .excludedNameWord("restaurant").excludedNameWord("food").excludedNameWord("foods")
                .excludedNameWord("pizza").excludedNameWord("burger").excludedNameWord("grill")
                .excludedNameWord("coffee").excludedNameWord("cafe").excludedNameWord("café")
                .excludedNameWord("bakery").excludedNameWord("diner").excludedNameWord("bar")
                // clothing, beauty
                .excludedNameWord("clothing").excludedNameWord("apparel").excludedNameWord("boutique")
                .excludedNameWord("beauty").excludedNameWord("salon").excludedNameWord("spa")
                .excludedNameWord("nails").excludedNameWord("barber")
                // fuel, money, pharmacy
                .excludedNameWord("gas").excludedNameWord("fuel").excludedNameWord("bank")
                .excludedNameWord("credit union").excludedNameWord("pharmacy").excludedNameWord("drugstore")
                // automotive
                .excludedNameWord("auto").excludedNameWord("automotive").excludedNameWord("autozone")
                .excludedNameWord("car wash")
                // hospitality, worship, education, health
                .excludedNameWord("hotel").excludedNameWord("motel").excludedNameWord("inn")
                .excludedNameWord("church").excludedNameWord("temple").excludedNameWord("mosque")
                .excludedNameWord("school").excludedNameWord("university").excludedNameWord("hospital")
                .excludedNameWord("gym").excludedNameWord("fitness")
                .excludedType("restaurant").excludedType("food").excludedType("cafe")
                .excludedType("bar").excludedType("bakery").excludedType("meal_takeaway")
                .excludedType("meal_delivery").excludedType("coffee_shop")
                .excludedType("clothing_store").excludedType("shoe_store")
                .excludedType("beauty_salon").excludedType("hair_care").excludedType("spa")
                .excludedType("gas_station").excludedType("bank").excludedType("atm")
                .excludedType("pharmacy").excludedType("drugstore")
                .excludedType("auto_parts_store")
                .excludedType("lodging").excludedType("hotel").excludedType("motel")
                .excludedType("church").excludedType("place_of_worship").excludedType("hindu_temple")
                .excludedType("mosque").excludedType("synagogue")
                .excludedType("school").excludedType("primary_school").excludedType("secondary_school")
                .excludedType("university").excludedType("hospital").excludedType("gym")
                .excludedTypePrefix("car_")
                .build();
    }
}
