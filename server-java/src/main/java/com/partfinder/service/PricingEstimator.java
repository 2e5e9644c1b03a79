package com.partfinder.service;

import com.partfinder.model.Part;
import com.partfinder.model.PriceEstimate;
import com.partfinder.model.RankedStore;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Rough shelf-price estimate for a part at a given store. Deterministic: the same
 * part and store always produce the same estimate.
 */
@Service
public class PricingEstimator {

    static final int DEFAULT_BASE_PRICE = 35;
    static final double RANGE_SPREAD = 0.15;

    // First matching keyword wins, so more specific keywords come first.
    private static final Map<String, Integer> CATEGORY_BASE_PRICES = new LinkedHashMap<>();

    static {
        CATEGORY_BASE_PRICES.put("control", 120);
        CATEGORY_BASE_PRICES.put("board", 120);
        CATEGORY_BASE_PRICES.put("motor", 85);
        CATEGORY_BASE_PRICES.put("pump", 85);
        CATEGORY_BASE_PRICES.put("drive", 85);
        CATEGORY_BASE_PRICES.put("heating", 55);
        CATEGORY_BASE_PRICES.put("element", 55);
        CATEGORY_BASE_PRICES.put("ice maker", 45);
        CATEGORY_BASE_PRICES.put("seal", 30);
        CATEGORY_BASE_PRICES.put("gasket", 30);
        CATEGORY_BASE_PRICES.put("filter", 25);
    }

    private static final List<String> BIG_BOX_NAMES = List.of("home depot", "lowe");
    private static final List<String> SPECIALTY_NAMES = List.of("parts", "appliance");

    public PriceEstimate estimate(Part part, RankedStore store) {
        double multiplier = likelihoodMultiplier(store.getLikelihood()) * storeMultiplier(store.getName());
        BigDecimal amount = wholeDollars(basePrice(part) * multiplier);

        return PriceEstimate.builder()
                .amount(amount)
                .currency("USD")
                .rangeLow(wholeDollars(amount.doubleValue() * (1 - RANGE_SPREAD)))
                .rangeHigh(wholeDollars(amount.doubleValue() * (1 + RANGE_SPREAD)))
                .build();
    }

    static int basePrice(Part part) {
        String text = ((part.getCategory() == null ? "" : part.getCategory()) + " "
                + (part.getName() == null ? "" : part.getName())).toLowerCase(Locale.ROOT);
        // category decides when present, the name is only a hint
        if (part.hasCategory()) {
            Integer byCategory = lookup(part.getCategory().toLowerCase(Locale.ROOT));
            if (byCategory != null) {
                return byCategory;
            }
        }
        Integer byName = lookup(text);
        return byName != null ? byName : DEFAULT_BASE_PRICE;
    }

    static double likelihoodMultiplier(int likelihood) {
        if (likelihood >= 85) {
            return 0.9;
        }
        if (likelihood >= 70) {
            return 1.0;
        }
        return 1.1;
    }

    static double storeMultiplier(String storeName) {
        String name = storeName == null ? "" : storeName.toLowerCase(Locale.ROOT);
        if (BIG_BOX_NAMES.stream().anyMatch(name::contains)) {
            return 0.95;
        }
        if (SPECIALTY_NAMES.stream().anyMatch(name::contains)) {
            return 1.05;
        }
        return 1.0;
    }

    private static Integer lookup(String text) {
        for (Map.Entry<String, Integer> entry : CATEGORY_BASE_PRICES.entrySet()) {
            if (text.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static BigDecimal wholeDollars(double value) {
        return BigDecimal.valueOf(value).setScale(0, RoundingMode.HALF_UP);
    }
}
