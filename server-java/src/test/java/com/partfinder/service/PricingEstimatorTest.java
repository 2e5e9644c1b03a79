package com.partfinder.service;

import com.partfinder.model.Part;
import com.partfinder.model.PriceEstimate;
import com.partfinder.model.RankedStore;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class PricingEstimatorTest {

    private final PricingEstimator estimator = new PricingEstimator();

    private static RankedStore store(String name, int likelihood) {
        return RankedStore.builder().id(name).name(name).likelihood(likelihood).build();
    }

    @Test
    void sealAtBigBoxChainWithHighLikelihood() {
        PriceEstimate price = estimator.estimate(TestStores.DOOR_SEAL, store("The Home Depot", 90));

        assertEquals(new BigDecimal("26"), price.getAmount());
        assertEquals(new BigDecimal("22"), price.getRangeLow());
        assertEquals(new BigDecimal("30"), price.getRangeHigh());
        assertEquals("USD", price.getCurrency());
        assertEquals("$26", price.getFormatted());
        assertEquals("$22-$30", price.getRangeFormatted());
    }

    @Test
    void controlBoardAtSpecialtyStoreWithLowLikelihood() {
        Part board = Part.builder().name("Main Control Board").category("Control Boards").build();

        PriceEstimate price = estimator.estimate(board, store("Appliance Parts Center", 65));

        assertEquals(new BigDecimal("139"), price.getAmount());
        assertEquals(new BigDecimal("118"), price.getRangeLow());
        assertEquals(new BigDecimal("160"), price.getRangeHigh());
    }

    @Test
    void unknownCategoryUsesDefaultBasePrice() {
        Part part = Part.builder().name("Knob").category("").build();

        PriceEstimate price = estimator.estimate(part, store("Corner Store", 75));

        assertEquals(new BigDecimal("35"), price.getAmount());
    }

    @Test
    void nameIsUsedWhenCategoryIsMissing() {
        Part filter = Part.builder().name("Refrigerator Water Filter").build();

        assertEquals(25, PricingEstimator.basePrice(filter));
    }

    @Test
    void sameInputsGiveSameEstimate() {
        RankedStore store = store("Lowe's Home Improvement", 80);
        assertEquals(estimator.estimate(TestStores.DOOR_SEAL, store), estimator.estimate(TestStores.DOOR_SEAL, store));
    }
}
