package com.phillippitts.multishot.service.metrics;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PricingTableTest {

    @Test
    void knownEnginesUseTheirOwnPrices() {
        assertThat(PricingTable.cost("gpt-4o-mini", 1000, 1000)).isCloseTo(0.00075, within(1e-12));
        assertThat(PricingTable.cost("CLAUDE-HAIKU", 2000, 0)).isCloseTo(0.0005, within(1e-12));
    }

    @Test
    void localEnginesAreFree() {
        assertThat(PricingTable.cost("tinyllama", 10_000, 10_000)).isZero();
        assertThat(PricingTable.estimate("local", 10_000)).isZero();
    }

    @Test
    void unknownEnginesUseDefaultPrice() {
        assertThat(PricingTable.priceFor("mistral-7b")).isEqualTo(PricingTable.DEFAULT);
    }

    @Test
    void estimateRoundsTokensUp() {
        // 5 chars -> 2 tokens at 0.002 per 1K
        assertThat(PricingTable.estimate("mistral-7b", 5)).isCloseTo(0.000004, within(1e-12));
        assertThat(PricingTable.estimate("mistral-7b", 0)).isZero();
    }
}
