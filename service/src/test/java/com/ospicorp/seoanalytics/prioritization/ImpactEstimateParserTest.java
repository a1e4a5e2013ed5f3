package com.ospicorp.seoanalytics.prioritization;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ImpactEstimateParserTest {

  @Test
  void readsCountsAdjacentToTheirUnit() {
    String estimate = "15 conversions and +200 clicks per month";

    assertEquals(200d, ImpactEstimateParser.clicks(estimate));
    assertEquals(15d, ImpactEstimateParser.conversions(estimate));
  }

  @Test
  void acceptsThousandsSeparatorsAndAnyCase() {
    assertEquals(1200d, ImpactEstimateParser.clicks("Estimated +1,200 Clicks"));
    assertEquals(300d, ImpactEstimateParser.clicks("+300 clicks, $15,000 revenue"));
  }

  @Test
  void missingCountsAreZero() {
    assertEquals(0d, ImpactEstimateParser.clicks("better rankings overall"));
    assertEquals(0d, ImpactEstimateParser.clicks(null));
    assertEquals(0d, ImpactEstimateParser.conversions(""));
  }

  @Test
  void dollarAmountsHonourThousandSuffix() {
    assertEquals(15000d, ImpactEstimateParser.dollars("$15,000 revenue"));
    assertEquals(12000d, ImpactEstimateParser.dollars("about $12k in value"));
    assertEquals(2500d, ImpactEstimateParser.dollars("$2.5k"));
    assertEquals(0d, ImpactEstimateParser.dollars("no money mentioned"));
  }

  @Test
  void detectsMonetaryMentions() {
    assertTrue(ImpactEstimateParser.mentionsMonetaryValue("Adds brand value"));
    assertTrue(ImpactEstimateParser.mentionsMonetaryValue("+$500"));
    assertTrue(ImpactEstimateParser.mentionsMonetaryValue("Revenue uplift"));
    assertFalse(ImpactEstimateParser.mentionsMonetaryValue("+50 clicks"));
    assertFalse(ImpactEstimateParser.mentionsMonetaryValue(null));
  }
}
