package com.plagiarism.engine.config;

import com.plagiarism.common.exception.ConfigurationException;
import com.plagiarism.engine.filter.FilterMode;
import com.plagiarism.engine.filter.RankMetric;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EnginePropertiesTest {

    @Test
    void defaultsAreValid() {
        EngineProperties properties = new EngineProperties();

        assertDoesNotThrow(properties::validate);
        assertEquals(FilterMode.THRESHOLD, properties.getFilterMode());
        assertEquals(0.8, properties.getSourceThreshold());
        assertEquals(0.7, properties.getHexThreshold());
        assertEquals(0.85, properties.getFallbackThreshold());
        assertEquals(RankMetric.AGGREGATE, properties.getRankMetric());
    }

    @Test
    void thresholdOutsideUnitIntervalIsRejected() {
        EngineProperties properties = new EngineProperties();
        properties.setSourceThreshold(1.2);

        ConfigurationException e = assertThrows(ConfigurationException.class, properties::validate);
        assertEquals("CONFIG_ERROR", e.getErrorCode());
    }

    @Test
    void topPercentMustBePositive() {
        EngineProperties properties = new EngineProperties();
        properties.setTopPercent(0.0);
        assertThrows(ConfigurationException.class, properties::validate);

        properties.setTopPercent(1.0);
        assertDoesNotThrow(properties::validate);

        properties.setTopPercent(1.5);
        assertThrows(ConfigurationException.class, properties::validate);
    }

    @Test
    void missingFilterModeIsRejected() {
        EngineProperties properties = new EngineProperties();
        properties.setFilterMode(null);

        assertThrows(ConfigurationException.class, properties::validate);
    }

    @Test
    void invalidHexRangeIsRejected() {
        EngineProperties properties = new EngineProperties();
        properties.getAnomaly().setMinHexBytes(100);
        properties.getAnomaly().setMaxHexBytes(10);

        assertThrows(ConfigurationException.class, properties::validate);
    }

    @Test
    void parallelismMustBePositive() {
        EngineProperties properties = new EngineProperties();
        properties.setParallelism(0);

        assertThrows(ConfigurationException.class, properties::validate);
    }
}
