package com.blogicum.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class IdGeneratorConfigTest {

    @Test
    void normalize5Bits_ShouldKeepValuesInRange() {
        assertEquals(0, IdGeneratorConfig.normalize5Bits(0));
        assertEquals(31, IdGeneratorConfig.normalize5Bits(31));
        assertEquals(0, IdGeneratorConfig.normalize5Bits(32));
        assertEquals(1, IdGeneratorConfig.normalize5Bits(33));
    }
}
