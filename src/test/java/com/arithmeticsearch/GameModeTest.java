package com.arithmeticsearch;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class GameModeTest {

    @Test
    public void presets() {
        assertEquals(4, GameMode.TWENTY_FOUR.handSize());
        assertEquals(Fraction.of(24), GameMode.TWENTY_FOUR.target());
        assertEquals(6, GameMode.ONE_SIXTY_THREE.handSize());
        assertEquals(Fraction.of(163), GameMode.ONE_SIXTY_THREE.target());
    }

    @Test
    public void lookupByLabel() {
        assertEquals(GameMode.TWENTY_FOUR, GameMode.fromLabel("24"));
        assertEquals(GameMode.ONE_SIXTY_THREE, GameMode.fromLabel(" 163 "));
        assertThrows(IllegalArgumentException.class, () -> GameMode.fromLabel("42"));
    }

    @Test
    public void explicitTargetOverridesPreset() {
        SolverConfig c = new SolverConfig.Builder()
                .mode(GameMode.TWENTY_FOUR)
                .target(Fraction.of(10))
                .addNumber(Fraction.of(1)).addNumber(Fraction.of(2))
                .addNumber(Fraction.of(3)).addNumber(Fraction.of(4))
                .build();
        assertEquals(Fraction.of(10), c.target);
    }
}
