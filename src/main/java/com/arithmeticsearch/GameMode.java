package com.arithmeticsearch;

/** Game presets: how many numbers a hand holds and which value it must reach. */
public enum GameMode {
    TWENTY_FOUR("24", 4, 24),
    ONE_SIXTY_THREE("163", 6, 163);

    private final String label;
    private final int handSize;
    private final int target;

    GameMode(String label, int handSize, int target) {
        this.label = label;
        this.handSize = handSize;
        this.target = target;
    }

    public String label()   { return label; }
    public int handSize()   { return handSize; }
    public Fraction target() { return Fraction.of(target); }

    /** Looks a mode up by its label ("24" or "163"). */
    public static GameMode fromLabel(String label) {
        for (GameMode m : values()) {
            if (m.label.equals(label.trim())) return m;
        }
        throw new IllegalArgumentException("Unknown mode: " + label);
    }
}
