package org.rgen.runtime.model;

/**
 * Energy, hunger and mood of an NPC. Every value is clamped to [0, 100] on write.
 * Higher hunger means hungrier.
 */
public final class Needs {

    public static final double MIN = 0.0;
    public static final double MAX = 100.0;

    private double energy;
    private double hunger;
    private double mood;

    public Needs(double energy, double hunger, double mood) {
        setEnergy(energy);
        setHunger(hunger);
        setMood(mood);
    }

    public static double clamp(double value) {
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("Need value must not be NaN");
        }
        return Math.max(MIN, Math.min(MAX, value));
    }

    public double getEnergy() {
        return energy;
    }

    public void setEnergy(double energy) {
        this.energy = clamp(energy);
    }

    public double getHunger() {
        return hunger;
    }

    public void setHunger(double hunger) {
        this.hunger = clamp(hunger);
    }

    public double getMood() {
        return mood;
    }

    public void setMood(double mood) {
        this.mood = clamp(mood);
    }

    @Override
    public String toString() {
        return String.format("Needs{energy=%.2f, hunger=%.2f, mood=%.2f}", energy, hunger, mood);
    }
}
