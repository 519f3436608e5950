package org.rgen.runtime.model;

/**
 * States of the NPC behavior state machine.
 */
public enum NpcState {
    IDLE,
    WORKING,
    EATING,
    SLEEPING,
    SOCIALIZING,
    TRAVELING
}
