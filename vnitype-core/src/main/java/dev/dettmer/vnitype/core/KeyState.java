package dev.dettmer.vnitype.core;

/**
 * Transition of a physical key.
 */
public enum KeyState {

    /** Key went down. The only state the engine acts on. */
    PRESS,

    /** Key went up. */
    RELEASE
}
