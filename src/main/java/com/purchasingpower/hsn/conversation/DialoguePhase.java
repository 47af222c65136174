package com.purchasingpower.hsn.conversation;

/**
 * Dialogue state between turns.
 */
public enum DialoguePhase {
    /**
     * No disambiguation pending.
     */
    IDLE,

    /**
     * A disambiguation prompt was issued and its options are stored.
     */
    AWAITING_SELECTION
}
