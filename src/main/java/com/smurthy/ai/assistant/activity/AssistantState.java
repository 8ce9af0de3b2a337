package com.smurthy.ai.assistant.activity;

/**
 * Visible state of the assistant, as shown by the status indicator.
 */
public enum AssistantState {
    IDLE,
    LISTENING,
    THINKING,
    SPEAKING,
    WRITING,
    ERROR,
    SLEEPING
}
