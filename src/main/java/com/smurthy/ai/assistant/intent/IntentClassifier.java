package com.smurthy.ai.assistant.intent;

/**
 * Scores a query against the fixed set of intent categories.
 */
public interface IntentClassifier {

    /**
     * @param query raw user query, possibly mixed-language
     * @return confidence per category in [0,1]; categories scoring zero are absent
     */
    IntentScores classify(String query);
}
