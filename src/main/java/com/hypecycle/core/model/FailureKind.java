package com.hypecycle.core.model;

/**
 * Why a classification run ended in {@link ClassificationStatus#FAILED}.
 */
public enum FailureKind {
    INSUFFICIENT_DATA,
    CLASSIFICATION_FAILED,
    SYNTHESIS_FAILED,
    PERSISTENCE_FAILED
}
