package com.compass.evidencecollector.model;

public enum EvidenceType {
    DOCUMENT,
    AUTOMATED_COLLECTION
}
