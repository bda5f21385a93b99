package com.graphrecall.model.graph;

public enum RetrievalStatus {
    ANSWERED,
    NO_INFORMATION
}
