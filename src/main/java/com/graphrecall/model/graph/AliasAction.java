package com.graphrecall.model.graph;

/**
 * What {@code handleAlias} did to the alias partition.
 */
public enum AliasAction {
    CREATED_GROUP,
    JOINED_GROUP,
    MERGED_GROUPS,
    ALREADY_GROUPED,
    IGNORED
}
