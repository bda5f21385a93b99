package com.graphrecall.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AliasOutcome {

    private AliasAction action;

    // Surviving group, null when ignored
    private UUID groupId;

    // Group deleted by a merge
    private UUID removedGroupId;

    private int movedMembers;
}
