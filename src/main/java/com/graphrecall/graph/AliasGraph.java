package com.graphrecall.graph;

import com.graphrecall.exception.AliasConflictException;
import com.graphrecall.model.entity.Entity;
import com.graphrecall.model.entity.EntityAlias;
import com.graphrecall.model.graph.AliasAction;
import com.graphrecall.model.graph.AliasOutcome;
import com.graphrecall.repository.AliasRepository;
import com.graphrecall.repository.EntityRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.UUID;

/**
 * Equivalence classes over entities that name the same referent.
 *
 * <p>Union without path compression: a merge moves every member of the smaller
 * group (the second on a tie) into the other and deletes the emptied group, so
 * merge cost is the size of the losing group. Alias groups hold a handful of
 * names, which keeps that cheap.</p>
 *
 * <p>Each call runs in one transaction holding a per-user advisory lock, so two
 * merges touching the same user's entities cannot interleave.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AliasGraph {

    private final AliasRepository aliasRepository;
    private final EntityRepository entityRepository;

    @Transactional
    public Mono<AliasOutcome> handleAlias(Entity source, Entity target) {
        if (!source.getUserId().equals(target.getUserId())) {
            return Mono.error(new AliasConflictException(
                    "Cannot alias '" + source.getName() + "' and '" + target.getName() + "' across users"));
        }
        if (source.getId().equals(target.getId())) {
            return Mono.just(AliasOutcome.builder().action(AliasAction.IGNORED).build());
        }

        UUID userId = source.getUserId();
        return aliasRepository.lockUser(userId)
                .then(Mono.zip(membership(source.getId()), membership(target.getId())))
                .flatMap(memberships -> dispatch(userId, source, target, memberships.getT1(), memberships.getT2()))
                .doOnNext(outcome -> log.info("Alias '{}' = '{}': {} (group {})",
                        source.getName(), target.getName(), outcome.getAction(), outcome.getGroupId()));
    }

    /**
     * Ids of every entity grouped with {@code entityId}, itself included. An ungrouped
     * entity is its own single member.
     */
    public Flux<UUID> membersOf(UUID entityId) {
        return aliasRepository.findMembership(entityId)
                .flatMapMany(membership -> aliasRepository.findMembers(membership.getAliasGroupId()))
                .map(EntityAlias::getEntityId)
                .switchIfEmpty(Flux.just(entityId));
    }

    /**
     * Names of the entities sharing {@code entity}'s alias group, excluding the entity itself.
     */
    public Flux<String> aliasNames(Entity entity) {
        return membersOf(entity.getId())
                .filter(id -> !id.equals(entity.getId()))
                .concatMap(id -> entityRepository.findById(entity.getUserId(), id))
                .map(Entity::getName);
    }

    private Mono<AliasOutcome> dispatch(UUID userId, Entity source, Entity target,
                                        Optional<EntityAlias> sourceMembership,
                                        Optional<EntityAlias> targetMembership) {
        if (sourceMembership.isEmpty() && targetMembership.isEmpty()) {
            return aliasRepository.createGroup(userId, source.getId())
                    .flatMap(group -> aliasRepository.addMember(userId, group.getId(), source.getId())
                            .then(aliasRepository.addMember(userId, group.getId(), target.getId()))
                            .thenReturn(outcome(AliasAction.CREATED_GROUP, group.getId())));
        }
        if (sourceMembership.isEmpty() || targetMembership.isEmpty()) {
            UUID groupId = sourceMembership.orElseGet(targetMembership::get).getAliasGroupId();
            UUID joining = sourceMembership.isEmpty() ? source.getId() : target.getId();
            return aliasRepository.addMember(userId, groupId, joining)
                    .thenReturn(outcome(AliasAction.JOINED_GROUP, groupId));
        }

        UUID first = sourceMembership.get().getAliasGroupId();
        UUID second = targetMembership.get().getAliasGroupId();
        if (first.equals(second)) {
            return Mono.just(outcome(AliasAction.ALREADY_GROUPED, first));
        }
        return Mono.zip(aliasRepository.countMembers(first), aliasRepository.countMembers(second))
                .flatMap(sizes -> {
                    boolean secondWins = sizes.getT2() > sizes.getT1();
                    UUID survivor = secondWins ? second : first;
                    UUID loser = secondWins ? first : second;
                    return merge(loser, survivor);
                });
    }

    private Mono<AliasOutcome> merge(UUID loser, UUID survivor) {
        return aliasRepository.reassignMembers(loser, survivor)
                .flatMap(moved -> aliasRepository.deleteGroup(loser)
                        .thenReturn(AliasOutcome.builder()
                                .action(AliasAction.MERGED_GROUPS)
                                .groupId(survivor)
                                .removedGroupId(loser)
                                .movedMembers(moved.intValue())
                                .build()));
    }

    private Mono<Optional<EntityAlias>> membership(UUID entityId) {
        return aliasRepository.findMembership(entityId)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty());
    }

    private static AliasOutcome outcome(AliasAction action, UUID groupId) {
        return AliasOutcome.builder().action(action).groupId(groupId).build();
    }
}
