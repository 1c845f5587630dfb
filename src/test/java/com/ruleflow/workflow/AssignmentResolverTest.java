package com.ruleflow.workflow;

import com.ruleflow.collaborator.UserDirectory;
import com.ruleflow.config.RuleflowProperties;
import com.ruleflow.exception.AssignmentException;
import com.ruleflow.model.ApproverGroup;
import com.ruleflow.model.AssignmentRule;
import com.ruleflow.model.AssignmentType;
import com.ruleflow.repository.ApproverGroupRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AssignmentResolverTest {

    private static final String TENANT = "acme";

    @Mock private UserDirectory userDirectory;
    @Mock private ApproverGroupRepository groupRepository;

    private RuleflowProperties properties;
    private AssignmentResolver resolver;
    private ApproverGroup group;

    @BeforeEach
    void setUp() {
        properties = new RuleflowProperties();
        resolver = new AssignmentResolver(userDirectory, groupRepository, properties);
        group = ApproverGroup.builder()
                .id(UUID.randomUUID())
                .tenantId(TENANT)
                .name("reviewers")
                .memberIds(new ArrayList<>(List.of("ana", "ben", "cho", "dev")))
                .build();
    }

    private AssignmentRule rule(AssignmentType type) {
        return AssignmentRule.builder().type(type).groupId(group.getId().toString()).build();
    }

    /** Backs the cursor queries with an in-memory compare-and-swap counter. */
    private AtomicLong stubCursor(long start) {
        AtomicLong cursor = new AtomicLong(start);
        when(groupRepository.findByIdAndTenantId(group.getId(), TENANT)).thenReturn(Optional.of(group));
        when(groupRepository.findRotationCursor(group.getId())).thenAnswer(inv -> Optional.of(cursor.get()));
        when(groupRepository.advanceCursor(eq(group.getId()), anyLong())).thenAnswer(inv -> {
            long expected = inv.getArgument(1);
            return cursor.compareAndSet(expected, expected + 1) ? 1 : 0;
        });
        return cursor;
    }

    @Nested
    @DisplayName("Round robin")
    class RoundRobin {

        @Test
        @DisplayName("M consecutive picks on an M-member group yield every member once, in order")
        void sequentialPicksVisitEveryMember() {
            stubCursor(0);

            List<String> picks = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                picks.add(resolver.resolve(TENANT, rule(AssignmentType.ROUND_ROBIN)).assignedTo());
            }

            assertEquals(List.of("ana", "ben", "cho", "dev"), picks);
        }

        @Test
        @DisplayName("Cursor wraps around the member list")
        void cursorWraps() {
            stubCursor(9);

            assertEquals("ben", resolver.resolve(TENANT, rule(AssignmentType.ROUND_ROBIN)).assignedTo());
        }

        @Test
        @DisplayName("Concurrent picks still hand each member out exactly once")
        void concurrentPicksArePermutation() throws Exception {
            properties.getAssignment().setMaxRotationAttempts(1000);
            AtomicLong cursor = stubCursor(0);
            int members = group.getMemberIds().size();

            ExecutorService pool = Executors.newFixedThreadPool(members);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<String>> futures = new ArrayList<>();
            for (int i = 0; i < members; i++) {
                Callable<String> pick = () -> {
                    start.await();
                    return resolver.resolve(TENANT, rule(AssignmentType.ROUND_ROBIN)).assignedTo();
                };
                futures.add(pool.submit(pick));
            }
            start.countDown();

            List<String> picks = Collections.synchronizedList(new ArrayList<>());
            for (Future<String> future : futures) {
                picks.add(future.get(5, TimeUnit.SECONDS));
            }
            pool.shutdown();

            assertEquals(members, cursor.get());
            assertEquals(List.of("ana", "ben", "cho", "dev"), picks.stream().sorted().toList());
        }

        @Test
        @DisplayName("Gives up after the configured number of lost compare-and-swap attempts")
        void givesUpAfterMaxAttempts() {
            properties.getAssignment().setMaxRotationAttempts(3);
            when(groupRepository.findByIdAndTenantId(group.getId(), TENANT)).thenReturn(Optional.of(group));
            when(groupRepository.findRotationCursor(group.getId())).thenReturn(Optional.of(0L));
            when(groupRepository.advanceCursor(group.getId(), 0L)).thenReturn(0);

            assertThrows(AssignmentException.class, () -> resolver.resolve(TENANT, rule(AssignmentType.ROUND_ROBIN)));
            verify(groupRepository, times(3)).advanceCursor(group.getId(), 0L);
        }
    }

    @Nested
    @DisplayName("Other assignment types")
    class OtherTypes {

        @Test
        @DisplayName("ROLE queues the request for every holder of the role")
        void role() {
            when(userDirectory.findUsersByRole(TENANT, "compliance_officer")).thenReturn(List.of("kim", "lee"));

            Assignment assignment = resolver.resolve(TENANT,
                    AssignmentRule.builder().type(AssignmentType.ROLE).role("compliance_officer").build());

            assertNull(assignment.assignedTo());
            assertEquals("role:compliance_officer", assignment.queue());
            assertEquals(List.of("kim", "lee"), assignment.candidates());
        }

        @Test
        @DisplayName("ROLE nobody holds is an assignment failure")
        void emptyRole() {
            when(userDirectory.findUsersByRole(TENANT, "auditor")).thenReturn(List.of());

            assertThrows(AssignmentException.class, () -> resolver.resolve(TENANT,
                    AssignmentRule.builder().type(AssignmentType.ROLE).role("auditor").build()));
        }

        @Test
        @DisplayName("USER assigns directly")
        void user() {
            Assignment assignment = resolver.resolve(TENANT,
                    AssignmentRule.builder().type(AssignmentType.USER).userId("zoe").build());

            assertEquals("zoe", assignment.assignedTo());
            verifyNoInteractions(groupRepository, userDirectory);
        }

        @Test
        @DisplayName("GROUP queues the request for all members without touching the cursor")
        void group() {
            when(groupRepository.findByIdAndTenantId(group.getId(), TENANT)).thenReturn(Optional.of(group));

            Assignment assignment = resolver.resolve(TENANT, rule(AssignmentType.GROUP));

            assertEquals("group:" + group.getId(), assignment.queue());
            assertEquals(group.getMemberIds(), assignment.candidates());
            verify(groupRepository, never()).advanceCursor(any(), anyLong());
        }

        @Test
        @DisplayName("Unknown or empty groups are assignment failures")
        void badGroups() {
            assertThrows(AssignmentException.class, () -> resolver.resolve(TENANT,
                    AssignmentRule.builder().type(AssignmentType.GROUP).groupId("not-a-uuid").build()));

            group.setMemberIds(new ArrayList<>());
            when(groupRepository.findByIdAndTenantId(group.getId(), TENANT)).thenReturn(Optional.of(group));
            assertThrows(AssignmentException.class, () -> resolver.resolve(TENANT, rule(AssignmentType.ROUND_ROBIN)));
        }

        @Test
        @DisplayName("No rule means nobody is assigned")
        void noRule() {
            assertEquals(Assignment.none(), resolver.resolve(TENANT, null));
        }
    }
}
