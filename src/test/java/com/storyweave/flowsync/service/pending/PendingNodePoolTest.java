package com.storyweave.flowsync.service.pending;

import com.storyweave.flowsync.dto.graph.FlowNodeData;
import com.storyweave.flowsync.dto.graph.FlowNodeType;
import com.storyweave.flowsync.dto.graph.Position;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PendingNodePoolTest {

    private static final Instant CREATED_AT = Instant.parse("2024-05-01T10:00:00Z");
    private static final Instant LATER = Instant.parse("2024-05-01T10:05:00Z");

    @Mock
    private Clock clock;

    private PendingNodePool pool;

    @BeforeEach
    void setUp() {
        pool = new PendingNodePool(clock);
    }

    @Test
    void add_stampsTimestamps_andStartsAsCreated() {
        stubClock();

        pool.add(node("n1"));

        PendingNode stored = pool.get("n1").orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(PendingNodeStatus.CREATED);
        assertThat(stored.getCreatedAt()).isEqualTo(LocalDateTime.of(2024, 5, 1, 10, 0));
        assertThat(stored.getUpdatedAt()).isEqualTo(stored.getCreatedAt());
        assertThat(pool.isPending("n1")).isTrue();
        assertThat(pool.size()).isEqualTo(1);
    }

    @Test
    void updateConnection_recordsSource_andBumpsUpdatedAt() {
        stubClock(CREATED_AT, LATER);
        pool.add(node("n1"));

        boolean updated = pool.updateConnection("n1", new ConnectionInfo("scene-0", null));

        PendingNode stored = pool.get("n1").orElseThrow();
        assertThat(updated).isTrue();
        assertThat(stored.getStatus()).isEqualTo(PendingNodeStatus.CONNECTED);
        assertThat(stored.getConnectedTo().getSourceNodeId()).isEqualTo("scene-0");
        assertThat(stored.getUpdatedAt()).isEqualTo(LocalDateTime.of(2024, 5, 1, 10, 5));
        assertThat(stored.getCreatedAt()).isEqualTo(LocalDateTime.of(2024, 5, 1, 10, 0));
        assertThat(pool.getConnectedNodes()).containsExactly(stored);
    }

    @Test
    void updateStatus_rejectsTransitionsOutOfSynced() {
        stubClock();
        pool.add(node("n1"));

        assertThat(pool.updateStatus("n1", PendingNodeStatus.SYNCED)).isFalse();
        assertThat(pool.updateStatus("n1", PendingNodeStatus.CONNECTED)).isTrue();
        assertThat(pool.markSynced("n1", "dialogue-1", "start")).isTrue();
        assertThat(pool.updateStatus("n1", PendingNodeStatus.ORPHAN)).isFalse();
        assertThat(pool.updateConnection("n1", new ConnectionInfo("x", null))).isFalse();

        PendingNode stored = pool.get("n1").orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(PendingNodeStatus.SYNCED);
        assertThat(stored.getAstNodeId()).isEqualTo("dialogue-1");
        assertThat(stored.getLabelName()).isEqualTo("start");
    }

    @Test
    void orphanNodes_canReconnect() {
        stubClock();
        pool.add(node("n1"));
        pool.add(node("n2"));

        pool.updateStatus("n1", PendingNodeStatus.ORPHAN);

        assertThat(pool.getOrphanNodes()).extracting(PendingNode::getId).containsExactly("n1");
        assertThat(pool.updateConnection("n1", new ConnectionInfo("menu-1", "choice-0"))).isTrue();
        assertThat(pool.getOrphanNodes()).isEmpty();
        assertThat(pool.getByStatus(PendingNodeStatus.CREATED)).extracting(PendingNode::getId).containsExactly("n2");
    }

    @Test
    void updateData_mergesPatch_withoutChangingStatus() {
        stubClock();
        PendingNode node = node("n1");
        node.setData(FlowNodeData.builder().target("old").call(false).build());
        pool.add(node);

        pool.updateData("n1", FlowNodeData.builder().target("new_target").build());
        pool.updatePosition("n1", new Position(40, 80));

        PendingNode stored = pool.get("n1").orElseThrow();
        assertThat(stored.getData().getTarget()).isEqualTo("new_target");
        assertThat(stored.getData().getCall()).isFalse();
        assertThat(stored.getPosition()).isEqualTo(new Position(40, 80));
        assertThat(stored.getStatus()).isEqualTo(PendingNodeStatus.CREATED);
    }

    @Test
    void unknownIds_areReportedNotThrown() {
        assertThat(pool.get("ghost")).isEmpty();
        assertThat(pool.remove("ghost")).isFalse();
        assertThat(pool.updateStatus("ghost", PendingNodeStatus.CONNECTED)).isFalse();
        assertThat(pool.updateData("ghost", FlowNodeData.builder().build())).isFalse();
        assertThat(pool.updatePosition("ghost", Position.origin())).isFalse();
        assertThat(pool.markSynced("ghost", "a", "b")).isFalse();
    }

    @Test
    void getAll_returnsCopyInInsertionOrder() {
        stubClock();
        pool.add(node("n2"));
        pool.add(node("n1"));

        List<PendingNode> all = pool.getAll();
        all.clear();

        assertThat(pool.getAll()).extracting(PendingNode::getId).containsExactly("n2", "n1");
        pool.clear();
        assertThat(pool.size()).isZero();
    }

    private void stubClock() {
        stubClock(CREATED_AT);
    }

    private void stubClock(Instant first, Instant... rest) {
        when(clock.instant()).thenReturn(first, rest);
        when(clock.getZone()).thenReturn(ZoneOffset.UTC);
    }

    private static PendingNode node(String id) {
        return PendingNode.builder()
                .id(id)
                .type(FlowNodeType.JUMP)
                .position(Position.origin())
                .build();
    }
}
