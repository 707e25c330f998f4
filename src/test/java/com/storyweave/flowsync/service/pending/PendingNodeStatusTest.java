package com.storyweave.flowsync.service.pending;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class PendingNodeStatusTest {

    @ParameterizedTest
    @CsvSource({
            "CREATED, CONNECTED, true",
            "CREATED, ORPHAN, true",
            "CREATED, SYNCED, false",
            "CONNECTED, SYNCED, true",
            "CONNECTED, ORPHAN, true",
            "CONNECTED, CREATED, false",
            "ORPHAN, CONNECTED, true",
            "ORPHAN, SYNCED, false",
            "SYNCED, ORPHAN, false",
            "SYNCED, CONNECTED, false",
            "SYNCED, SYNCED, true"
    })
    void canTransitionTo_followsLifecycle(PendingNodeStatus from, PendingNodeStatus to, boolean allowed) {
        assertThat(from.canTransitionTo(to)).isEqualTo(allowed);
    }

    @Test
    void canTransitionTo_null_isRejected() {
        assertThat(PendingNodeStatus.CREATED.canTransitionTo(null)).isFalse();
    }

    @Test
    void wireValues_areLowercase() {
        assertThat(PendingNodeStatus.ORPHAN.getValue()).isEqualTo("orphan");
    }
}
