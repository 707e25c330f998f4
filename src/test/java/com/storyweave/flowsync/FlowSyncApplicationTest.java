package com.storyweave.flowsync;

import com.storyweave.flowsync.config.GraphBuilderSettings;
import com.storyweave.flowsync.service.history.ScriptHistory;
import com.storyweave.flowsync.service.operation.NodeOperationHandler;
import com.storyweave.flowsync.service.sync.ScriptJsonCodec;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class FlowSyncApplicationTest {

    @Autowired
    private NodeOperationHandler nodeOperationHandler;

    @Autowired
    private ScriptJsonCodec scriptJsonCodec;

    @Autowired
    private ScriptHistory scriptHistory;

    @Autowired
    private GraphBuilderSettings graphBuilderSettings;

    @Test
    void contextLoads_withConfiguredSettings() {
        assertThat(nodeOperationHandler).isNotNull();
        assertThat(scriptJsonCodec).isNotNull();
        assertThat(scriptHistory.getCapacity()).isEqualTo(100);
        assertThat(graphBuilderSettings.getNarratorName()).isEqualTo("narrator");
    }
}
