package org.flowvault.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.util.List;

import org.flowvault.TestFlows;
import org.flowvault.api.flow.Flow;
import org.flowvault.api.flow.FlowKind;
import org.flowvault.api.flow.HttpFlow;
import org.flowvault.api.store.StoreException;
import org.flowvault.api.store.UnsupportedFlowTypeException;
import org.flowvault.logging.CapturedLogs;
import org.flowvault.logging.LogCaptureExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for {@link FlowStoreRecorder}.
 */
@Tag("unit")
@ExtendWith(LogCaptureExtension.class)
@ExtendWith(MockitoExtension.class)
class FlowStoreRecorderTest {

    @Mock
    private FlowStore store;
    private FlowStoreRecorder recorder;

    private final HttpFlow first = TestFlows.http("f1").build();
    private final HttpFlow second = TestFlows.http("f2").noResponse().build();

    @BeforeEach
    void setUp() {
        recorder = new FlowStoreRecorder(store);
    }

    @Test
    void everyHook_recordsEachFlowInOrder() throws Exception {
        recorder.onRequest(List.of(first, second));
        recorder.onResponse(List.of(first));
        recorder.onUpdate(List.of(second));
        recorder.onError(List.of(first));

        InOrder order = inOrder(store);
        order.verify(store).record(first);
        order.verify(store).record(second);
        order.verify(store).record(first);
        order.verify(store).record(second);
        order.verify(store).record(first);
        order.verifyNoMoreInteractions();
    }

    @Test
    void onRequest_unsupportedFlow_isDroppedAndRestRecorded(CapturedLogs logs) throws Exception {
        Flow tcpFlow = mock(Flow.class);
        doThrow(new UnsupportedFlowTypeException("t1", FlowKind.TCP)).when(store).record(tcpFlow);

        recorder.onRequest(List.of(tcpFlow, first));

        verify(store).record(tcpFlow);
        verify(store).record(first);
        assertThat(logs.warnings(FlowStoreRecorder.class))
            .containsExactly("Dropping request event: Cannot store flow t1 of kind TCP");
    }

    @Test
    void onResponse_storeFailure_throwsUncheckedWithCause() throws Exception {
        StoreException failure = new StoreException("disk full");
        doThrow(failure).when(store).record(first);

        assertThatThrownBy(() -> recorder.onResponse(List.of(first, second)))
            .isInstanceOf(UncheckedStoreException.class)
            .hasMessage("Failed to record response of flow f1")
            .satisfies(e -> assertThat(e.getCause()).isSameAs(failure));
        verify(store, never()).record(second);
    }

    @Test
    void onUpdate_emptyEvent_recordsNothing() throws Exception {
        recorder.onUpdate(List.of());

        verify(store, never()).record(first);
    }
}
