package com.p14n.eventbroker.broker;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import com.p14n.eventbroker.broker.TestEvents.TypeA;
import com.p14n.eventbroker.broker.TestEvents.TypeB;
import com.p14n.eventbroker.data.ConfigData;
import com.p14n.eventbroker.data.Event;

import io.opentelemetry.api.OpenTelemetry;

class DeterministicDeliveryTest {

    private final List<ManualDeliveryExecutor> executors = new ArrayList<>();
    private LocalEventBroker broker;

    @BeforeEach
    void setUp() {
        broker = new LocalEventBroker(new ConfigData("deterministic"), () -> {
            var executor = new ManualDeliveryExecutor();
            executors.add(executor);
            return executor;
        }, OpenTelemetry.noop());
    }

    private ManualDeliveryExecutor executor() {
        return executors.get(executors.size() - 1);
    }

    @Test
    void shouldReturnFromPublishBeforeAnyDelivery() {
        EventSubscriber subscriber = mock(EventSubscriber.class);
        broker.subscribe(subscriber);

        BrokerHandle handle = broker.open();
        handle.publish(new TypeA(1));

        verifyNoInteractions(subscriber);
        assertEquals(1, executor().pending());

        handle.close();
        verify(subscriber).onEvent(any(TypeA.class));
    }

    @Test
    void shouldRetireOneShotWhenScheduledNotWhenDelivered() {
        EventSubscriber subscriber = mock(EventSubscriber.class);
        broker.subscribe(subscriber, null, true);

        try (BrokerHandle handle = broker.open()) {
            handle.publish(new TypeA(1));
            assertEquals(0, broker.subscriptionCount());

            handle.publish(new TypeA(2));
            assertEquals(1, executor().pending());
        }

        verify(subscriber, times(1)).onEvent(any());
    }

    @Test
    void shouldStillRunDeliveryScheduledBeforeUnsubscribe() {
        EventSubscriber subscriber = mock(EventSubscriber.class);
        SubscriptionToken token = broker.subscribe(subscriber);

        try (BrokerHandle handle = broker.open()) {
            TypeA scheduled = new TypeA(1);
            handle.publish(scheduled);
            handle.unsubscribe(token);
            handle.publish(new TypeA(2));

            executor().runAll();
            verify(subscriber).onEvent(scheduled);
            verifyNoMoreInteractions(subscriber);
        }
    }

    @Test
    void shouldDeliverToEachSubscriberInPublishOrder() {
        EventSubscriber first = mock(EventSubscriber.class);
        EventSubscriber second = mock(EventSubscriber.class);
        broker.subscribe(first);
        broker.subscribe(second, Set.of(TypeB.class));

        TypeA e1 = new TypeA(1);
        TypeB e2 = new TypeB("two");
        TypeA e3 = new TypeA(3);
        try (BrokerHandle handle = broker.open()) {
            handle.publish(e1);
            handle.publish(e2);
            handle.publish(e3);
        }

        InOrder inOrder = inOrder(first, second);
        inOrder.verify(first).onEvent(e1);
        inOrder.verify(first).onEvent(e2);
        inOrder.verify(second).onEvent(e2);
        inOrder.verify(first).onEvent(e3);
        verify(second, never()).onEvent(e1);
        verify(second, never()).onEvent(e3);
    }

    @Test
    void shouldReportFailureToSubscriberAndContinue() {
        RuntimeException failure = new RuntimeException("boom");
        EventSubscriber failing = mock(EventSubscriber.class);
        doThrow(failure).when(failing).onEvent(any());
        EventSubscriber healthy = mock(EventSubscriber.class);
        broker.subscribe(failing);
        broker.subscribe(healthy);

        Event event = new TypeA(1);
        try (BrokerHandle handle = broker.open()) {
            handle.publish(event);
        }

        verify(failing).onError(failure);
        verify(healthy).onEvent(event);
        assertEquals(2, executor().executed());
    }

    @Test
    void shouldCreateFreshExecutorForEachOpenCycle() {
        try (BrokerHandle handle = broker.open()) {
            assertEquals(1, executors.size());
        }
        assertTrue(executors.get(0).isShutdown());

        try (BrokerHandle handle = broker.open()) {
            assertEquals(2, executors.size());
            assertFalse(executor().isShutdown());
        }
    }

    @Test
    void shouldRejectPublishOnceClosingBegins() {
        EventSubscriber subscriber = mock(EventSubscriber.class);
        broker.subscribe(subscriber);
        BrokerHandle handle = broker.open();
        handle.publish(new TypeA(1));
        handle.close();

        assertThrows(BrokerClosedException.class, () -> broker.publish(new TypeA(2)));
        assertEquals(0, executors.get(0).pending());
        verify(subscriber, times(1)).onEvent(any());
    }
}
