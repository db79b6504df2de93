package com.p14n.eventbroker.broker;

import java.time.Instant;

import com.p14n.eventbroker.data.Event;

final class TestEvents {

    private TestEvents() {
    }

    record TypeA(Instant timestamp, int value) implements Event {
        TypeA(int value) {
            this(Instant.now(), value);
        }
    }

    record TypeB(Instant timestamp, String value) implements Event {
        TypeB(String value) {
            this(Instant.now(), value);
        }
    }
}
