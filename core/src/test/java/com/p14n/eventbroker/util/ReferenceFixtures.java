package com.p14n.eventbroker.util;

public class ReferenceFixtures {

    public static final String CONSTANT = "constant";

    public static final String UNSET = null;

    public static class Nested {
        public static final Nested INSTANCE = new Nested("inner");

        public final String label;

        public Nested(String label) {
            this.label = label;
        }
    }

    public enum Colour {
        RED,
        GREEN
    }
}
