package com.odelab.backend.expr;

public enum Symbol {
    X("x"),
    Y("y");

    private final String text;

    Symbol(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }

    public static Symbol fromText(String name) {
        for (Symbol s : values()) {
            if (s.text.equals(name)) return s;
        }
        return null;
    }
}
