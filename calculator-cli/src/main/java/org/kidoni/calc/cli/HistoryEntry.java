package org.kidoni.calc.cli;

public record HistoryEntry(String expression, double result) {
}
