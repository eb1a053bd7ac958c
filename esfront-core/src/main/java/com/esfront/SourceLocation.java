package com.esfront;

public record SourceLocation(Position start, Position end) {
    public record Position(int line, int column) {
        @Override
        public String toString() {
            return line + ":" + column;
        }
    }
}
