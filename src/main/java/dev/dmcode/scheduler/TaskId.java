package dev.dmcode.scheduler;

public record TaskId(long value) {

    @Override
    public String toString() {
        return "#" + value;
    }
}
