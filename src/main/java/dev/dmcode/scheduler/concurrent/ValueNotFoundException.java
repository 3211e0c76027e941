package dev.dmcode.scheduler.concurrent;

import java.util.NoSuchElementException;

public class ValueNotFoundException extends NoSuchElementException {

    public ValueNotFoundException(String message) {
        super(message);
    }
}
