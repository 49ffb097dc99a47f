package com.fujical.engine.geo;

public class InvalidCoordinatesException extends IllegalArgumentException {
    public InvalidCoordinatesException(String message) {
        super(message);
    }
}
