package com.star.eximscanner.exception;

import lombok.Getter;

@Getter
public class InvalidTimestampException extends RuntimeException {

    private final int year;
    private final int month;
    private final int day;
    private final int hour;
    private final int minute;
    private final int second;

    public InvalidTimestampException(int year, int month, int day,
                                     int hour, int minute, int second, Throwable cause) {
        super(String.format("Invalid date/time %04d-%02d-%02d %02d:%02d:%02d: %s",
                year, month, day, hour, minute, second,
                cause != null ? cause.getMessage() : "out of range"), cause);
        this.year = year;
        this.month = month;
        this.day = day;
        this.hour = hour;
        this.minute = minute;
        this.second = second;
    }
}
