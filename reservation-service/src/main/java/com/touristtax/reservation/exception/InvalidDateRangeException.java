package com.touristtax.reservation.exception;

import java.time.LocalDate;

public class InvalidDateRangeException extends ValidationException {

    public InvalidDateRangeException(LocalDate checkIn, LocalDate checkOut) {
        super("checkOutDate",
                String.format("Check-out date %s must be after check-in date %s", checkOut, checkIn),
                "INVALID_DATE_RANGE");
    }
}
