package com.touristtax.reservation.domain.model;

public enum Currency {
    PLN,
    EUR,
    USD
}
