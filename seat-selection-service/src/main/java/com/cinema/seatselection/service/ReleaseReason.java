package com.cinema.seatselection.service;

public enum ReleaseReason {
    DESELECTED,
    CLEARED,
    DISCONNECTED,
    ADMIN_RELEASE
}
