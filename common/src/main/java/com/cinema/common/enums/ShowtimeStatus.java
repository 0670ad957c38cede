package com.cinema.common.enums;

public enum ShowtimeStatus {
    SCHEDULED("Scheduled - Open for seat selection"),
    ON_SALE("On sale - Open for seat selection"),
    CANCELLED("Cancelled - No longer bookable"),
    FINISHED("Finished - Screening has ended");

    private final String description;

    ShowtimeStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isBookable() {
        return this == SCHEDULED || this == ON_SALE;
    }
}
