package com.deda.plugin;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One submitted revision of a versioned file.
 */
public final class Revision {

    private final int number;
    private final String description;
    private final String user;
    private final long submittedAtMillis;

    @JsonCreator
    public Revision(@JsonProperty("number") int number,
                    @JsonProperty("description") String description,
                    @JsonProperty("user") String user,
                    @JsonProperty("submittedAtMillis") long submittedAtMillis) {
        if (number < 1) {
            throw new IllegalArgumentException("Revision number must be >= 1: " + number);
        }
        this.number = number;
        this.description = description != null ? description : "";
        this.user = user;
        this.submittedAtMillis = submittedAtMillis;
    }

    /** 1-based revision number. */
    public int getNumber() {
        return number;
    }

    public String getDescription() {
        return description;
    }

    /** Submitting user, or null when the backend does not record it. */
    public String getUser() {
        return user;
    }

    public long getSubmittedAtMillis() {
        return submittedAtMillis;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Revision that = (Revision) o;
        return number == that.number && submittedAtMillis == that.submittedAtMillis
                && description.equals(that.description) && Objects.equals(user, that.user);
    }

    @Override
    public int hashCode() {
        return Objects.hash(number, description, user, submittedAtMillis);
    }

    @Override
    public String toString() {
        return "#" + number + " " + description;
    }
}
