package com.example.attendance.domain.model;

/**
 * One line of the staff roster: a name and its raw type label (e.g. {@code 內勤}).
 */
public record RosterEntry(String name, String typeLabel) {

    public RosterEntry {
        name = name == null ? "" : name.trim();
        typeLabel = typeLabel == null ? "" : typeLabel.trim();
    }

    public StaffRegime regime() {
        return StaffRegime.fromLabel(typeLabel);
    }
}
