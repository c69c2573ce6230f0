package com.example.attendance.application.service;

import com.example.attendance.application.exception.UseCaseValidationException;
import com.example.attendance.domain.model.RosterEntry;
import com.example.attendance.domain.model.Staff;
import com.example.attendance.domain.model.StaffRegime;
import com.example.attendance.infrastructure.exception.RosterAccessException;
import com.example.attendance.infrastructure.roster.CsvStaffRosterStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory index of the staff roster, keyed by exact name.
 * The index is swapped as a whole on every load; {@link #append(String, StaffRegime)} also persists to the roster file.
 */
public class StaffDirectory {

    private static final Logger log = LoggerFactory.getLogger(StaffDirectory.class);

    private final CsvStaffRosterStore store;
    private final Path rosterPath;
    private volatile Map<String, Staff> index = Map.of();

    /**
     * @param store      CSV access
     * @param rosterPath backing file used by {@link #append(String, StaffRegime)}; may be {@code null} for read-only directories
     */
    public StaffDirectory(CsvStaffRosterStore store, Path rosterPath) {
        this.store = store;
        this.rosterPath = rosterPath;
    }

    public static StaffDirectory of(List<RosterEntry> entries) {
        StaffDirectory directory = new StaffDirectory(new CsvStaffRosterStore(), null);
        directory.loadEntries(entries);
        return directory;
    }

    public void load(Path path) {
        loadEntries(store.read(path));
    }

    public void load(Reader reader) {
        try {
            loadEntries(store.read(reader));
        } catch (IOException e) {
            throw new RosterAccessException("Unable to read roster", e);
        }
    }

    /**
     * Replaces the index. Blank names are skipped and a repeated name keeps its last entry.
     */
    public synchronized void loadEntries(List<RosterEntry> entries) {
        Map<String, Staff> loaded = new LinkedHashMap<>();
        for (RosterEntry entry : entries) {
            if (entry.name().isEmpty()) {
                continue;
            }
            loaded.put(entry.name(), new Staff(entry.name(), entry.regime()));
        }
        index = Collections.unmodifiableMap(loaded);
        log.info("Loaded staff roster: {} entries ({} internal, {} external)",
                loaded.size(), internalStaff().size(), externalStaff().size());
    }

    public Optional<Staff> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(index.get(name.trim()));
    }

    public int size() {
        return index.size();
    }

    public boolean isEmpty() {
        return index.isEmpty();
    }

    public List<Staff> internalStaff() {
        return byRegime(StaffRegime.INTERNAL);
    }

    public List<Staff> externalStaff() {
        return byRegime(StaffRegime.EXTERNAL);
    }

    /**
     * Adds a staff member to the roster file and the index.
     *
     * @throws UseCaseValidationException when the name is blank or the directory has no backing file
     * @throws RosterAccessException      when the roster file cannot be written
     */
    public synchronized Staff append(String name, StaffRegime regime) {
        if (name == null || name.isBlank()) {
            throw new UseCaseValidationException("Staff name is required.");
        }
        if (rosterPath == null) {
            throw new UseCaseValidationException("This staff directory is read-only.");
        }
        StaffRegime resolved = regime != null ? regime : StaffRegime.INTERNAL;
        String trimmed = name.trim();
        store.append(rosterPath, new RosterEntry(trimmed, resolved.rosterLabel()));

        Staff staff = new Staff(trimmed, resolved);
        Map<String, Staff> updated = new LinkedHashMap<>(index);
        updated.put(trimmed, staff);
        index = Collections.unmodifiableMap(updated);
        log.info("Added {} to roster as {}", trimmed, resolved);
        return staff;
    }

    private List<Staff> byRegime(StaffRegime regime) {
        return index.values().stream()
                .filter(staff -> staff.regime() == regime)
                .toList();
    }
}
