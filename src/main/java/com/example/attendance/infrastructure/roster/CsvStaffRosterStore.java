package com.example.attendance.infrastructure.roster;

import com.example.attendance.domain.model.RosterEntry;
import com.example.attendance.infrastructure.exception.RosterAccessException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reads and appends the staff roster CSV ({@code Name,Type}, UTF-8, optional BOM).
 */
@Component
public class CsvStaffRosterStore {

    private static final Logger log = LoggerFactory.getLogger(CsvStaffRosterStore.class);

    static final String HEADER = "Name,Type";
    private static final char BOM = '\uFEFF';
    private static final Set<String> NAME_HEADERS = Set.of("Name", "name", "姓名");
    private static final Set<String> TYPE_HEADERS = Set.of("Type", "type", "類型", "類別");

    /**
     * @param rosterPath roster file
     * @return entries in file order, empty when the file does not exist
     * @throws RosterAccessException when the file exists but cannot be read
     */
    public List<RosterEntry> read(Path rosterPath) {
        if (!Files.exists(rosterPath)) {
            log.info("Roster file {} not found; starting with an empty roster", rosterPath);
            return List.of();
        }
        try (BufferedReader reader = Files.newBufferedReader(rosterPath, StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (IOException e) {
            throw new RosterAccessException("Unable to read roster file " + rosterPath, e);
        }
    }

    /**
     * Parses roster CSV text. The first line is the header; rows with a blank name are dropped.
     */
    public List<RosterEntry> read(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
        String headerLine = reader.readLine();
        if (headerLine == null) {
            return List.of();
        }
        if (!headerLine.isEmpty() && headerLine.charAt(0) == BOM) {
            headerLine = headerLine.substring(1);
        }
        List<String> header = splitLine(headerLine);
        int nameIndex = indexOf(header, NAME_HEADERS);
        int typeIndex = indexOf(header, TYPE_HEADERS);
        if (nameIndex < 0 || typeIndex < 0) {
            log.warn("Roster header '{}' has no recognised name/type columns; using the first two columns", headerLine);
            nameIndex = nameIndex < 0 ? 0 : nameIndex;
            typeIndex = typeIndex < 0 ? 1 : typeIndex;
        }

        List<RosterEntry> entries = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            List<String> fields = splitLine(line);
            String name = fieldAt(fields, nameIndex);
            if (name.isBlank()) {
                continue;
            }
            entries.add(new RosterEntry(name, fieldAt(fields, typeIndex)));
        }
        return entries;
    }

    /**
     * Appends one entry, writing the header first when the file is new or empty.
     *
     * @throws RosterAccessException on I/O failure
     */
    public void append(Path rosterPath, RosterEntry entry) {
        try {
            boolean needsHeader = !Files.exists(rosterPath) || Files.size(rosterPath) == 0;
            Path parent = rosterPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(rosterPath, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                if (needsHeader) {
                    writer.write(HEADER);
                    writer.newLine();
                }
                writer.write(escape(entry.name()) + "," + escape(entry.typeLabel()));
                writer.newLine();
            }
        } catch (IOException e) {
            throw new RosterAccessException("Unable to append to roster file " + rosterPath, e);
        }
    }

    private static int indexOf(List<String> header, Set<String> aliases) {
        for (int i = 0; i < header.size(); i++) {
            if (aliases.contains(header.get(i).trim())) {
                return i;
            }
        }
        return -1;
    }

    private static String fieldAt(List<String> fields, int index) {
        return index < fields.size() ? fields.get(index).trim() : "";
    }

    // Minimal RFC 4180 split: quoted fields may contain commas and doubled quotes.
    static List<String> splitLine(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"' && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    current.append('"');
                    i++;
                } else if (c == '"') {
                    quoted = false;
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                fields.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        fields.add(current.toString());
        return fields;
    }

    private static String escape(String value) {
        String sanitized = value.replace("\"", "\"\"");
        if (sanitized.contains(",") || sanitized.contains("\"") || sanitized.contains("\n")) {
            return "\"" + sanitized + "\"";
        }
        return sanitized;
    }
}
