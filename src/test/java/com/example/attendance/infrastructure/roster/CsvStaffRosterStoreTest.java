package com.example.attendance.infrastructure.roster;

import com.example.attendance.domain.model.RosterEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CsvStaffRosterStoreTest {

    private final CsvStaffRosterStore store = new CsvStaffRosterStore();

    @Test
    void quotedFieldsSurviveRoundTrip(@TempDir Path dir) {
        Path roster = dir.resolve("staff.csv");

        store.append(roster, new RosterEntry("Smith, \"Jo\"", "internal"));

        assertThat(store.read(roster)).containsExactly(new RosterEntry("Smith, \"Jo\"", "internal"));
    }

    @Test
    void columnsAreFoundByHeaderNotPosition() throws IOException {
        List<RosterEntry> entries = store.read(new StringReader("type,Dept,name\n外勤,Sales,林大華\n"));

        assertThat(entries).containsExactly(new RosterEntry("林大華", "外勤"));
    }

    @Test
    void emptySourceGivesNoEntries() throws IOException {
        assertThat(store.read(new StringReader(""))).isEmpty();
    }

    @Test
    void splitHandlesEscapedQuotes() {
        assertThat(CsvStaffRosterStore.splitLine("a,\"b,c\",\"d\"\"e\",")).containsExactly("a", "b,c", "d\"e", "");
    }
}
