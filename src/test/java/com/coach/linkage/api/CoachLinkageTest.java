package com.coach.linkage.api;

import com.coach.linkage.candidate.DuplicateScan;
import com.coach.linkage.core.model.Attendance;
import com.coach.linkage.core.model.Coach;
import com.coach.linkage.core.model.ConfidenceTier;
import com.coach.linkage.core.model.MatchType;
import com.coach.linkage.core.model.School;
import com.coach.linkage.importer.ColumnMapping;
import com.coach.linkage.importer.ImportPreview;
import com.coach.linkage.importer.ImportResult;
import com.coach.linkage.importer.SpreadsheetRows;
import com.coach.linkage.merge.MergeListener;
import com.coach.linkage.merge.MergeResult;
import com.coach.linkage.merge.MergeStatus;
import com.coach.linkage.store.AttendanceRepository;
import com.coach.linkage.store.CoachRepository;
import com.coach.linkage.store.InMemoryRecordStore;
import com.coach.linkage.store.SchoolRepository;
import com.coach.linkage.suppression.FileKeyValueStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("CoachLinkage Tests")
class CoachLinkageTest {

    private InMemoryRecordStore store;
    private CoachRepository coachRepository;
    private SchoolRepository schoolRepository;

    @BeforeEach
    void setUp() {
        store = new InMemoryRecordStore();
        coachRepository = new CoachRepository(store);
        schoolRepository = new SchoolRepository(store);

        schoolRepository.insertAll(List.of(
                School.builder().id("duke").name("Duke University").city("Durham").state("NC").build(),
                School.builder().id("duke-2").name("Duke University").state("NC").conference("ACC").build()));
        coachRepository.insertAll(List.of(
                Coach.builder().id("c1").firstName("J.").lastName("Smith").schoolId("duke").build(),
                Coach.builder().id("c2").firstName("John").lastName("Smith").email("js@duke.edu").schoolId("duke").build(),
                Coach.builder().id("c3").firstName("Amy").lastName("Jones").schoolId("duke-2").build()));
        new AttendanceRepository(store).insertAll(List.of(
                new Attendance("a1", "g1", "c1"),
                new Attendance("a2", "g1", "c2"),
                new Attendance("a3", "g2", "c2")));
    }

    @Test
    @DisplayName("Builder should require a record store")
    void testBuilderRequiresStore() {
        assertThrows(NullPointerException.class, () -> CoachLinkage.builder().build());
    }

    @Nested
    @DisplayName("Coach workflow")
    class CoachWorkflow {

        private final MergeListener listener = mock(MergeListener.class);
        private CoachLinkage linkage;

        @BeforeEach
        void setUp() {
            linkage = CoachLinkage.builder().recordStore(store).mergeListener(listener).build();
        }

        @Test
        @DisplayName("Scan should find the initial variant and report attendance counts")
        void testScan() {
            DuplicateScan<Coach> scan = linkage.coaches().scan();

            assertEquals(1, scan.candidates().size());
            assertTrue(scan.candidates().get(0).involves("c1", "c2"));
            assertEquals(MatchType.FUZZY, scan.candidates().get(0).matchType());
            assertEquals(3, scan.totalRecords());
            assertEquals(1, scan.dependentCount("c1"));
            assertEquals(2, scan.dependentCount("c2"));
            assertEquals(0, scan.dependentCount("c3"));
        }

        @Test
        @DisplayName("Dismissed pairs should stay hidden until dismissals are cleared")
        void testDismissAndClear() {
            DuplicateScan<Coach> scan = linkage.coaches().scan();

            DuplicateScan<Coach> remaining = linkage.coaches().dismiss(scan, "c2", "c1");

            assertTrue(remaining.candidates().isEmpty());
            assertEquals(1, linkage.coaches().dismissedCount());
            assertTrue(linkage.coaches().scan().candidates().isEmpty());

            DuplicateScan<Coach> rescanned = linkage.coaches().clearDismissed();
            assertEquals(1, rescanned.candidates().size());
            assertEquals(0, linkage.coaches().dismissedCount());
        }

        @Test
        @DisplayName("Merge should absorb the loser and notify listeners")
        void testMerge() {
            MergeResult<Coach> result = linkage.coaches().merge("c1", "c2");

            assertEquals(MergeStatus.MERGED, result.status());
            assertEquals("John", result.keeper().getFirstName());
            assertEquals(1, result.dependents().moved());
            assertEquals(1, result.dependents().dropped());
            verify(listener).onMerge("coach", "c1", "c2");

            assertTrue(linkage.coaches().scan().candidates().isEmpty());
            assertEquals(MergeStatus.ALREADY_RESOLVED, linkage.coaches().merge("c1", "c2").status());
            verifyNoMoreInteractions(listener);
        }
    }

    @Nested
    @DisplayName("School workflow")
    class SchoolWorkflow {

        @Test
        @DisplayName("A school row without a name should be skipped and reported, not fail the scan")
        void testNamelessSchoolSkipped() {
            schoolRepository.insertAll(List.of(School.builder().id("no-name").state("NC").build()));
            CoachLinkage linkage = CoachLinkage.builder().recordStore(store).build();

            DuplicateScan<School> scan = linkage.schools().scan();

            assertEquals(List.of("no-name"), scan.skippedIds());
            assertEquals(3, scan.totalRecords());
            assertEquals(1, scan.exactCount());
        }

        @Test
        @DisplayName("Identical school names should be exact candidates and merge their coaches")
        void testScanAndMerge() {
            CoachLinkage linkage = CoachLinkage.builder().recordStore(store).build();

            DuplicateScan<School> scan = linkage.schools().scan();
            assertEquals(1, scan.exactCount());
            assertEquals(2, scan.dependentCount("duke"));

            MergeResult<School> result = linkage.schools().merge("duke", "duke-2");

            assertTrue(result.isSuccess());
            assertEquals("ACC", result.keeper().getConference());
            assertEquals("Durham", result.keeper().getCity());
            assertEquals(1, result.dependents().moved());
            assertEquals("duke", coachRepository.findById("c3").orElseThrow().getSchoolId());
            assertTrue(schoolRepository.findById("duke-2").isEmpty());
        }
    }

    @Test
    @DisplayName("Dismissals should survive a restart through the file store")
    void testPersistentDismissals(@TempDir Path dir) {
        Path file = dir.resolve("settings.json");
        CoachLinkage first = CoachLinkage.builder().recordStore(store)
                .keyValueStore(new FileKeyValueStore(file)).build();
        first.coaches().dismiss(first.coaches().scan(), "c1", "c2");

        CoachLinkage second = CoachLinkage.builder().recordStore(store)
                .keyValueStore(new FileKeyValueStore(file)).build();

        assertEquals(1, second.coaches().dismissedCount());
        assertTrue(second.coaches().scan().candidates().isEmpty());
        assertEquals(0, second.schools().dismissedCount());
    }

    @Test
    @DisplayName("Import should match schools, skip existing coaches and insert the rest")
    void testImport() {
        CoachLinkage linkage = CoachLinkage.builder().recordStore(store).build();
        linkage.schools().merge("duke", "duke-2");

        SpreadsheetRows rows = new SpreadsheetRows(
                List.of("School", "First Name", "Last Name", "Email"),
                List.of(
                        List.of("Duke", "Amy", "Jones", ""),
                        List.of("duke university", "Kara", "Lawson", "kara@duke.edu"),
                        List.of("Unknown State", "Pat", "Doe", "")));

        ImportPreview preview = linkage.previewImport(rows, ColumnMapping.detect(rows.headers()));
        assertEquals(ConfidenceTier.HIGH, preview.row(0).getTier());
        assertEquals(ConfidenceTier.EXACT, preview.row(1).getTier());
        assertEquals(new ImportPreview.Stats(3, 2, 1, 2), preview.stats());

        ImportResult result = linkage.commitImport(preview);

        assertEquals(1, result.imported());
        assertEquals(1, result.duplicates());
        assertEquals(4, coachRepository.findAll().size());
    }
}
