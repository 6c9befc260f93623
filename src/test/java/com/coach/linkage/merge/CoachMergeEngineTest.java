package com.coach.linkage.merge;

import com.coach.linkage.core.model.Attendance;
import com.coach.linkage.core.model.Coach;
import com.coach.linkage.error.ConstraintViolationException;
import com.coach.linkage.error.RecordNotFoundException;
import com.coach.linkage.error.StoreException;
import com.coach.linkage.error.ValidationException;
import com.coach.linkage.store.AttendanceRepository;
import com.coach.linkage.store.CoachRepository;
import com.coach.linkage.store.InMemoryRecordStore;
import com.coach.linkage.store.RecordStore;
import com.coach.linkage.store.Tables;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class CoachMergeEngineTest {

    private InMemoryRecordStore store;
    private CoachRepository coaches;
    private AttendanceRepository attendance;
    private CoachMergeEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryRecordStore();
        coaches = new CoachRepository(store);
        attendance = new AttendanceRepository(store);
        engine = new CoachMergeEngine(coaches, attendance);
    }

    private void givenCoach(String id, String first, String last, String email, String schoolId) {
        coaches.insertAll(List.of(Coach.builder()
                .id(id).firstName(first).lastName(last).email(email).schoolId(schoolId).build()));
    }

    @Test
    @DisplayName("Initial keeper should take the loser's first name and missing email")
    void testJSmithAbsorbsJohnSmith() {
        givenCoach("keeper", "J.", "Smith", null, "x");
        givenCoach("loser", "John", "Smith", "j@x.edu", "x");

        MergeResult<Coach> result = engine.merge("keeper", "loser");

        assertEquals(MergeStatus.MERGED, result.status());
        Coach merged = coaches.findById("keeper").orElseThrow();
        assertEquals("John", merged.getFirstName());
        assertEquals("Smith", merged.getLastName());
        assertEquals("j@x.edu", merged.getEmail());
        assertEquals("John", result.keeper().getFirstName());
        assertEquals(List.of("first name", "email"), result.mergedFields());
        assertTrue(coaches.findById("loser").isEmpty());
    }

    @Test
    @DisplayName("Non-empty keeper fields should never be overwritten")
    void testKeeperFieldsWin() {
        coaches.insertAll(List.of(
                Coach.builder().id("k").firstName("John").lastName("Smith").email("keep@x.edu")
                        .phone("555-0100").schoolId("x").build(),
                Coach.builder().id("l").firstName("Johnny").lastName("Smith").email("other@x.edu")
                        .phone("555-0199").title("Head Coach").schoolId("x").build()));

        MergeResult<Coach> result = engine.merge("k", "l");

        Coach merged = coaches.findById("k").orElseThrow();
        assertEquals("John", merged.getFirstName());
        assertEquals("keep@x.edu", merged.getEmail());
        assertEquals("555-0100", merged.getPhone());
        assertEquals("Head Coach", merged.getTitle());
        assertEquals(List.of("title"), result.mergedFields());
    }

    @Test
    @DisplayName("Attendance should move to the keeper, dropping games the keeper already attended")
    void testRepointAttendance() {
        givenCoach("k", "John", "Smith", null, "x");
        givenCoach("l", "Jon", "Smith", null, "x");
        attendance.insertAll(List.of(
                new Attendance("a1", "g1", "k"),
                new Attendance("a2", "g1", "l"),
                new Attendance("a3", "g2", "l"),
                new Attendance("a4", "g3", "l")));

        MergeResult<Coach> result = engine.merge("k", "l");

        assertTrue(result.isSuccess());
        assertEquals(new DependentMove(2, 1), result.dependents());
        assertEquals(List.of("g1", "g2", "g3"),
                attendance.findByCoach("k").stream().map(Attendance::gameId).sorted().toList());
        assertTrue(attendance.findByCoach("l").isEmpty());
        assertEquals("Merged \"Jon Smith\" into \"John Smith\" (2 attendance records reassigned) (1 redundant removed)",
                result.message());
    }

    @Test
    @DisplayName("Merging again after success should report already resolved and leave the keeper alone")
    void testIdempotent() {
        givenCoach("k", "J.", "Smith", null, "x");
        givenCoach("l", "John", "Smith", "j@x.edu", "x");
        engine.merge("k", "l");
        coaches.update("k", Map.of(Tables.TITLE, "Assistant"));

        MergeResult<Coach> second = engine.merge("k", "l");

        assertEquals(MergeStatus.ALREADY_RESOLVED, second.status());
        assertNull(second.failedStep());
        Coach keeper = coaches.findById("k").orElseThrow();
        assertEquals("Assistant", keeper.getTitle());
        assertEquals("John", keeper.getFirstName());
    }

    @Test
    @DisplayName("Missing keeper should report already resolved")
    void testMissingKeeper() {
        givenCoach("l", "John", "Smith", null, "x");

        assertTrue(engine.merge("gone", "l").isAlreadyResolved());
        assertTrue(coaches.findById("l").isPresent());
    }

    @Test
    @DisplayName("Coaches of different schools or the same coach twice cannot be merged")
    void testValidation() {
        givenCoach("a", "John", "Smith", null, "x");
        givenCoach("b", "John", "Smith", null, "y");

        assertThrows(ValidationException.class, () -> engine.merge("a", "b"));
        assertThrows(ValidationException.class, () -> engine.merge("a", "a"));
        assertThrows(ValidationException.class, () -> engine.merge(null, "a"));
        assertTrue(coaches.findById("b").isPresent());
    }

    @Test
    @DisplayName("Listeners should hear about successful merges only")
    void testListeners() {
        List<String> events = new ArrayList<>();
        engine.addMergeListener((kind, keeperId, loserId) -> events.add(kind + ":" + keeperId + "<-" + loserId));
        engine.addMergeListener((kind, keeperId, loserId) -> {
            throw new IllegalStateException("listener broke");
        });
        givenCoach("k", "John", "Smith", null, "x");
        givenCoach("l", "John", "Smith", null, "x");

        assertTrue(engine.merge("k", "l").isSuccess());
        engine.merge("k", "l");

        assertEquals(List.of("coach:k<-l"), events);
    }

    @Nested
    @DisplayName("Store failures")
    @ExtendWith(MockitoExtension.class)
    class FailureTests {

        @Mock
        private RecordStore failingStore;

        private CoachMergeEngine failingEngine;

        private Map<String, Object> row(String id, String first, String email) {
            Map<String, Object> row = new HashMap<>();
            row.put(Tables.ID, id);
            row.put(Tables.FIRST_NAME, first);
            row.put(Tables.LAST_NAME, "Smith");
            row.put(Tables.EMAIL, email);
            row.put(Tables.SCHOOL_ID, "x");
            return row;
        }

        @BeforeEach
        void setUp() {
            failingEngine = new CoachMergeEngine(new CoachRepository(failingStore), new AttendanceRepository(failingStore));
            lenient().when(failingStore.select(eq(Tables.COACHES), eq(Map.of(Tables.ID, "k"))))
                    .thenReturn(List.of(row("k", "J.", null)));
            lenient().when(failingStore.select(eq(Tables.COACHES), eq(Map.of(Tables.ID, "l"))))
                    .thenReturn(List.of(row("l", "John", "j@x.edu")));
        }

        @Test
        @DisplayName("Repoint failure should report the step and keep the reconciled keeper")
        void testRepointFailure() {
            when(failingStore.select(eq(Tables.ATTENDANCE), anyMap())).thenReturn(List.of());
            when(failingStore.updateWhere(eq(Tables.ATTENDANCE), anyMap(), anyMap()))
                    .thenThrow(new StoreException("connection reset"));

            MergeResult<Coach> result = failingEngine.merge("k", "l");

            assertEquals(MergeStatus.FAILED, result.status());
            assertEquals(MergeStep.REPOINT_ATTENDANCE, result.failedStep());
            assertTrue(result.message().contains("connection reset"), result.message());
            verify(failingStore).update(eq(Tables.COACHES), eq("k"), anyMap());
            verify(failingStore, never()).delete(eq(Tables.COACHES), anyString());
        }

        @Test
        @DisplayName("Loser deleted concurrently should report already resolved")
        void testConcurrentDelete() {
            when(failingStore.select(eq(Tables.ATTENDANCE), anyMap())).thenReturn(List.of());
            when(failingStore.updateWhere(eq(Tables.ATTENDANCE), anyMap(), anyMap())).thenReturn(0);
            doThrow(new RecordNotFoundException(Tables.COACHES, "l"))
                    .when(failingStore).delete(Tables.COACHES, "l");

            MergeResult<Coach> result = failingEngine.merge("k", "l");

            assertEquals(MergeStatus.ALREADY_RESOLVED, result.status());
        }

        @Test
        @DisplayName("Constraint violation while repointing should be reported distinctly")
        void testConstraintViolation() {
            when(failingStore.select(eq(Tables.ATTENDANCE), anyMap())).thenReturn(List.of());
            when(failingStore.updateWhere(eq(Tables.ATTENDANCE), anyMap(), anyMap()))
                    .thenThrow(new ConstraintViolationException(
                            InMemoryRecordStore.ATTENDANCE_UNIQUE, "duplicate (game_id, coach_id)"));

            MergeResult<Coach> result = failingEngine.merge("k", "l");

            assertTrue(result.isFailure());
            assertEquals(MergeStep.REPOINT_ATTENDANCE, result.failedStep());
            assertTrue(result.message().startsWith("Constraint " + InMemoryRecordStore.ATTENDANCE_UNIQUE), result.message());
        }

        @Test
        @DisplayName("Load failure should be reported at the load step")
        void testLoadFailure() {
            reset(failingStore);
            when(failingStore.select(anyString(), anyMap())).thenThrow(new StoreException("timeout"));

            MergeResult<Coach> result = failingEngine.merge("k", "l");

            assertEquals(MergeStep.LOAD_RECORDS, result.failedStep());
            verify(failingStore, never()).update(anyString(), anyString(), anyMap());
        }
    }
}
