package czm.dabs_be.activity;

import com.fasterxml.jackson.databind.ObjectMapper;
import czm.dabs_be.activity.ActivityDao.ActivityMutation;
import czm.dabs_be.activity.ActivityDao.ActivityRow;
import czm.dabs_be.activity.ActivityService.DaySchedule;
import czm.dabs_be.activity.ActivityService.DeletedActivity;
import czm.dabs_be.audit.AuditLogService;
import czm.dabs_be.briefing.BriefingDao.BriefingRow;
import czm.dabs_be.briefing.BriefingService;
import czm.dabs_be.briefing.BriefingStatus;
import czm.dabs_be.config.DabsProperties;
import czm.dabs_be.contractor.ContractorDescriptor;
import czm.dabs_be.contractor.ContractorLookup;
import czm.dabs_be.contractor.ContractorResolver;
import czm.dabs_be.contractor.ContractorService;
import czm.dabs_be.web.ApiException;
import czm.dabs_be.web.RequestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ActivityServiceTest {
    private static final RequestContext CTX = new RequestContext(7L, 42L);
    private static final LocalDate DAY = LocalDate.of(2025, 6, 25);
    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-06-25T07:00:00Z");

    private static final ContractorLookup LOOKUP = new ContractorLookup(
            Map.of(1L, "Acme Electrical", 2L, "Bolt Ltd"),
            Map.of(1L, "Electrical", 2L, "Steel"),
            Map.of(
                    1L, new ContractorDescriptor(1L, "Acme Electrical", "Electrical", "Active", "", "", null),
                    2L, new ContractorDescriptor(2L, "Bolt Ltd", "Steel", "Active", "", "", null)));

    @Mock
    private ActivityDao dao;
    @Mock
    private BriefingService briefings;
    @Mock
    private ContractorService contractors;
    @Mock
    private AuditLogService audit;
    @Mock
    private PlatformTransactionManager transactionManager;

    private ActivityService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-06-25T09:00:00Z"), ZoneId.of("Europe/London"));
        service = new ActivityService(
                dao,
                briefings,
                contractors,
                new ContractorResolver(contractors),
                new ContractorIdCodec(new ObjectMapper()),
                new ActivityInputNormalizer(clock, new DabsProperties()),
                audit,
                transactionManager);
    }

    @Test
    void addResolvesBriefingByDateAndFiltersContractors() {
        when(briefings.getOrCreateBriefing(CTX, DAY)).thenReturn(briefing(5L, DAY));
        when(contractors.retainProjectContractors(7L, List.of(1L, 99L))).thenReturn(List.of(1L));
        when(dao.insert(any(ActivityMutation.class))).thenAnswer(invocation -> rowFrom(11L, invocation.getArgument(0)));
        when(contractors.buildLookupMaps(7L)).thenReturn(LOOKUP);

        ActivityResponse response = service.add(CTX, new ActivityRequest(
                null, "25/06/2025", "", "  Pour slab ", null, "Level 1", "urgent", 6, List.of(1L, 99L), null));

        assertEquals(11L, response.id());
        assertEquals(5L, response.briefingId());
        assertEquals(DAY, response.date());
        assertEquals(LocalTime.of(8, 0), response.time());
        assertEquals("Pour slab", response.title());
        assertEquals("medium", response.priority());
        assertEquals(List.of(1L), response.contractorIds());
        assertEquals("Acme Electrical", response.contractors().get(0).name());
        verify(audit).record(eq(CTX), eq(AuditLogService.ADD_ACTIVITY), anyString());
    }

    @Test
    void addRejectsBlankTitle() {
        ApiException ex = assertThrows(ApiException.class, () -> service.add(CTX, new ActivityRequest(
                5L, null, null, "   ", null, null, null, 1, null, null)));

        assertEquals(ApiException.VALIDATION, ex.getCode());
        verifyNoInteractions(dao, briefings);
    }

    @Test
    void addRejectsNegativeLabor() {
        ApiException ex = assertThrows(ApiException.class, () -> service.add(CTX, new ActivityRequest(
                5L, null, null, "Scaffold", null, null, null, -2, null, null)));

        assertEquals("labor_count_negative", ex.getDetails());
    }

    @Test
    void addIntoForeignBriefingIsValidationError() {
        when(briefings.requireBriefing(CTX, 500L))
                .thenThrow(ApiException.validation("Briefing does not belong to this project.", "briefing_not_in_project"));

        ApiException ex = assertThrows(ApiException.class, () -> service.add(CTX, new ActivityRequest(
                500L, null, null, "Scaffold", null, null, "high", 2, List.of(), null)));

        assertEquals(ApiException.VALIDATION, ex.getCode());
        verify(dao, never()).insert(any());
    }

    @Test
    void updateMovesActivityAndDateFollowsBriefing() {
        LocalDate nextDay = DAY.plusDays(1);
        when(dao.findById(7L, 10L)).thenReturn(Optional.of(row(10L, 5L, DAY, "Level 1", "high", 4, "[1]")));
        when(briefings.requireBriefing(CTX, 6L)).thenReturn(briefing(6L, nextDay));
        when(contractors.retainProjectContractors(7L, List.of(2L))).thenReturn(List.of(2L));
        when(dao.update(eq(10L), any(ActivityMutation.class)))
                .thenAnswer(invocation -> Optional.of(rowFrom(10L, invocation.getArgument(1))));
        when(contractors.buildLookupMaps(7L)).thenReturn(LOOKUP);

        ActivityResponse response = service.update(CTX, 10L, new ActivityRequest(
                6L, "01/01/2020", "07:15", "Pour slab", "east side", "Level 2", "critical", 8, List.of(2L), "Site team"));

        ArgumentCaptor<ActivityMutation> captor = ArgumentCaptor.forClass(ActivityMutation.class);
        verify(dao).update(eq(10L), captor.capture());
        assertEquals(nextDay, captor.getValue().date());
        assertEquals(6L, captor.getValue().briefingId());
        assertEquals("[2]", captor.getValue().contractors());
        assertEquals("critical", response.priority());
        assertEquals("Bolt Ltd", response.contractors().get(0).name());
    }

    @Test
    void getFromAnotherProjectIsNotFound() {
        when(dao.findById(7L, 10L)).thenReturn(Optional.empty());

        ApiException ex = assertThrows(ApiException.class, () -> service.get(CTX, 10L));

        assertEquals(ApiException.NOT_FOUND, ex.getCode());
    }

    @Test
    void deleteReturnsPriorSnapshot() {
        when(dao.findById(7L, 10L)).thenReturn(Optional.of(row(10L, 5L, DAY, "Level 1", "low", 3, "[1, 99]")));
        when(dao.delete(10L)).thenReturn(1);
        when(contractors.buildLookupMaps(7L)).thenReturn(LOOKUP);

        DeletedActivity deleted = service.delete(CTX, 10L);

        assertTrue(deleted.deleted());
        assertEquals("Task 10", deleted.prior().title());
        assertEquals(List.of(1L, 99L), deleted.prior().contractorIds());
        assertEquals(1, deleted.prior().contractors().size());
        verify(audit).record(eq(CTX), eq(AuditLogService.DELETE_ACTIVITY), anyString());
    }

    @Test
    void deleteMissingActivityIsNotFound() {
        when(dao.findById(7L, 10L)).thenReturn(Optional.empty());

        ApiException ex = assertThrows(ApiException.class, () -> service.delete(CTX, 10L));

        assertEquals(ApiException.NOT_FOUND, ex.getCode());
        verify(dao, never()).delete(10L);
        verifyNoInteractions(audit);
    }

    @Test
    void dayScheduleGroupsByAreaAndCountsContractorsOnce() {
        when(briefings.briefingExists(CTX, DAY.minusDays(1))).thenReturn(true);
        when(briefings.findBriefing(CTX, DAY)).thenReturn(Optional.of(briefing(5L, DAY)));
        when(dao.listByBriefing(5L)).thenReturn(List.of(
                row(1L, 5L, DAY, null, "medium", 2, "[1]"),
                row(2L, 5L, DAY, "Level 1", "critical", 4, "[1,2]"),
                row(3L, 5L, DAY, "Level 1", null, 1, null)));
        when(contractors.buildLookupMaps(7L)).thenReturn(LOOKUP);

        DaySchedule schedule = service.listDay(CTX, "2025-06-25");

        assertEquals(5L, schedule.briefingId());
        assertEquals(3, schedule.activities().size());
        assertEquals(List.of(ActivityService.UNSPECIFIED_AREA, "Level 1"), List.copyOf(schedule.activitiesByArea().keySet()));
        assertEquals(2, schedule.activitiesByArea().get("Level 1").size());
        assertEquals(7, schedule.totalLabor());
        assertEquals(2, schedule.uniqueContractors());
        assertTrue(schedule.previousDayHasBriefing());
    }

    @Test
    void dayWithoutBriefingIsEmptyAndNotCreated() {
        when(briefings.briefingExists(CTX, DAY.minusDays(1))).thenReturn(false);
        when(briefings.findBriefing(CTX, DAY)).thenReturn(Optional.empty());

        DaySchedule schedule = service.listDay(CTX, null);

        assertNull(schedule.briefingId());
        assertTrue(schedule.activities().isEmpty());
        assertFalse(schedule.previousDayHasBriefing());
        verify(briefings, never()).getOrCreateBriefing(any(), any());
        verifyNoInteractions(dao);
    }

    private static BriefingRow briefing(long id, LocalDate date) {
        return new BriefingRow(id, 7L, date, BriefingStatus.DRAFT, 42L, NOW);
    }

    private static ActivityRow row(long id, long briefingId, LocalDate date, String area, String priority,
                                   int labor, String contractors) {
        return new ActivityRow(id, briefingId, date, LocalTime.of(8, 0), "Task " + id, null, area, priority,
                labor, contractors, null, NOW, NOW);
    }

    private static ActivityRow rowFrom(long id, ActivityMutation m) {
        return new ActivityRow(id, m.briefingId(), m.date(), m.time(), m.title(), m.description(), m.area(),
                m.priority(), m.laborCount(), m.contractors(), m.assignedTo(), NOW, NOW);
    }
}
