package czm.dabs_be.stats;

import czm.dabs_be.activity.ActivityInputNormalizer;
import czm.dabs_be.activity.ContractorIdCodec;
import czm.dabs_be.briefing.BriefingDao.BriefingRow;
import czm.dabs_be.briefing.BriefingService;
import czm.dabs_be.config.DabsProperties;
import czm.dabs_be.contractor.ContractorDescriptor;
import czm.dabs_be.contractor.ContractorLookup;
import czm.dabs_be.contractor.ContractorResolver;
import czm.dabs_be.contractor.ContractorService;
import czm.dabs_be.stats.ResourceStatsRepository.AreaUsageRow;
import czm.dabs_be.stats.ResourceStatsRepository.StatActivityRow;
import czm.dabs_be.web.ApiException;
import czm.dabs_be.web.RequestContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Stateless labor and activity statistics over a project's briefings.
 *
 * <p>A contractor assigned to an activity is credited with the activity's whole labor count. Nothing is
 * split between contractors sharing an activity, so contractor figures may add up to more than the
 * period total.</p>
 */
@Service
public class ResourceStatsService {
    private static final Logger log = LoggerFactory.getLogger(ResourceStatsService.class);

    static final String UNASSIGNED = "Unassigned";

    private final ResourceStatsRepository repository;
    private final BriefingService briefings;
    private final ContractorService contractors;
    private final ContractorResolver resolver;
    private final ContractorIdCodec codec;
    private final ActivityInputNormalizer normalizer;
    private final DabsProperties properties;

    public ResourceStatsService(ResourceStatsRepository repository,
                                BriefingService briefings,
                                ContractorService contractors,
                                ContractorResolver resolver,
                                ContractorIdCodec codec,
                                ActivityInputNormalizer normalizer,
                                DabsProperties properties) {
        this.repository = repository;
        this.briefings = briefings;
        this.contractors = contractors;
        this.resolver = resolver;
        this.codec = codec;
        this.normalizer = normalizer;
        this.properties = properties;
    }

    public record AreaLabor(String area, int laborCount, int activityCount) {}

    public record ContractorLabor(long contractorId, String name, String trade, int laborCount, int activityCount) {}

    public record DailyTotals(LocalDate date,
                              Long briefingId,
                              int totalLabor,
                              int totalActivities,
                              int totalUniqueContractors,
                              long activeContractors,
                              List<AreaLabor> byArea,
                              List<ContractorLabor> byContractor) {}

    public record DayPoint(LocalDate date, int laborCount, int activityCount) {}

    public record ContractorAttribution(LocalDate date,
                                        long contractorId,
                                        String contractorName,
                                        String area,
                                        int laborCount,
                                        String activityTitle) {}

    public record AreaDay(LocalDate date, String area, int laborCount, int activityCount) {}

    public record Totals(int totalLabor, int totalActivities, int totalAreas, int totalDays) {}

    public record ContractorSummary(long contractorId,
                                    String name,
                                    String trade,
                                    String status,
                                    int totalAssignments,
                                    int daysWorked,
                                    List<String> areasWorked) {}

    public record AreaSummary(String area, int totalLabor, int totalActivities, int daysActive) {}

    public record PeriodSummary(BigDecimal laborPerDay, BigDecimal activitiesPerDay) {}

    public record RangeTotals(LocalDate start,
                              LocalDate end,
                              List<DayPoint> dailySeries,
                              List<ContractorAttribution> contractorBreakdown,
                              List<AreaDay> areaBreakdown,
                              Totals totals,
                              List<ContractorSummary> contractorSummary,
                              List<AreaSummary> areaSummary,
                              PeriodSummary periodSummary) {

        static RangeTotals empty(LocalDate start, LocalDate end) {
            return new RangeTotals(start, end, List.of(), List.of(), List.of(), new Totals(0, 0, 0, 0),
                    List.of(), List.of(), new PeriodSummary(BigDecimal.ZERO, BigDecimal.ZERO));
        }
    }

    public record ContractorDay(LocalDate date, Map<String, Integer> workers) {}

    public record UsageSummary(String mostActiveArea, long totalActivities, long totalLabor) {}

    public record AreaUsage(List<AreaUsageRow> areas, UsageSummary summary) {}

    /**
     * Totals for one day. A day without a briefing yields zeros, not an error.
     */
    public DailyTotals dailyTotals(RequestContext ctx, String rawDate) {
        LocalDate date = normalizer.date(rawDate);
        long activeContractors = contractors.countActiveContractors(ctx.projectId());
        Optional<BriefingRow> briefing = briefings.findBriefing(ctx, date);
        if (briefing.isEmpty()) {
            return new DailyTotals(date, null, 0, 0, 0, activeContractors, List.of(), List.of());
        }
        List<StatActivityRow> rows = repository.listActivities(ctx.projectId(), date, date);
        ContractorLookup lookup = resolver.lookupFor(ctx.projectId());

        int totalLabor = 0;
        Map<String, int[]> byArea = new TreeMap<>();
        Map<Long, int[]> byContractor = new LinkedHashMap<>();
        Set<String> uniqueNames = new HashSet<>();
        for (StatActivityRow row : rows) {
            totalLabor += row.laborCount();
            if (hasArea(row.area())) {
                int[] area = byArea.computeIfAbsent(row.area(), key -> new int[2]);
                area[0] += row.laborCount();
                area[1]++;
            }
            for (ContractorDescriptor contractor : resolver.resolve(codec.decode(row.contractors()), lookup)) {
                int[] sums = byContractor.computeIfAbsent(contractor.id(), key -> new int[2]);
                sums[0] += row.laborCount();
                sums[1]++;
                uniqueNames.add(lookup.names().get(contractor.id()));
            }
        }
        List<AreaLabor> areas = new ArrayList<>();
        byArea.forEach((area, sums) -> areas.add(new AreaLabor(area, sums[0], sums[1])));
        areas.sort(Comparator.comparingInt(AreaLabor::laborCount).reversed().thenComparing(AreaLabor::area));

        List<ContractorLabor> contractorLabor = new ArrayList<>();
        byContractor.forEach((id, sums) -> contractorLabor.add(new ContractorLabor(
                id, lookup.names().get(id), lookup.trades().get(id), sums[0], sums[1])));
        contractorLabor.sort(Comparator.comparingInt(ContractorLabor::laborCount).reversed()
                .thenComparing(ContractorLabor::name));

        return new DailyTotals(date, briefing.get().id(), totalLabor, rows.size(), uniqueNames.size(),
                activeContractors, List.copyOf(areas), List.copyOf(contractorLabor));
    }

    /**
     * Range statistics with the week containing today as default bounds.
     */
    public RangeTotals rangeTotals(RequestContext ctx, String rawStart, String rawEnd) {
        LocalDate today = normalizer.today();
        LocalDate start = isBlank(rawStart)
                ? today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
                : normalizer.date(rawStart);
        LocalDate end = isBlank(rawEnd)
                ? today.with(TemporalAdjusters.nextOrSame(DayOfWeek.SUNDAY))
                : normalizer.date(rawEnd);
        return rangeTotals(ctx, start, end);
    }

    /**
     * Statistics for the inclusive range. An inverted range is empty, not an error.
     */
    public RangeTotals rangeTotals(RequestContext ctx, LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            throw ApiException.validation("Both range bounds are required.", "range_bounds_required");
        }
        if (end.isBefore(start)) {
            return RangeTotals.empty(start, end);
        }
        List<StatActivityRow> rows = repository.listActivities(ctx.projectId(), start, end);
        List<LocalDate> briefingDates = repository.listBriefingDates(ctx.projectId(), start, end);
        ContractorLookup lookup = resolver.lookupFor(ctx.projectId());

        Map<LocalDate, int[]> perDay = new LinkedHashMap<>();
        for (LocalDate day = start; !day.isAfter(end); day = day.plusDays(1)) {
            perDay.put(day, new int[2]);
        }
        List<ContractorAttribution> attributions = new ArrayList<>();
        Map<String, AreaDayAccumulator> areaDays = new LinkedHashMap<>();
        Map<String, AreaAccumulator> areas = new TreeMap<>();
        Map<Long, ContractorAccumulator> contractorTotals = new LinkedHashMap<>();
        int totalLabor = 0;

        for (StatActivityRow row : rows) {
            totalLabor += row.laborCount();
            int[] day = perDay.get(row.date());
            day[0] += row.laborCount();
            day[1]++;

            if (hasArea(row.area())) {
                areaDays.computeIfAbsent(row.date() + "|" + row.area(),
                        key -> new AreaDayAccumulator(row.date(), row.area())).add(row.laborCount());
                areas.computeIfAbsent(row.area(), AreaAccumulator::new).add(row);
            }

            for (ContractorDescriptor contractor : resolver.resolve(codec.decode(row.contractors()), lookup)) {
                attributions.add(new ContractorAttribution(row.date(), contractor.id(),
                        lookup.names().get(contractor.id()), row.area(), row.laborCount(), row.title()));
                contractorTotals.computeIfAbsent(contractor.id(), key -> new ContractorAccumulator(contractor))
                        .add(row);
            }
        }

        List<DayPoint> series = new ArrayList<>(perDay.size());
        perDay.forEach((date, sums) -> series.add(new DayPoint(date, sums[0], sums[1])));

        int totalDays = new TreeSet<>(briefingDates).size();
        Totals totals = new Totals(totalLabor, rows.size(), areas.size(), totalDays);

        List<ContractorSummary> contractorSummary = contractorTotals.values().stream()
                .map(acc -> acc.toSummary(lookup))
                .sorted(Comparator.comparing(ContractorSummary::name))
                .toList();

        log.debug("Range stats for project {} {}..{}: {} activities, {} attributions",
                ctx.projectId(), start, end, rows.size(), attributions.size());
        return new RangeTotals(
                start,
                end,
                List.copyOf(series),
                List.copyOf(attributions),
                areaDays.values().stream().map(AreaDayAccumulator::toAreaDay).toList(),
                totals,
                contractorSummary,
                areas.values().stream().map(AreaAccumulator::toSummary).toList(),
                new PeriodSummary(ratePerDay(totalLabor, totalDays), ratePerDay(rows.size(), totalDays)));
    }

    /**
     * Monday to Sunday week containing the date.
     */
    public RangeTotals weekTotals(RequestContext ctx, String rawDate) {
        LocalDate date = normalizer.date(rawDate);
        LocalDate monday = date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        return rangeTotals(ctx, monday, monday.plusDays(6));
    }

    /**
     * Workers per assignee for each day of the window ending at the given date, oldest first.
     */
    public List<ContractorDay> rollingContractorDaily(RequestContext ctx, String rawEnd, Integer window) {
        int size = window != null ? window : properties.getRollingWindowDays();
        if (size < 1 || size > properties.getMaxWindowDays()) {
            throw ApiException.validation(
                    "Window must be between 1 and " + properties.getMaxWindowDays() + " days.", "window_invalid");
        }
        LocalDate end = normalizer.date(rawEnd);
        LocalDate start = end.minusDays(size - 1L);
        Map<LocalDate, Map<String, Integer>> days = new LinkedHashMap<>();
        for (LocalDate day = start; !day.isAfter(end); day = day.plusDays(1)) {
            days.put(day, new LinkedHashMap<>());
        }
        for (StatActivityRow row : repository.listActivities(ctx.projectId(), start, end)) {
            String assignee = isBlank(row.assignedTo()) ? UNASSIGNED : row.assignedTo();
            days.get(row.date()).merge(assignee, row.laborCount(), Integer::sum);
        }
        List<ContractorDay> result = new ArrayList<>(days.size());
        days.forEach((date, workers) -> result.add(new ContractorDay(date, Map.copyOf(workers))));
        return result;
    }

    public AreaUsage areaUsageStats(RequestContext ctx) {
        List<AreaUsageRow> areas = repository.listAreaUsage(ctx.projectId());
        long activities = areas.stream().mapToLong(AreaUsageRow::activityCount).sum();
        long labor = areas.stream().mapToLong(AreaUsageRow::totalLabor).sum();
        String mostActive = areas.isEmpty() ? null : areas.get(0).area();
        return new AreaUsage(areas, new UsageSummary(mostActive, activities, labor));
    }

    static BigDecimal ratePerDay(long amount, int days) {
        if (days <= 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(amount).divide(BigDecimal.valueOf(days), 2, RoundingMode.HALF_UP);
    }

    private static boolean hasArea(String area) {
        return area != null && !area.isBlank();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static final class AreaDayAccumulator {
        private final LocalDate date;
        private final String area;
        private int labor;
        private int activities;

        AreaDayAccumulator(LocalDate date, String area) {
            this.date = date;
            this.area = area;
        }

        void add(int laborCount) {
            labor += laborCount;
            activities++;
        }

        AreaDay toAreaDay() {
            return new AreaDay(date, area, labor, activities);
        }
    }

    private static final class AreaAccumulator {
        private final String area;
        private final Set<LocalDate> days = new HashSet<>();
        private int labor;
        private int activities;

        AreaAccumulator(String area) {
            this.area = area;
        }

        void add(StatActivityRow row) {
            labor += row.laborCount();
            activities++;
            days.add(row.date());
        }

        AreaSummary toSummary() {
            return new AreaSummary(area, labor, activities, days.size());
        }
    }

    private static final class ContractorAccumulator {
        private final ContractorDescriptor contractor;
        private final Set<LocalDate> days = new HashSet<>();
        private final Set<String> areas = new LinkedHashSet<>();
        private int assignments;

        ContractorAccumulator(ContractorDescriptor contractor) {
            this.contractor = contractor;
        }

        void add(StatActivityRow row) {
            assignments++;
            days.add(row.date());
            if (hasArea(row.area())) {
                areas.add(row.area());
            }
        }

        ContractorSummary toSummary(ContractorLookup lookup) {
            return new ContractorSummary(
                    contractor.id(),
                    lookup.names().get(contractor.id()),
                    lookup.trades().get(contractor.id()),
                    contractor.status(),
                    assignments,
                    days.size(),
                    List.copyOf(areas));
        }
    }
}
