package czm.dabs_be.briefing;

import czm.dabs_be.audit.AuditLogDao;
import czm.dabs_be.audit.AuditLogService;
import czm.dabs_be.contractor.ContractorDao;
import czm.dabs_be.contractor.ContractorStatus;
import czm.dabs_be.web.RequestContext;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BriefingDaoIntegrationTest {

    @Test
    void concurrentGetOrCreateLeavesSingleBriefing() throws Exception {
        Assumptions.assumeTrue(isDockerAvailable(), "Docker is required for the integration test");

        DockerImageName image = DockerImageName.parse("postgres:16-alpine").asCompatibleSubstituteFor("postgres");
        try (PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>(image)) {
            postgres.start();
            JdbcTemplate jdbcTemplate = migratedTemplate(postgres);

            BriefingDao briefingDao = new BriefingDao(jdbcTemplate);
            BriefingService service = new BriefingService(briefingDao, new AuditLogService(new AuditLogDao(jdbcTemplate)));
            RequestContext ctx = new RequestContext(1L, 5L);
            LocalDate day = LocalDate.of(2025, 6, 25);

            assertThat(service.findBriefing(ctx, day)).isEmpty();
            assertThat(count(jdbcTemplate, "SELECT COUNT(*) FROM briefings")).isZero();

            int callers = 8;
            ExecutorService pool = Executors.newFixedThreadPool(callers);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Long>> results = new ArrayList<>();
            try {
                for (int i = 0; i < callers; i++) {
                    results.add(pool.submit(() -> {
                        start.await();
                        return service.getOrCreateBriefing(ctx, day).id();
                    }));
                }
                start.countDown();
                List<Long> ids = new ArrayList<>();
                for (Future<Long> result : results) {
                    ids.add(result.get(30, TimeUnit.SECONDS));
                }
                assertThat(ids).containsOnly(ids.get(0));
            } finally {
                pool.shutdownNow();
            }

            assertThat(count(jdbcTemplate, "SELECT COUNT(*) FROM briefings WHERE project_id = 1 AND date = '2025-06-25'"))
                    .isEqualTo(1);
            assertThat(count(jdbcTemplate, "SELECT COUNT(*) FROM activity_log WHERE action = 'create_briefing'"))
                    .isEqualTo(1);
            assertThat(briefingDao.findByProjectAndDate(2L, day)).isEmpty();
        }
    }

    @Test
    void contractorNamesAreUniqueIgnoringCase() {
        Assumptions.assumeTrue(isDockerAvailable(), "Docker is required for the integration test");

        DockerImageName image = DockerImageName.parse("postgres:16-alpine").asCompatibleSubstituteFor("postgres");
        try (PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>(image)) {
            postgres.start();
            ContractorDao dao = new ContractorDao(migratedTemplate(postgres));

            dao.insert(1L, mutation("Zenith Scaffolding", ContractorStatus.OFFSITE), "5");
            dao.insert(1L, mutation("Acme Electrical", ContractorStatus.ACTIVE), "5");
            dao.insert(1L, mutation("Bolt Ltd", ContractorStatus.STANDBY), "5");
            dao.insert(2L, mutation("ACME ELECTRICAL", ContractorStatus.ACTIVE), "5");

            assertThatThrownBy(() -> dao.insert(1L, mutation("acme electrical", ContractorStatus.ACTIVE), "5"))
                    .isInstanceOf(DuplicateKeyException.class);
            assertThat(dao.findByNameIgnoreCase(1L, "ACME Electrical")).isPresent();
            assertThat(dao.listByProject(1L))
                    .extracting(ContractorDao.ContractorRow::name)
                    .containsExactly("Acme Electrical", "Bolt Ltd", "Zenith Scaffolding");
            assertThat(dao.countActiveNames(1L)).isEqualTo(1L);
        }
    }

    private static ContractorDao.ContractorMutation mutation(String name, ContractorStatus status) {
        return new ContractorDao.ContractorMutation(name, "General", status, "", "", null);
    }

    private static JdbcTemplate migratedTemplate(PostgreSQLContainer<?> postgres) {
        Flyway.configure()
                .dataSource(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword())
                .locations("classpath:db/migration")
                .load()
                .migrate();

        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setDriverClassName("org.postgresql.Driver");
        dataSource.setUrl(postgres.getJdbcUrl());
        dataSource.setUsername(postgres.getUsername());
        dataSource.setPassword(postgres.getPassword());
        return new JdbcTemplate(dataSource);
    }

    private static int count(JdbcTemplate jdbcTemplate, String sql) {
        Integer value = jdbcTemplate.queryForObject(sql, Integer.class);
        return value != null ? value : 0;
    }

    private static boolean isDockerAvailable() {
        try {
            DockerClientFactory.instance().client();
            return true;
        } catch (Throwable ex) {
            return false;
        }
    }
}
