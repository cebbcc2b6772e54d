package com.vuong.pgconnect.core.domain.repository;

import com.vuong.pgconnect.config.LogLevel;
import com.vuong.pgconnect.core.connection.Database;
import com.vuong.pgconnect.config.DatabaseConfig;
import com.vuong.pgconnect.exception.ErrorCode;
import com.vuong.pgconnect.exception.NotFoundException;
import com.vuong.pgconnect.exception.QueryException;
import com.vuong.pgconnect.support.Account;
import com.vuong.pgconnect.support.Country;
import com.vuong.pgconnect.support.NotAnEntity;
import com.vuong.pgconnect.support.TestDatabases;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SimpleGenericRepository Tests")
class SimpleGenericRepositoryTest {

    private Database database;
    private GenericRepository<Account> accounts;
    private GenericRepository<Country> countries;

    @BeforeEach
    void setUp() {
        DatabaseConfig config = TestDatabases.h2Config();
        config.setLogLevel(LogLevel.INFO);
        database = Database.open(config);
        database.autoMigrate(Account.class, Country.class);
        accounts = database.repository(Account.class);
        countries = database.repository(Country.class);
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    @DisplayName("Should populate generated id on create")
    void shouldPopulateGeneratedId() {
        // Given
        Account account = new Account("Ann", "ann@example.com", "active");

        // When
        accounts.create(account);

        // Then
        assertThat(account.getId()).isNotNull();
    }

    @Test
    @DisplayName("Should find created record by id")
    void shouldFindCreatedRecordById() {
        // Given
        Account account = new Account("Ann", "ann@example.com", "active");
        accounts.create(account);

        // When
        Account found = accounts.findById(account.getId());

        // Then
        assertThat(found.getId()).isEqualTo(account.getId());
        assertThat(found.getName()).isEqualTo("Ann");
        assertThat(found.getEmail()).isEqualTo("ann@example.com");
        assertThat(found.getStatus()).isEqualTo("active");
    }

    @Test
    @DisplayName("Should convert loosely typed ids")
    void shouldConvertIds() {
        // Given
        Account account = new Account("Ann", "ann@example.com", "active");
        accounts.create(account);
        int intId = account.getId().intValue();

        // When & Then
        assertThat(accounts.findById(intId).getName()).isEqualTo("Ann");
        assertThat(accounts.findById(String.valueOf(intId)).getName()).isEqualTo("Ann");
    }

    @Test
    @DisplayName("Should throw NotFoundException for unknown id")
    void shouldThrowNotFoundForUnknownId() {
        assertThatThrownBy(() -> accounts.findById(999L))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("999");
    }

    @Test
    @DisplayName("Should find all records")
    void shouldFindAll() {
        // Given
        seed(3, 2);

        // When
        List<Account> all = accounts.findAll();

        // Then
        assertThat(all).hasSize(5);
    }

    @Test
    @DisplayName("Should find records matching filter")
    void shouldFindWhere() {
        // Given
        seed(3, 2);

        // When
        List<Account> active = accounts.findWhere("status = ?", "active");

        // Then
        assertThat(active)
                .hasSize(3)
                .allSatisfy(account -> assertThat(account.getStatus()).isEqualTo("active"));
    }

    @Test
    @DisplayName("Should bind list arguments")
    void shouldBindListArguments() {
        // Given
        seed(3, 2);
        accounts.create(new Account("Locked", "locked@example.com", "locked"));

        // When
        List<Account> found = accounts.findWhere("status in (?)", List.of("inactive", "locked"));

        // Then
        assertThat(found).extracting(Account::getStatus).containsOnly("inactive", "locked").hasSize(3);
    }

    @Test
    @DisplayName("Should bind array arguments as a list")
    void shouldBindArrayArguments() {
        // Given
        seed(3, 2);

        // When
        List<Account> found = accounts.findWhere("status in (?)", (Object) new String[]{"inactive", "locked"});

        // Then
        assertThat(found).hasSize(2);
    }

    @Test
    @DisplayName("Should find first match ordered by primary key")
    void shouldFindOne() {
        // Given
        seed(3, 2);

        // When
        Account first = accounts.findOne("status = ?", "inactive");

        // Then
        assertThat(first.getName()).isEqualTo("account-04");
    }

    @Test
    @DisplayName("Should throw NotFoundException when nothing matches")
    void shouldThrowNotFoundWhenNothingMatches() {
        // Given
        seed(1, 0);

        // When & Then
        assertThatThrownBy(() -> accounts.findOne("email = ?", "nobody@example.com"))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Should update existing record")
    void shouldUpdateExistingRecord() {
        // Given
        Account account = new Account("Ann", "ann@example.com", "active");
        accounts.create(account);
        account.setName("Ann Updated");
        account.setStatus("inactive");

        // When
        accounts.update(account);

        // Then
        Account found = accounts.findById(account.getId());
        assertThat(found.getName()).isEqualTo("Ann Updated");
        assertThat(found.getStatus()).isEqualTo("inactive");
        assertThat(accounts.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should insert when updating a key that does not exist")
    void shouldInsertOnUpdateOfMissingKey() {
        // Given
        Country vietnam = new Country("VN", "Vietnam");

        // When
        countries.update(vietnam);

        // Then
        Country found = countries.findById("VN");
        assertThat(found.getName()).isEqualTo("Vietnam");
    }

    @Test
    @DisplayName("Should insert record without id on update and set the generated id")
    void shouldInsertRecordWithoutId() {
        // Given
        Account account = new Account("Ann", "ann@example.com", "active");

        // When
        Account saved = accounts.update(account);

        // Then
        assertThat(saved.getId()).isNotNull();
        assertThat(account.getId()).isEqualTo(saved.getId());
        assertThat(accounts.findById(saved.getId()).getEmail()).isEqualTo("ann@example.com");
    }

    @Test
    @DisplayName("Should insert under the given key when the generated key does not exist")
    void shouldInsertUnderGivenGeneratedKey() {
        // Given
        Account account = new Account("Ann", "ann@example.com", "active");
        account.setId(999L);

        // When
        Account saved = accounts.update(account);

        // Then
        assertThat(saved.getId()).isEqualTo(999L);
        Account found = accounts.findById(999L);
        assertThat(found.getName()).isEqualTo("Ann");
        assertThat(found.getEmail()).isEqualTo("ann@example.com");
        assertThat(found.getStatus()).isEqualTo("active");
        assertThat(accounts.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should delete record by primary key")
    void shouldDelete() {
        // Given
        Account account = new Account("Ann", "ann@example.com", "active");
        accounts.create(account);

        // When
        accounts.delete(account);

        // Then
        assertThatThrownBy(() -> accounts.findById(account.getId())).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Should ignore delete of missing record")
    void shouldIgnoreDeleteOfMissingRecord() {
        // Given
        Country ghost = new Country("ZZ", "Nowhere");

        // When
        countries.delete(ghost);

        // Then
        assertThat(countries.count()).isZero();
    }

    @Test
    @DisplayName("Should refuse delete without primary key")
    void shouldRefuseDeleteWithoutKey() {
        assertThatThrownBy(() -> accounts.delete(new Account("Ann", "ann@example.com", "active")))
                .isInstanceOf(QueryException.class)
                .hasMessageContaining("without a primary key");
    }

    @Test
    @DisplayName("Should delete matching records in one statement")
    void shouldDeleteWhere() {
        // Given
        seed(3, 2);

        // When
        int deleted = accounts.deleteWhere("status = ?", "inactive");

        // Then
        assertThat(deleted).isEqualTo(2);
        assertThat(accounts.count()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should refuse delete without filter")
    void shouldRefuseDeleteWithoutFilter() {
        // Given
        seed(2, 0);

        // When & Then
        assertThatThrownBy(() -> accounts.deleteWhere(" "))
                .isInstanceOf(QueryException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.INVALID_OPERATION);
        assertThat(accounts.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should count matching records")
    void shouldCountMatching() {
        // Given
        seed(3, 2);

        // When
        long active = accounts.count("status = ?", "active");

        // Then
        assertThat(active).isEqualTo(3);
    }

    @Test
    @DisplayName("Should count all records without filter")
    void shouldCountAll() {
        // Given
        seed(3, 2);

        // When & Then
        assertThat(accounts.count()).isEqualTo(5);
        assertThat(accounts.count(null)).isEqualTo(5);
        assertThat(accounts.count("")).isEqualTo(accounts.findAll().size());
    }

    @Test
    @DisplayName("Should return first and last page of 25 rows")
    void shouldPaginate() {
        // Given
        seed(25, 0);

        // When
        List<Account> first = accounts.paginate(1, 10);
        List<Account> last = accounts.paginate(3, 10);

        // Then
        assertThat(first).extracting(Account::getName)
                .containsExactly("account-01", "account-02", "account-03", "account-04", "account-05",
                        "account-06", "account-07", "account-08", "account-09", "account-10");
        assertThat(last).extracting(Account::getName)
                .containsExactly("account-21", "account-22", "account-23", "account-24", "account-25");
    }

    @Test
    @DisplayName("Should return empty page past the end")
    void shouldReturnEmptyPagePastEnd() {
        // Given
        seed(5, 0);

        // When & Then
        assertThat(accounts.paginate(2, 10)).isEmpty();
    }

    @Test
    @DisplayName("Should read page zero from the first row")
    void shouldReadPageZeroFromFirstRow() {
        // Given
        seed(5, 0);

        // When
        List<Account> page = accounts.paginate(0, 2);

        // Then
        assertThat(page).extracting(Account::getName).containsExactly("account-01", "account-02");
    }

    @Test
    @DisplayName("Should read without limit for negative page size")
    void shouldReadWithoutLimitForNegativeSize() {
        // Given
        seed(5, 0);

        // When & Then
        assertThat(accounts.paginate(1, -1)).hasSize(5);
    }

    @Test
    @DisplayName("Should reject offsets beyond the int range instead of wrapping")
    void shouldRejectOverflowingOffset() {
        // Given
        seed(3, 0);

        // When & Then
        assertThatThrownBy(() -> accounts.paginate(1048577, 4096))
                .isInstanceOf(QueryException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.INVALID_OPERATION);
    }

    @Test
    @DisplayName("Should paginate filtered records")
    void shouldPaginateWhere() {
        // Given
        seed(3, 4);
        List<String> inactive = accounts.findWhere("status = ?", "inactive").stream()
                .map(Account::getName)
                .toList();

        // When
        List<Account> page = accounts.paginateWhere(2, 3, "status = ?", "inactive");

        // Then
        assertThat(page).extracting(Account::getName).containsExactly(inactive.get(3));
    }

    @Test
    @DisplayName("Should report malformed filter as QueryException")
    void shouldReportMalformedFilter() {
        assertThatThrownBy(() -> accounts.findWhere("nosuchfield = ?", "x"))
                .isInstanceOf(QueryException.class)
                .hasMessageStartingWith("findWhere Account failed");
    }

    @Test
    @DisplayName("Should report argument mismatch as QueryException")
    void shouldReportArgumentMismatch() {
        assertThatThrownBy(() -> accounts.count("status = ? and name = ?", "active"))
                .isInstanceOf(QueryException.class);
    }

    @Test
    @DisplayName("Should report unique constraint violation")
    void shouldReportConstraintViolation() {
        // Given
        accounts.create(new Account("Ann", "ann@example.com", "active"));

        // When & Then
        assertThatThrownBy(() -> accounts.create(new Account("Other Ann", "ann@example.com", "active")))
                .isInstanceOf(QueryException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.CONSTRAINT_VIOLATION);
    }

    @Test
    @DisplayName("Should refuse non-entity classes")
    void shouldRefuseNonEntity() {
        assertThatThrownBy(() -> database.repository(NotAnEntity.class))
                .isInstanceOf(QueryException.class)
                .hasMessageContaining("@Entity");
    }

    @Test
    @DisplayName("Should serve concurrent callers through the shared pool")
    void shouldServeConcurrentCallers() throws Exception {
        // Given
        ExecutorService executor = Executors.newFixedThreadPool(4);
        List<Future<?>> futures = new ArrayList<>();

        // When
        try {
            for (int worker = 0; worker < 4; worker++) {
                int offset = worker * 10;
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 10; i++) {
                        int n = offset + i;
                        accounts.create(new Account("user-" + n, "user-" + n + "@example.com", "active"));
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        // Then
        assertThat(accounts.count()).isEqualTo(40);
    }

    private void seed(int active, int inactive) {
        int n = 0;
        for (int i = 0; i < active; i++) {
            n++;
            accounts.create(new Account(name(n), "user" + n + "@example.com", "active"));
        }
        for (int i = 0; i < inactive; i++) {
            n++;
            accounts.create(new Account(name(n), "user" + n + "@example.com", "inactive"));
        }
    }

    private static String name(int n) {
        return String.format("account-%02d", n);
    }
}
