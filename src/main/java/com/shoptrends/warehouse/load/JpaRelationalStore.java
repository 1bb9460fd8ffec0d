package com.shoptrends.warehouse.load;

import com.shoptrends.warehouse.config.LoaderProperties;
import com.shoptrends.warehouse.exception.CommitFailureException;
import com.shoptrends.warehouse.exception.StoreUnavailableException;
import com.shoptrends.warehouse.exception.WarehouseLoadException;
import com.shoptrends.warehouse.repository.CustomerRepository;
import com.shoptrends.warehouse.repository.ItemRepository;
import com.shoptrends.warehouse.repository.PurchaseRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * {@link RelationalStore} backed by Spring Data JPA.
 *
 * <p>Upserts go through {@code saveAll} on entities whose natural keys are
 * already assigned, which Hibernate executes as {@code merge}: an insert for a
 * new key, an update for an existing one. Each call runs in its own
 * {@code REQUIRES_NEW} transaction bounded by
 * {@code warehouse.load.commit-timeout}, so a failed batch rolls back alone
 * and never joins a caller's transaction. Counts run in a read-only
 * transaction with the same timeout, which Spring applies to each query.
 */
@Slf4j
@Repository
public class JpaRelationalStore implements RelationalStore {

    private static final String SCHEMA_SCRIPT = "db/star-schema.sql";

    private final DataSource dataSource;
    private final TransactionTemplate batchTransaction;
    private final TransactionTemplate countTransaction;
    private final PurchaseRepository purchaseRepository;
    private final Map<StarTable, JpaRepository<?, ?>> repositories = new EnumMap<>(StarTable.class);

    public JpaRelationalStore(DataSource dataSource,
                              PlatformTransactionManager transactionManager,
                              LoaderProperties properties,
                              CustomerRepository customerRepository,
                              ItemRepository itemRepository,
                              PurchaseRepository purchaseRepository) {
        int timeoutSeconds = (int) Math.max(1, properties.getCommitTimeout().toSeconds());
        this.dataSource = dataSource;
        this.batchTransaction = new TransactionTemplate(transactionManager);
        this.batchTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.batchTransaction.setTimeout(timeoutSeconds);
        this.countTransaction = new TransactionTemplate(transactionManager);
        this.countTransaction.setReadOnly(true);
        this.countTransaction.setTimeout(timeoutSeconds);
        this.purchaseRepository = purchaseRepository;
        repositories.put(StarTable.CUSTOMER, customerRepository);
        repositories.put(StarTable.ITEM, itemRepository);
        repositories.put(StarTable.PURCHASE, purchaseRepository);
    }

    @Override
    public void createSchemaIfAbsent() {
        try {
            new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_SCRIPT)).execute(dataSource);
            log.info("Star schema ready ({})", SCHEMA_SCRIPT);
        } catch (DataAccessResourceFailureException e) {
            throw new StoreUnavailableException("Cannot reach the warehouse to create the schema", e);
        } catch (DataAccessException e) {
            throw new WarehouseLoadException("Failed to create the star schema: " + e.getMessage(), e);
        }
    }

    @Override
    public int upsertRows(StarTable table, List<?> rows) {
        if (rows.isEmpty()) {
            return 0;
        }
        List<Object> batch = new ArrayList<>(rows.size());
        for (Object row : rows) {
            if (!table.getRowType().isInstance(row)) {
                throw new IllegalArgumentException(table.getTableName() + " cannot store "
                    + (row == null ? "null" : row.getClass().getSimpleName()));
            }
            batch.add(row);
        }

        JpaRepository<Object, ?> repository = repositoryFor(table);
        try {
            batchTransaction.executeWithoutResult(status -> repository.saveAll(batch));
        } catch (CannotCreateTransactionException | DataAccessResourceFailureException e) {
            throw new StoreUnavailableException("Cannot reach the warehouse to write " + table.getTableName(), e);
        } catch (DataAccessException | TransactionException e) {
            throw new CommitFailureException(table, batch.size(), e);
        }
        log.debug("Committed {} rows into {}", batch.size(), table.getTableName());
        return batch.size();
    }

    @Override
    public long rowCount(StarTable table) {
        return count("rows of " + table.getTableName(), () -> repositoryFor(table).count());
    }

    @Override
    public long orphanedFactCount() {
        return count("orphaned facts", () ->
            purchaseRepository.countWithoutCustomer() + purchaseRepository.countWithoutItem());
    }

    private long count(String what, LongSupplier query) {
        try {
            Long count = countTransaction.execute(status -> query.getAsLong());
            return count == null ? 0 : count;
        } catch (DataAccessException | TransactionException e) {
            throw new StoreUnavailableException("Cannot count " + what, e);
        }
    }

    @SuppressWarnings("unchecked")
    private JpaRepository<Object, ?> repositoryFor(StarTable table) {
        return (JpaRepository<Object, ?>) repositories.get(table);
    }
}
